package com.example.posematch_backend.exception;

/**
 * Stable classification of a failed analysis run, exposed to callers so a retry policy can be layered on top.
 */
public enum ErrorKind {
    /** Bad input the caller can correct. Never retried. */
    VALIDATION,
    /** ffprobe, ffmpeg or the pose sidecar failed. Possibly transient. */
    EXTERNAL_TOOL,
    /** A pipeline invariant was broken (no frames, misaligned sequences). */
    INTEGRITY,
    /** Workspace or upload storage could not be created. */
    RESOURCE,
    /** Run timed out or was aborted by the caller. */
    CANCELLED,
    INTERNAL
}
