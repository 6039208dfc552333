package com.example.posematch_backend.dto;

/**
 * Stream metadata of one source clip. Duration may be 0 for containers that do not report it.
 */
public record MediaMetadata(double durationSeconds, int width, int height, double fps) {

    /** Shortest duration that still prints as non-zero in the six-decimal ffmpeg fps filter. */
    public static final double MIN_SAMPLABLE_DURATION_SECONDS = 0.000001;

    /** True when duration and frame rate allow uniform time-based sampling. */
    public boolean isTimeSamplable() {
        return durationSeconds >= MIN_SAMPLABLE_DURATION_SECONDS && fps > 0;
    }
}
