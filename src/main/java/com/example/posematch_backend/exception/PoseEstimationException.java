package com.example.posematch_backend.exception;

public class PoseEstimationException extends AnalysisException {

    public PoseEstimationException(String message) {
        super(ErrorKind.EXTERNAL_TOOL, "POSE_ENGINE_FAILED", message);
    }

    public PoseEstimationException(String message, Throwable cause) {
        super(ErrorKind.EXTERNAL_TOOL, "POSE_ENGINE_FAILED", message, cause);
    }
}
