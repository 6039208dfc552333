package com.example.posematch_backend.exception;

public class SampleException extends AnalysisException {

    public enum Reason {
        INVALID_TARGET_COUNT(ErrorKind.VALIDATION),
        SOURCE_NOT_FOUND(ErrorKind.VALIDATION),
        NO_FRAMES_PRODUCED(ErrorKind.INTEGRITY),
        EXTRACTION_FAILED(ErrorKind.EXTERNAL_TOOL),
        EXTRACTION_CANCELLED(ErrorKind.CANCELLED);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;

    public SampleException(Reason reason, String message) {
        this(reason, message, null);
    }

    public SampleException(Reason reason, String message, Throwable cause) {
        super(reason.kind, reason.name(), message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
