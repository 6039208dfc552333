package com.example.posematch_backend.exception;

public class ProbeException extends AnalysisException {

    public enum Reason {
        SOURCE_NOT_FOUND(ErrorKind.VALIDATION),
        NO_VIDEO_STREAM(ErrorKind.VALIDATION),
        PROBE_FAILED(ErrorKind.EXTERNAL_TOOL);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;

    public ProbeException(Reason reason, String message) {
        this(reason, message, null);
    }

    public ProbeException(Reason reason, String message, Throwable cause) {
        super(reason.kind, reason.name(), message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
