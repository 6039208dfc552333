package com.example.posematch_backend.exception;

/**
 * Base failure of an analysis run. The {@link #getCode() code} is a stable identifier such as
 * {@code SHORT_VIDEO_TOO_LONG}; the message is meant for humans.
 */
public class AnalysisException extends RuntimeException {
    private final ErrorKind kind;
    private final String code;

    public AnalysisException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public AnalysisException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
