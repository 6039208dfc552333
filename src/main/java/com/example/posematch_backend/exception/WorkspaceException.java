package com.example.posematch_backend.exception;

public class WorkspaceException extends AnalysisException {

    public WorkspaceException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE, "WORKSPACE_UNAVAILABLE", message, cause);
    }
}
