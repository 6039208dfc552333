package com.example.posematch_backend.dto;

import com.example.posematch_backend.exception.WorkspaceException;

import java.nio.file.Path;

/**
 * Scratch directory exclusively owned by one analysis run.
 */
public record RunWorkspace(String runId, Path root) {

    public Path resolve(String child) {
        if (child == null || child.isBlank()) {
            throw new WorkspaceException("workspace child name is blank", null);
        }
        Path p = root.resolve(child).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new WorkspaceException("Invalid workspace path (path traversal?): " + child, null);
        }
        return p;
    }
}
