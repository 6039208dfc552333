package com.example.posematch_backend.service;

import com.example.posematch_backend.dto.RunWorkspace;
import com.example.posematch_backend.exception.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Allocates one scratch directory per run under a shared root and removes it again.
 * The root only ever gains new uniquely named children.
 */
public class WorkspaceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceService.class);

    private final Path runsRoot;
    private final Path uploadsRoot;

    public WorkspaceService(Path runsRoot, Path uploadsRoot) {
        this.runsRoot = runsRoot.toAbsolutePath().normalize();
        this.uploadsRoot = uploadsRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.runsRoot);
            Files.createDirectories(this.uploadsRoot);
            LOGGER.info("WorkspaceService ready. runs={}, uploads={}", this.runsRoot, this.uploadsRoot);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace directories", e);
        }
    }

    public RunWorkspace allocate() {
        return allocate(UUID.randomUUID().toString());
    }

    /**
     * Creates {@code run-<runId>} under the runs root. Fails when the directory already exists.
     */
    public RunWorkspace allocate(String runId) {
        if (runId == null || runId.isBlank() || !runId.matches("[A-Za-z0-9-]+")) {
            throw new WorkspaceException("Invalid run id: " + runId, null);
        }
        Path root = runsRoot.resolve("run-" + runId);
        try {
            Files.createDirectory(root);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace for run " + runId + ": " + e.getMessage(), e);
        }
        LOGGER.debug("workspace allocated run={} dir={}", runId, root);
        return new RunWorkspace(runId, root);
    }

    /**
     * Removes the workspace and everything in it. Individual delete failures are logged and returned, never thrown.
     *
     * @return one entry per path that could not be removed; empty when the workspace is gone.
     */
    public List<String> reclaim(RunWorkspace workspace) {
        if (workspace == null) {
            return List.of();
        }
        Path root = workspace.root();
        if (!root.startsWith(runsRoot) || root.equals(runsRoot)) {
            String issue = "Refusing to delete path outside workspace root: " + root;
            LOGGER.error(issue);
            return List.of(issue);
        }
        return deleteRecursively(root);
    }

    /**
     * Deletes a single file, typically an uploaded source copy.
     *
     * @return a description of the problem, or {@code null} when the file is gone.
     */
    public String deleteFile(Path file) {
        if (file == null) {
            return null;
        }
        try {
            Files.deleteIfExists(file);
            return null;
        } catch (IOException e) {
            LOGGER.warn("Cleanup delete failed path={} err={}", file, e.toString());
            return "Could not delete " + file + ": " + e.getMessage();
        }
    }

    public Path uploadsRoot() {
        return uploadsRoot;
    }

    public Path runsRoot() {
        return runsRoot;
    }

    private List<String> deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return List.of();
        }
        List<String> issues = new ArrayList<>();
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warn("Cleanup walk failed path={} err={}", root, e.toString());
            return List.of("Could not list " + root + ": " + e.getMessage());
        }
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                LOGGER.warn("Cleanup delete failed path={} err={}", p, e.toString());
                issues.add("Could not delete " + p + ": " + e.getMessage());
            }
        }
        return issues;
    }
}
