package com.example.posematch_backend.service;

import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores uploaded clips under the uploads root with generated names. The stored copies belong to the run that
 * consumes them and are deleted during its cleanup.
 */
@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

    private final WorkspaceService workspaceService;

    public UploadService(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    public record StoredPair(Path shortVideo, Path referenceVideo) {
    }

    /**
     * Stores both clips. When the second copy fails the first one is removed again.
     */
    public StoredPair storePair(MultipartFile shortVideo, MultipartFile referenceVideo) {
        requirePresent(shortVideo, "short_video");
        requirePresent(referenceVideo, "reference_video");

        Path shortPath = store(shortVideo, "short");
        try {
            Path referencePath = store(referenceVideo, "reference");
            return new StoredPair(shortPath, referencePath);
        } catch (RuntimeException e) {
            workspaceService.deleteFile(shortPath);
            throw e;
        }
    }

    Path store(MultipartFile file, String role) {
        Path target = workspaceService.uploadsRoot()
                .resolve(role + "-" + UUID.randomUUID() + extensionOf(file.getOriginalFilename()));
        try {
            file.transferTo(target);
            LOGGER.debug("upload stored role={} name={} bytes={} path={}", role, file.getOriginalFilename(), file.getSize(), target);
            return target;
        } catch (IOException | IllegalStateException e) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new AnalysisException(ErrorKind.RESOURCE, "UPLOAD_FAILED",
                    "Could not store " + role + " upload: " + e.getMessage(), e);
        }
    }

    private static void requirePresent(MultipartFile file, String field) {
        if (file == null || file.isEmpty()) {
            throw new AnalysisException(ErrorKind.VALIDATION, "FILE_MISSING", "Missing or empty upload: " + field);
        }
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return ".bin";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return ".bin";
        }
        String ext = filename.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,8}") ? ext : ".bin";
    }
}
