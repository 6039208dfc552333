package com.example.posematch_backend.dto;

import java.nio.file.Path;

/**
 * @param sourcesOwned when true both source files are uploaded copies and are deleted when the run ends
 */
public record AnalysisRequest(
        Path shortVideo,
        Path referenceVideo,
        int targetFrames,
        double maxShortDurationSeconds,
        boolean sourcesOwned
) {
}
