package com.example.posematch_backend.dto.web;

public record AnalysisResponse(
        String runId,
        int targetFrames,
        double similarityScore,
        String analysisText,
        double averageDissimilarity,
        int mismatchedFrames
) {
}
