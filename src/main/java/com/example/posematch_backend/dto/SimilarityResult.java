package com.example.posematch_backend.dto;

public record SimilarityResult(
        double score,
        String analysisText,
        double averageDissimilarity,
        int mismatchedFrames,
        int malformedFrames
) {
    public static SimilarityResult failed(String analysisText) {
        return new SimilarityResult(0, analysisText, Double.NaN, 0, 0);
    }
}
