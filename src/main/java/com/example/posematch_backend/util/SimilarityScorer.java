package com.example.posematch_backend.util;

import com.example.posematch_backend.dto.LandmarkPoint;
import com.example.posematch_backend.dto.LandmarkSequence;
import com.example.posematch_backend.dto.LandmarkSet;
import com.example.posematch_backend.dto.SimilarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Turns two index-aligned landmark sequences into a 0..100 similarity score.
 * <p>
 * Each frame gets a dissimilarity: the mean Euclidean distance between corresponding landmarks when both poses
 * are present, {@value #MAX_DISSIMILARITY} when only one side has a pose or the data is malformed, and
 * {@value #BOTH_ABSENT_DISSIMILARITY} when neither has one. The mean over all frames is mapped linearly so that
 * {@value #NORMALIZATION_CAP} or more scores 0.
 * <p>
 * Landmark visibility is not used.
 */
@Component
public class SimilarityScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimilarityScorer.class);

    /** Average dissimilarity (normalized units) that maps to a score of 0. */
    public static final double NORMALIZATION_CAP = 0.5;
    public static final double BOTH_ABSENT_DISSIMILARITY = 0.1;
    public static final double MAX_DISSIMILARITY = 1.0;

    public SimilarityResult score(LandmarkSequence sequenceA, LandmarkSequence sequenceB, int targetFrames) {
        int sizeA = sequenceA == null ? 0 : sequenceA.size();
        int sizeB = sequenceB == null ? 0 : sequenceB.size();
        if (sequenceA == null || sequenceB == null || sizeA != targetFrames || sizeB != targetFrames) {
            String errorMsg = "Input landmark arrays length mismatch. Expected " + targetFrames
                    + ", got " + sizeA + " and " + sizeB + ".";
            LOGGER.error(errorMsg);
            return SimilarityResult.failed("Error: Landmark data length mismatch. " + errorMsg);
        }
        if (targetFrames <= 0) {
            return SimilarityResult.failed("No frames to compare.");
        }

        double total = 0;
        int mismatchedFrames = 0;
        int malformedFrames = 0;

        for (int i = 0; i < targetFrames; i++) {
            LandmarkSet a = orAbsent(sequenceA.get(i));
            LandmarkSet b = orAbsent(sequenceB.get(i));

            if (a.isPresent() && b.isPresent()) {
                if (!a.isComplete() || !b.isComplete()) {
                    LOGGER.warn("Frame {}: unexpected number of landmarks a={} b={}", i, a.size(), b.size());
                    malformedFrames++;
                    total += MAX_DISSIMILARITY;
                } else {
                    total += frameDissimilarity(a.points(), b.points());
                }
            } else if (a.isPresent() || b.isPresent()) {
                mismatchedFrames++;
                total += MAX_DISSIMILARITY;
            } else {
                total += BOTH_ABSENT_DISSIMILARITY;
            }
        }

        double avg = total / targetFrames;
        double score = toScore(avg);

        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "Overall similarity: %.1f%%. ", score));
        text.append(String.format(Locale.ROOT, "Average dissimilarity per frame: %.3f (lower is better). ", avg));
        if (mismatchedFrames > 0) {
            text.append(mismatchedFrames).append(" frame(s) had one pose missing. ");
        }
        if (malformedFrames > 0) {
            text.append(malformedFrames).append(" frame(s) had malformed landmark data. ");
        }
        return new SimilarityResult(score, text.toString(), avg, mismatchedFrames, malformedFrames);
    }

    static double frameDissimilarity(List<LandmarkPoint> a, List<LandmarkPoint> b) {
        double sum = 0;
        int compared = 0;
        for (int j = 0; j < LandmarkSet.POSE_LANDMARK_COUNT; j++) {
            LandmarkPoint pa = a.get(j);
            LandmarkPoint pb = b.get(j);
            if (pa == null || pb == null) {
                continue;
            }
            sum += pa.distanceTo(pb);
            compared++;
        }
        return compared > 0 ? sum / compared : MAX_DISSIMILARITY;
    }

    static double toScore(double avgDissimilarity) {
        double normalized = 1 - avgDissimilarity / NORMALIZATION_CAP;
        double clamped = Math.max(0, Math.min(1, normalized));
        return BigDecimal.valueOf(clamped * 100).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static LandmarkSet orAbsent(LandmarkSet set) {
        return set == null ? LandmarkSet.ABSENT : set;
    }
}
