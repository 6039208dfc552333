package com.example.posematch_backend.dto;

import java.util.List;
import java.util.Objects;

/**
 * Pose landmarks detected in a single frame, or {@link #ABSENT} when no pose was found.
 */
public final class LandmarkSet {
    public static final int POSE_LANDMARK_COUNT = 33;

    public static final LandmarkSet ABSENT = new LandmarkSet(null);

    private final List<LandmarkPoint> points;

    private LandmarkSet(List<LandmarkPoint> points) {
        this.points = points;
    }

    public static LandmarkSet of(List<LandmarkPoint> points) {
        Objects.requireNonNull(points, "points");
        return new LandmarkSet(List.copyOf(points));
    }

    public boolean isPresent() {
        return points != null;
    }

    /** Present and carrying exactly {@value #POSE_LANDMARK_COUNT} points. */
    public boolean isComplete() {
        return points != null && points.size() == POSE_LANDMARK_COUNT;
    }

    public List<LandmarkPoint> points() {
        if (points == null) {
            throw new IllegalStateException("no pose detected in this frame");
        }
        return points;
    }

    public int size() {
        return points == null ? 0 : points.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LandmarkSet other)) return false;
        return Objects.equals(points, other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(points);
    }

    @Override
    public String toString() {
        return points == null ? "LandmarkSet[ABSENT]" : "LandmarkSet[" + points.size() + " points]";
    }
}
