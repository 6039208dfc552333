package com.example.posematch_backend.dto;

import java.util.List;

/**
 * Per-frame landmarks of one video, index-aligned with the {@link FrameSet} they were estimated from.
 */
public record LandmarkSequence(List<LandmarkSet> frames) {

    public LandmarkSequence {
        frames = List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    public LandmarkSet get(int index) {
        return frames.get(index);
    }

    public long detectedCount() {
        return frames.stream().filter(LandmarkSet::isPresent).count();
    }
}
