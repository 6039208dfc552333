package com.example.posematch_backend.dto;

import java.nio.file.Path;
import java.util.List;

/**
 * Exactly {@code targetFrames} frame images of one clip in temporal order.
 *
 * @param directory      directory the extractor wrote into
 * @param frames         frame paths; padded entries repeat the last extracted path
 * @param extractedCount number of frames the extractor actually produced
 */
public record FrameSet(Path directory, List<Path> frames, int extractedCount) {

    public FrameSet {
        frames = List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    public Path get(int index) {
        return frames.get(index);
    }
}
