package com.example.posematch_backend.engine.Interfaces;

import com.example.posematch_backend.dto.FrameSet;
import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.exception.SampleException;

import java.nio.file.Path;

public interface FrameSampler {

    /**
     * Extracts exactly {@code targetFrames} frames spread uniformly over the clip.
     *
     * @param videoPath    source clip.
     * @param targetFrames number of frames the result must contain, &gt; 0.
     * @param metadata     probed metadata of {@code videoPath}.
     * @param outputDir    directory to create and write frames into; removed again if sampling fails.
     * @throws SampleException on invalid input, extractor failure or when no frame could be extracted.
     */
    FrameSet sample(Path videoPath, int targetFrames, MediaMetadata metadata, Path outputDir);
}
