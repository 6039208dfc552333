package com.example.posematch_backend.engine.Interfaces;

import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.exception.ProbeException;

import java.nio.file.Path;

public interface MetadataProbe {

    /**
     * Reads duration, raster size and frame rate of the first video stream.
     *
     * @throws ProbeException when the file has no usable video stream or the probe tool fails.
     */
    MediaMetadata probe(Path path);
}
