package com.example.posematch_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Subset of {@code ffprobe -print_format json -show_streams -show_format}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FfprobeOutput(List<Stream> streams, Format format) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Stream(
            @JsonProperty("codec_type") String codecType,
            Integer width,
            Integer height,
            String duration,
            @JsonProperty("r_frame_rate") String rFrameRate,
            @JsonProperty("avg_frame_rate") String avgFrameRate
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Format(String duration) {}
}
