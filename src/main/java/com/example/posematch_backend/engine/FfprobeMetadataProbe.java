package com.example.posematch_backend.engine;

import com.example.posematch_backend.dto.FfprobeOutput;
import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.engine.Interfaces.MetadataProbe;
import com.example.posematch_backend.exception.ProbeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public class FfprobeMetadataProbe implements MetadataProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMetadataProbe.class);

    static final double DEFAULT_FPS = 30.0;
    private static final int LOG_SNIPPET_MAX = 2_000;

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final String ffprobeBin;
    private final Duration timeout;

    public FfprobeMetadataProbe(ProcessRunner processRunner, ObjectMapper objectMapper, String ffprobeBin, Duration timeout) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.ffprobeBin = (ffprobeBin == null || ffprobeBin.isBlank()) ? "ffprobe" : ffprobeBin;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
    }

    @Override
    public MediaMetadata probe(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ProbeException(ProbeException.Reason.SOURCE_NOT_FOUND, "Video file not found: " + path);
        }
        List<String> cmd = List.of(
                ffprobeBin,
                "-v", "error",
                "-print_format", "json",
                "-show_streams",
                "-show_format",
                path.toAbsolutePath().toString()
        );

        ProcessRunner.ProcessResult result;
        try {
            result = processRunner.run(cmd, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException(ProbeException.Reason.PROBE_FAILED, "ffprobe interrupted for " + path.getFileName(), e);
        } catch (IOException e) {
            throw new ProbeException(ProbeException.Reason.PROBE_FAILED, "ffprobe could not be started: " + e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new ProbeException(ProbeException.Reason.PROBE_FAILED, "ffprobe timed out after " + timeout + " for " + path.getFileName());
        }
        if (result.code() != 0) {
            throw new ProbeException(ProbeException.Reason.PROBE_FAILED,
                    "ffprobe exit=" + result.code() + " log=" + ProcessRunner.truncate(result.output(), LOG_SNIPPET_MAX));
        }

        FfprobeOutput parsed;
        try {
            parsed = objectMapper.readValue(result.output(), FfprobeOutput.class);
        } catch (JsonProcessingException e) {
            throw new ProbeException(ProbeException.Reason.PROBE_FAILED,
                    "ffprobe output is not valid JSON: " + ProcessRunner.truncate(result.output(), LOG_SNIPPET_MAX), e);
        }
        MediaMetadata metadata = toMetadata(parsed, path);
        LOGGER.debug("probe {} -> duration={}s {}x{} fps={}", path.getFileName(),
                metadata.durationSeconds(), metadata.width(), metadata.height(), metadata.fps());
        return metadata;
    }

    static MediaMetadata toMetadata(FfprobeOutput parsed, Path path) {
        FfprobeOutput.Stream video = parsed == null || parsed.streams() == null ? null : parsed.streams().stream()
                .filter(s -> "video".equals(s.codecType()))
                .findFirst()
                .orElse(null);
        if (video == null) {
            throw new ProbeException(ProbeException.Reason.NO_VIDEO_STREAM, "No video stream in " + fileName(path));
        }

        String rawDuration = video.duration();
        if (rawDuration == null && parsed.format() != null) {
            rawDuration = parsed.format().duration();
        }
        String rawRate = video.rFrameRate() != null ? video.rFrameRate() : video.avgFrameRate();
        if (rawDuration == null || rawRate == null
                || video.width() == null || video.width() <= 0
                || video.height() == null || video.height() <= 0) {
            throw new ProbeException(ProbeException.Reason.NO_VIDEO_STREAM,
                    "Essential video metadata (duration, width, height, fps) not found in " + fileName(path));
        }

        return new MediaMetadata(parseDuration(rawDuration), video.width(), video.height(), parseFrameRate(rawRate));
    }

    /** "N/A", garbage and negative values all mean "unknown" and become 0. */
    static double parseDuration(String raw) {
        try {
            double d = Double.parseDouble(raw.trim());
            return Double.isFinite(d) && d > 0 ? d : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /** Parses "num/den" (or a plain number); unusable values fall back to {@value #DEFAULT_FPS}. */
    static double parseFrameRate(String raw) {
        try {
            String[] parts = raw.trim().split("/");
            double fps;
            if (parts.length == 2) {
                double num = Double.parseDouble(parts[0]);
                double den = Double.parseDouble(parts[1]);
                if (den == 0) {
                    return DEFAULT_FPS;
                }
                fps = num / den;
            } else if (parts.length == 1) {
                fps = Double.parseDouble(parts[0]);
            } else {
                return DEFAULT_FPS;
            }
            return Double.isFinite(fps) && fps > 0 ? fps : DEFAULT_FPS;
        } catch (NumberFormatException e) {
            return DEFAULT_FPS;
        }
    }

    private static String fileName(Path path) {
        return path == null || path.getFileName() == null ? String.valueOf(path) : path.getFileName().toString();
    }
}
