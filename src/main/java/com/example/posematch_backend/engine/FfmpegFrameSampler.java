package com.example.posematch_backend.engine;

import com.example.posematch_backend.dto.FrameSet;
import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.engine.Interfaces.FrameSampler;
import com.example.posematch_backend.exception.SampleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Samples a clip into a fixed number of PNG frames with ffmpeg's {@code fps} filter.
 * <p>
 * The number of files ffmpeg writes is not trusted: rounding in the time-based filter can produce a few frames
 * more or less than requested, so the listing is padded with the last frame or truncated afterwards.
 */
public class FfmpegFrameSampler implements FrameSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSampler.class);

    static final String FRAME_PREFIX = "frame_";
    static final String FRAME_SUFFIX = ".png";
    static final String FRAME_PATTERN = FRAME_PREFIX + "%04d" + FRAME_SUFFIX;
    private static final int LOG_SNIPPET_MAX = 2_000;

    private final ProcessRunner processRunner;
    private final String ffmpegBin;
    private final Duration timeout;

    public FfmpegFrameSampler(ProcessRunner processRunner, String ffmpegBin, Duration timeout) {
        this.processRunner = processRunner;
        this.ffmpegBin = (ffmpegBin == null || ffmpegBin.isBlank()) ? "ffmpeg" : ffmpegBin;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(2);
    }

    @Override
    public FrameSet sample(Path videoPath, int targetFrames, MediaMetadata metadata, Path outputDir) {
        if (targetFrames <= 0) {
            throw new SampleException(SampleException.Reason.INVALID_TARGET_COUNT,
                    "targetFrames must be a positive number, got " + targetFrames);
        }
        if (videoPath == null || !Files.isRegularFile(videoPath)) {
            throw new SampleException(SampleException.Reason.SOURCE_NOT_FOUND, "Video file not found: " + videoPath);
        }

        boolean createdDir = !Files.exists(outputDir);
        try {
            Files.createDirectories(outputDir);
            if (!listFrames(outputDir).isEmpty()) {
                throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                        "Output directory already contains frames: " + outputDir);
            }
        } catch (IOException e) {
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                    "Failed to create output directory " + outputDir + ": " + e.getMessage(), e);
        }

        try {
            List<String> cmd = buildCommand(videoPath, targetFrames, metadata, outputDir);
            runExtraction(cmd, videoPath);

            List<Path> extracted = listFrames(outputDir);
            List<Path> frames = reconcile(extracted, targetFrames);
            if (extracted.size() != targetFrames) {
                LOGGER.info("Reconciled {}: extracted={} target={}", videoPath.getFileName(), extracted.size(), targetFrames);
            }
            return new FrameSet(outputDir, frames, extracted.size());
        } catch (SampleException e) {
            removePartialOutput(outputDir, createdDir);
            throw e;
        } catch (IOException e) {
            removePartialOutput(outputDir, createdDir);
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                    "Failed to list extracted frames in " + outputDir + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            removePartialOutput(outputDir, createdDir);
            throw e;
        }
    }

    List<String> buildCommand(Path videoPath, int targetFrames, MediaMetadata metadata, Path outputDir) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-hide_banner");
        cmd.add("-loglevel"); cmd.add("error");
        cmd.add("-i"); cmd.add(videoPath.toAbsolutePath().toString());

        if (metadata == null || !metadata.isTimeSamplable()) {
            // unknown duration or fps: dividing time is meaningless, take the first decodable frame and pad it
            LOGGER.warn("Video {} has duration={} fps={}; extracting first frame only",
                    videoPath.getFileName(),
                    metadata == null ? null : metadata.durationSeconds(),
                    metadata == null ? null : metadata.fps());
            cmd.add("-frames:v"); cmd.add("1");
        } else {
            cmd.add("-vf"); cmd.add(String.format(Locale.ROOT, "fps=%d/%.6f", targetFrames, metadata.durationSeconds()));
            cmd.add("-vsync"); cmd.add("vfr");
        }
        cmd.add(outputDir.resolve(FRAME_PATTERN).toAbsolutePath().toString());
        return cmd;
    }

    private void runExtraction(List<String> cmd, Path videoPath) {
        ProcessRunner.ProcessResult result;
        try {
            result = processRunner.run(cmd, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SampleException(SampleException.Reason.EXTRACTION_CANCELLED,
                    "Frame extraction cancelled for " + videoPath.getFileName(), e);
        } catch (IOException e) {
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                    "ffmpeg could not be started: " + e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                    "ffmpeg timed out after " + timeout + " for " + videoPath.getFileName());
        }
        if (result.code() != 0) {
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED,
                    "ffmpeg exit=" + result.code() + " for " + videoPath.getFileName()
                            + " log=" + ProcessRunner.truncate(result.output(), LOG_SNIPPET_MAX));
        }
    }

    /**
     * Forces the extracted listing to exactly {@code targetFrames} entries.
     *
     * @param extracted frames in temporal order.
     * @return the first {@code targetFrames} frames, padded with the last frame when fewer were produced.
     * @throws SampleException {@code NO_FRAMES_PRODUCED} when {@code extracted} is empty.
     */
    static List<Path> reconcile(List<Path> extracted, int targetFrames) {
        if (extracted.isEmpty()) {
            throw new SampleException(SampleException.Reason.NO_FRAMES_PRODUCED,
                    "No frames were extracted, expected " + targetFrames + ". Check video validity and ffmpeg logs.");
        }
        if (extracted.size() >= targetFrames) {
            return new ArrayList<>(extracted.subList(0, targetFrames));
        }
        List<Path> frames = new ArrayList<>(targetFrames);
        frames.addAll(extracted);
        Path last = extracted.get(extracted.size() - 1);
        while (frames.size() < targetFrames) {
            frames.add(last);
        }
        return frames;
    }

    static List<Path> listFrames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(FRAME_PREFIX) && name.endsWith(FRAME_SUFFIX);
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    private void removePartialOutput(Path dir, boolean removeDir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                if (!removeDir && p.equals(dir)) {
                    continue;
                }
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to remove partial frame output dir={} err={}", dir, e.toString());
        }
    }
}
