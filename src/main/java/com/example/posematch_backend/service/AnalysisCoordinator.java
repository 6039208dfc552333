package com.example.posematch_backend.service;

import com.example.posematch_backend.config.AnalysisProperties;
import com.example.posematch_backend.dto.AnalysisRequest;
import com.example.posematch_backend.dto.FrameSet;
import com.example.posematch_backend.dto.LandmarkSequence;
import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.dto.RunWorkspace;
import com.example.posematch_backend.dto.SimilarityResult;
import com.example.posematch_backend.engine.Interfaces.FrameSampler;
import com.example.posematch_backend.engine.Interfaces.MetadataProbe;
import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.exception.ErrorKind;
import com.example.posematch_backend.util.RunState;
import com.example.posematch_backend.util.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives one analysis run through probe, sampling, pose estimation and scoring, and always reclaims the run's
 * workspace at the end.
 * <p>
 * The two videos are processed in parallel on {@code analysisTaskExecutor}. The first failing task cancels its
 * sibling with interruption, which also stops any running ffmpeg process.
 */
@Service
public class AnalysisCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisCoordinator.class);

    static final String SHORT_FRAMES_DIR = "short_frames";
    static final String REFERENCE_FRAMES_DIR = "reference_frames";

    private final MetadataProbe metadataProbe;
    private final FrameSampler frameSampler;
    private final PoseSequenceService poseSequenceService;
    private final SimilarityScorer similarityScorer;
    private final WorkspaceService workspaceService;
    private final Executor analysisExecutor;
    private final AnalysisProperties properties;

    public AnalysisCoordinator(MetadataProbe metadataProbe,
                               FrameSampler frameSampler,
                               PoseSequenceService poseSequenceService,
                               SimilarityScorer similarityScorer,
                               WorkspaceService workspaceService,
                               @Qualifier("analysisTaskExecutor") Executor analysisExecutor,
                               AnalysisProperties properties) {
        this.metadataProbe = metadataProbe;
        this.frameSampler = frameSampler;
        this.poseSequenceService = poseSequenceService;
        this.similarityScorer = similarityScorer;
        this.workspaceService = workspaceService;
        this.analysisExecutor = analysisExecutor;
        this.properties = properties;
    }

    public AnalysisRun newRun(AnalysisRequest request) {
        return new AnalysisRun(UUID.randomUUID().toString(), request);
    }

    /**
     * Runs a complete analysis on the calling thread.
     *
     * @return the similarity result of the scored run.
     * @throws AnalysisException the run's failure, after cleanup has completed.
     */
    public SimilarityResult runAnalysis(AnalysisRequest request) {
        AnalysisRun run = analyze(request);
        if (run.getFailure() != null) {
            throw run.getFailure();
        }
        return run.getResult();
    }

    /**
     * Runs a complete analysis and returns the finished run, scored or failed.
     */
    public AnalysisRun analyze(AnalysisRequest request) {
        AnalysisRun run = newRun(request);
        execute(run);
        return run;
    }

    /**
     * Executes the run to a terminal state. Failures are recorded on the run, never thrown.
     */
    public void execute(AnalysisRun run) {
        AnalysisRequest req = run.getRequest();
        int targetFrames = req.targetFrames();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getRunTimeoutSeconds());
        RunWorkspace workspace = null;

        LOGGER.info("Analysis {} started short={} reference={} targetFrames={}",
                run.getRunId(), req.shortVideo().getFileName(), req.referenceVideo().getFileName(), targetFrames);
        try {
            ensureActive(run, deadline);
            workspace = workspaceService.allocate(run.getRunId());

            MediaMetadata shortMeta = metadataProbe.probe(req.shortVideo());
            if (shortMeta.durationSeconds() > req.maxShortDurationSeconds()) {
                throw new AnalysisException(ErrorKind.VALIDATION, "SHORT_VIDEO_TOO_LONG", String.format(Locale.ROOT,
                        "Short video must be %.1f seconds or less (got %.2f s)",
                        req.maxShortDurationSeconds(), shortMeta.durationSeconds()));
            }
            ensureActive(run, deadline);
            MediaMetadata referenceMeta = metadataProbe.probe(req.referenceVideo());
            ensureActive(run, deadline);
            run.transitionTo(RunState.METADATA_VALIDATED);
            LOGGER.info("Analysis {} metadata short={}s@{}fps reference={}s@{}fps", run.getRunId(),
                    shortMeta.durationSeconds(), shortMeta.fps(), referenceMeta.durationSeconds(), referenceMeta.fps());

            Path shortDir = workspace.resolve(SHORT_FRAMES_DIR);
            Path referenceDir = workspace.resolve(REFERENCE_FRAMES_DIR);
            List<FrameSet> frames = inParallel(run, deadline,
                    () -> frameSampler.sample(req.shortVideo(), targetFrames, shortMeta, shortDir),
                    () -> frameSampler.sample(req.referenceVideo(), targetFrames, referenceMeta, referenceDir));
            run.transitionTo(RunState.FRAMES_EXTRACTED);
            LOGGER.info("Analysis {} frames extracted short={} reference={} (target {})", run.getRunId(),
                    frames.get(0).extractedCount(), frames.get(1).extractedCount(), targetFrames);

            List<LandmarkSequence> poses = inParallel(run, deadline,
                    () -> poseSequenceService.estimate(frames.get(0)),
                    () -> poseSequenceService.estimate(frames.get(1)));
            for (LandmarkSequence sequence : poses) {
                if (sequence.size() != targetFrames) {
                    throw new AnalysisException(ErrorKind.INTEGRITY, "LANDMARK_SEQUENCE_MISMATCH",
                            "Landmark sequence has " + sequence.size() + " entries, expected " + targetFrames);
                }
            }
            run.transitionTo(RunState.POSES_ESTIMATED);
            LOGGER.info("Analysis {} poses detected short={}/{} reference={}/{}", run.getRunId(),
                    poses.get(0).detectedCount(), targetFrames, poses.get(1).detectedCount(), targetFrames);

            SimilarityResult result = similarityScorer.score(poses.get(0), poses.get(1), targetFrames);
            run.succeed(result);
            LOGGER.info("Analysis {} scored {}", run.getRunId(), result.score());
        } catch (AnalysisException e) {
            LOGGER.warn("Analysis {} failed in {}: {} {}", run.getRunId(), run.getState(), e.getCode(), e.getMessage());
            run.fail(e);
        } catch (RuntimeException e) {
            LOGGER.error("Analysis {} failed unexpectedly in {}", run.getRunId(), run.getState(), e);
            run.fail(new AnalysisException(ErrorKind.INTERNAL, "UNEXPECTED_FAILURE",
                    "Unexpected failure: " + e.getMessage(), e));
        } finally {
            cleanup(run, workspace);
        }
    }

    private <T> List<T> inParallel(AnalysisRun run, long deadline, Callable<T> first, Callable<T> second) {
        ExecutorCompletionService<T> completion = new ExecutorCompletionService<>(analysisExecutor);
        List<Future<T>> futures = new ArrayList<>(2);
        try {
            for (Callable<T> task : List.of(first, second)) {
                Future<T> future = completion.submit(task);
                futures.add(future);
                run.track(future);
            }
            List<T> results = new ArrayList<>(Collections.nCopies(futures.size(), null));
            for (int i = 0; i < futures.size(); i++) {
                long remaining = deadline - System.nanoTime();
                Future<T> done = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (done == null) {
                    throw timedOut(run);
                }
                results.set(futures.indexOf(done), done.get());
            }
            return results;
        } catch (RejectedExecutionException e) {
            throw new AnalysisException(ErrorKind.RESOURCE, "EXECUTOR_REJECTED",
                    "No capacity to run analysis tasks", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(run, e);
        } catch (CancellationException e) {
            throw cancelled(run, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (run.isCancelled()) {
                throw cancelled(run, cause);
            }
            if (cause instanceof AnalysisException ae) {
                throw ae;
            }
            throw new AnalysisException(ErrorKind.INTERNAL, "UNEXPECTED_FAILURE",
                    "Analysis task failed: " + cause, cause);
        } finally {
            for (Future<T> f : futures) {
                f.cancel(true);
                run.untrack(f);
            }
        }
    }

    private void ensureActive(AnalysisRun run, long deadline) {
        if (run.isCancelled()) {
            throw cancelled(run, null);
        }
        if (System.nanoTime() - deadline > 0) {
            throw timedOut(run);
        }
    }

    private AnalysisException cancelled(AnalysisRun run, Throwable cause) {
        return new AnalysisException(ErrorKind.CANCELLED, "RUN_CANCELLED", "Analysis " + run.getRunId() + " was cancelled", cause);
    }

    private AnalysisException timedOut(AnalysisRun run) {
        return new AnalysisException(ErrorKind.CANCELLED, "RUN_TIMEOUT",
                "Analysis " + run.getRunId() + " exceeded " + properties.getRunTimeoutSeconds() + "s");
    }

    private void cleanup(AnalysisRun run, RunWorkspace workspace) {
        List<String> issues = new ArrayList<>();
        try {
            issues.addAll(workspaceService.reclaim(workspace));
        } catch (RuntimeException e) {
            LOGGER.warn("Analysis {} workspace reclaim error: {}", run.getRunId(), e.toString());
            issues.add("Cleanup error: " + e.getMessage());
        }
        AnalysisRequest req = run.getRequest();
        if (req.sourcesOwned()) {
            for (Path source : List.of(req.shortVideo(), req.referenceVideo())) {
                try {
                    String issue = workspaceService.deleteFile(source);
                    if (issue != null) {
                        issues.add(issue);
                    }
                } catch (RuntimeException e) {
                    LOGGER.warn("Analysis {} source delete error path={}: {}", run.getRunId(), source, e.toString());
                    issues.add("Cleanup error: " + e.getMessage());
                }
            }
        }
        issues.forEach(run::addCleanupIssue);
        if (!issues.isEmpty()) {
            LOGGER.warn("Analysis {} cleanup left {} issue(s)", run.getRunId(), issues.size());
        }
        if (run.getState() != RunState.SCORED && run.getState() != RunState.FAILED) {
            run.fail(new AnalysisException(ErrorKind.INTERNAL, "UNEXPECTED_FAILURE",
                    "Analysis " + run.getRunId() + " aborted in " + run.getState()));
        }
        RunState outcome = run.getState();
        run.transitionTo(RunState.CLEANED);
        LOGGER.info("Analysis {} finished outcome={} history={}", run.getRunId(), outcome, run.getHistory());
    }
}
