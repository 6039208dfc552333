package com.example.posematch_backend.service;

import com.example.posematch_backend.config.AnalysisProperties;
import com.example.posematch_backend.dto.AnalysisRequest;
import com.example.posematch_backend.dto.FrameSet;
import com.example.posematch_backend.dto.LandmarkPoint;
import com.example.posematch_backend.dto.LandmarkSequence;
import com.example.posematch_backend.dto.LandmarkSet;
import com.example.posematch_backend.dto.MediaMetadata;
import com.example.posematch_backend.dto.RunWorkspace;
import com.example.posematch_backend.dto.SimilarityResult;
import com.example.posematch_backend.engine.Interfaces.FrameSampler;
import com.example.posematch_backend.engine.Interfaces.MetadataProbe;
import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.exception.ErrorKind;
import com.example.posematch_backend.exception.SampleException;
import com.example.posematch_backend.exception.WorkspaceException;
import com.example.posematch_backend.util.RunState;
import com.example.posematch_backend.util.SimilarityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisCoordinatorTest {

    private static final int TARGET = 10;
    private static final MediaMetadata SHORT_META = new MediaMetadata(3.0, 640, 360, 30.0);
    private static final MediaMetadata REFERENCE_META = new MediaMetadata(12.0, 1280, 720, 25.0);

    @Mock
    private MetadataProbe probe;

    @Mock
    private FrameSampler sampler;

    @Mock
    private PoseSequenceService poseSequenceService;

    @TempDir
    private Path tempDir;

    private ThreadPoolTaskExecutor executor;
    private WorkspaceService workspace;
    private AnalysisProperties properties;
    private Path shortVideo;
    private Path referenceVideo;

    @BeforeEach
    void setup() throws IOException {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("analysis-test-");
        executor.initialize();

        workspace = new WorkspaceService(tempDir.resolve("runs"), tempDir.resolve("uploads"));
        properties = new AnalysisProperties();
        shortVideo = Files.writeString(workspace.uploadsRoot().resolve("short.mp4"), "short");
        referenceVideo = Files.writeString(workspace.uploadsRoot().resolve("reference.mp4"), "reference");
    }

    @AfterEach
    void teardown() {
        executor.shutdown();
    }

    @Test
    void successfulRunIsScoredAndCleanedUp() throws IOException {
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(eq(shortVideo), eq(TARGET), eq(SHORT_META), any())).thenAnswer(writesFrames());
        when(sampler.sample(eq(referenceVideo), eq(TARGET), eq(REFERENCE_META), any())).thenAnswer(writesFrames());
        when(poseSequenceService.estimate(any())).thenReturn(poses(TARGET));

        AnalysisRun run = coordinator(workspace).newRun(request(true));
        coordinator(workspace).execute(run);

        assertThat(run.getFailure()).isNull();
        assertThat(run.getResult().score()).isEqualTo(100.0);
        assertThat(run.getHistory()).containsExactly(RunState.CREATED, RunState.METADATA_VALIDATED,
                RunState.FRAMES_EXTRACTED, RunState.POSES_ESTIMATED, RunState.SCORED, RunState.CLEANED);
        assertThat(run.getCleanupIssues()).isEmpty();
        assertRunsRootEmpty();
        assertThat(shortVideo).doesNotExist();
        assertThat(referenceVideo).doesNotExist();
    }

    @Test
    void framesAreWrittenIntoSeparateWorkspaceDirectories() {
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        List<Path> outputs = Collections.synchronizedList(new ArrayList<>());
        Answer<FrameSet> frames = writesFrames();
        when(sampler.sample(any(), eq(TARGET), any(), any())).thenAnswer(inv -> {
            outputs.add(inv.getArgument(3));
            return frames.answer(inv);
        });
        when(poseSequenceService.estimate(any())).thenReturn(poses(TARGET));

        coordinator(workspace).runAnalysis(request(false));

        assertThat(outputs).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("short_frames", "reference_frames");
        assertThat(outputs.get(0).getParent()).isEqualTo(outputs.get(1).getParent());
        assertThat(shortVideo).exists();
    }

    @Test
    void tooLongShortClipIsRejectedBeforeExtraction() {
        when(probe.probe(shortVideo)).thenReturn(new MediaMetadata(6.0, 640, 360, 30.0));

        AnalysisRun run = coordinator(workspace).newRun(request(true));
        coordinator(workspace).execute(run);

        assertThat(run.getFailure().getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(run.getFailure().getCode()).isEqualTo("SHORT_VIDEO_TOO_LONG");
        assertThat(run.getFailedIn()).isEqualTo(RunState.CREATED);
        assertThat(run.getState()).isEqualTo(RunState.CLEANED);
        assertThat(run.getResult()).isNull();
        verify(probe, never()).probe(referenceVideo);
        verifyNoInteractions(sampler, poseSequenceService);
        assertRunsRootEmpty();
        assertThat(shortVideo).doesNotExist();
    }

    @Test
    void samplerFailureCancelsSiblingAndSkipsPoses() throws Exception {
        CountDownLatch siblingStarted = new CountDownLatch(1);
        CountDownLatch siblingInterrupted = new CountDownLatch(1);
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(eq(shortVideo), eq(TARGET), any(), any())).thenAnswer(inv -> {
            siblingStarted.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                siblingInterrupted.countDown();
                throw new SampleException(SampleException.Reason.EXTRACTION_CANCELLED, "interrupted", e);
            }
            return null;
        });
        when(sampler.sample(eq(referenceVideo), eq(TARGET), any(), any())).thenAnswer(inv -> {
            siblingStarted.await(5, TimeUnit.SECONDS);
            throw new SampleException(SampleException.Reason.EXTRACTION_FAILED, "ffmpeg exit=1");
        });

        AnalysisRun run = coordinator(workspace).newRun(request(true));
        coordinator(workspace).execute(run);

        assertThat(run.getFailure().getCode()).isEqualTo("EXTRACTION_FAILED");
        assertThat(run.getFailure().getKind()).isEqualTo(ErrorKind.EXTERNAL_TOOL);
        assertThat(run.getFailedIn()).isEqualTo(RunState.METADATA_VALIDATED);
        assertThat(siblingInterrupted.await(5, TimeUnit.SECONDS)).isTrue();
        verifyNoInteractions(poseSequenceService);
        assertRunsRootEmpty();
    }

    @Test
    void shortLandmarkSequenceIsIntegrityFailure() {
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(any(), eq(TARGET), any(), any())).thenAnswer(writesFrames());
        when(poseSequenceService.estimate(any())).thenReturn(poses(TARGET - 1));

        assertThatThrownBy(() -> coordinator(workspace).runAnalysis(request(false)))
                .isInstanceOfSatisfying(AnalysisException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.INTEGRITY);
                    assertThat(e.getCode()).isEqualTo("LANDMARK_SEQUENCE_MISMATCH");
                });
        assertRunsRootEmpty();
    }

    @Test
    void cleanupProblemsDoNotMaskTheResult() {
        WorkspaceService leaky = new WorkspaceService(tempDir.resolve("runs"), tempDir.resolve("uploads")) {
            @Override
            public List<String> reclaim(RunWorkspace ws) {
                return List.of("Could not delete " + ws.root() + ": busy");
            }
        };
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(any(), eq(TARGET), any(), any())).thenAnswer(writesFrames());
        when(poseSequenceService.estimate(any())).thenReturn(poses(TARGET));

        AnalysisRun run = coordinator(leaky).newRun(request(false));
        coordinator(leaky).execute(run);

        assertThat(run.getFailure()).isNull();
        assertThat(run.getResult().score()).isEqualTo(100.0);
        assertThat(run.getCleanupIssues()).singleElement().asString().contains("busy");
        assertThat(run.getState()).isEqualTo(RunState.CLEANED);
    }

    @Test
    void reclaimFailureStillDeletesUploadedSources() {
        WorkspaceService racing = new WorkspaceService(tempDir.resolve("runs"), tempDir.resolve("uploads")) {
            @Override
            public List<String> reclaim(RunWorkspace ws) {
                throw new UncheckedIOException(new NoSuchFileException(ws.root().toString()));
            }
        };
        when(probe.probe(shortVideo)).thenReturn(new MediaMetadata(6.0, 640, 360, 30.0));

        AnalysisRun run = coordinator(racing).newRun(request(true));
        coordinator(racing).execute(run);

        assertThat(run.getFailure().getCode()).isEqualTo("SHORT_VIDEO_TOO_LONG");
        assertThat(run.getState()).isEqualTo(RunState.CLEANED);
        assertThat(run.getCleanupIssues()).singleElement().asString().contains("NoSuchFileException");
        assertThat(shortVideo).doesNotExist();
        assertThat(referenceVideo).doesNotExist();
    }

    @Test
    void sourceDeleteFailureDoesNotStopTheOtherDeletion() {
        WorkspaceService stubborn = new WorkspaceService(tempDir.resolve("runs"), tempDir.resolve("uploads")) {
            @Override
            public String deleteFile(Path file) {
                if (file.equals(shortVideo)) {
                    throw new IllegalStateException("locked");
                }
                return super.deleteFile(file);
            }
        };
        when(probe.probe(shortVideo)).thenReturn(new MediaMetadata(6.0, 640, 360, 30.0));

        AnalysisRun run = coordinator(stubborn).newRun(request(true));
        coordinator(stubborn).execute(run);

        assertThat(run.getCleanupIssues()).singleElement().asString().contains("locked");
        assertThat(shortVideo).exists();
        assertThat(referenceVideo).doesNotExist();
        assertRunsRootEmpty();
    }

    @Test
    void cancelDuringShortProbeSkipsReferenceProbe() {
        AnalysisCoordinator coordinator = coordinator(workspace);
        AnalysisRun run = coordinator.newRun(request(false));
        when(probe.probe(shortVideo)).thenAnswer(inv -> {
            run.cancel();
            return SHORT_META;
        });

        coordinator.execute(run);

        assertThat(run.getFailure().getKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(run.getFailure().getCode()).isEqualTo("RUN_CANCELLED");
        assertThat(run.getFailedIn()).isEqualTo(RunState.CREATED);
        verify(probe, never()).probe(referenceVideo);
        verifyNoInteractions(sampler, poseSequenceService);
        assertRunsRootEmpty();
    }

    @Test
    void workspaceAllocationFailureIsResourceError() {
        WorkspaceService broken = new WorkspaceService(tempDir.resolve("runs"), tempDir.resolve("uploads")) {
            @Override
            public RunWorkspace allocate(String runId) {
                throw new WorkspaceException("disk full", null);
            }
        };

        AnalysisRun run = coordinator(broken).newRun(request(false));
        coordinator(broken).execute(run);

        assertThat(run.getFailure().getKind()).isEqualTo(ErrorKind.RESOURCE);
        assertThat(run.getFailure().getCode()).isEqualTo("WORKSPACE_UNAVAILABLE");
        assertThat(run.getHistory()).containsExactly(RunState.CREATED, RunState.FAILED, RunState.CLEANED);
        verifyNoInteractions(probe, sampler, poseSequenceService);
    }

    @Test
    void cancelInterruptsRunningExtraction() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(any(), eq(TARGET), any(), any())).thenAnswer(blockUntilInterrupted(started));

        AnalysisCoordinator coordinator = coordinator(workspace);
        AnalysisRun run = coordinator.newRun(request(true));
        Thread worker = new Thread(() -> coordinator.execute(run));
        worker.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        run.cancel();
        worker.join(10_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(run.getFailure().getKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(run.getFailure().getCode()).isEqualTo("RUN_CANCELLED");
        assertThat(run.getState()).isEqualTo(RunState.CLEANED);
        verifyNoInteractions(poseSequenceService);
        assertRunsRootEmpty();
        assertThat(shortVideo).doesNotExist();
    }

    @Test
    void runDeadlineCancelsWithTimeout() {
        properties.setRunTimeoutSeconds(1);
        when(probe.probe(shortVideo)).thenReturn(SHORT_META);
        when(probe.probe(referenceVideo)).thenReturn(REFERENCE_META);
        when(sampler.sample(any(), eq(TARGET), any(), any())).thenAnswer(blockUntilInterrupted(new CountDownLatch(2)));

        assertThatThrownBy(() -> coordinator(workspace).runAnalysis(request(false)))
                .isInstanceOfSatisfying(AnalysisException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLED);
                    assertThat(e.getCode()).isEqualTo("RUN_TIMEOUT");
                });
        assertRunsRootEmpty();
    }

    @Test
    void illegalTransitionIsRejected() {
        AnalysisRun run = new AnalysisRun("r-1", request(false));

        assertThatThrownBy(() -> run.transitionTo(RunState.SCORED)).isInstanceOf(IllegalStateException.class);
        assertThat(run.getState()).isEqualTo(RunState.CREATED);
    }

    private AnalysisCoordinator coordinator(WorkspaceService ws) {
        return new AnalysisCoordinator(probe, sampler, poseSequenceService, new SimilarityScorer(), ws, executor, properties);
    }

    private AnalysisRequest request(boolean owned) {
        return new AnalysisRequest(shortVideo, referenceVideo, TARGET, 5.0, owned);
    }

    private static Answer<FrameSet> writesFrames() {
        return inv -> {
            int target = inv.getArgument(1);
            Path out = inv.getArgument(3);
            Files.createDirectories(out);
            List<Path> frames = new ArrayList<>();
            for (int i = 1; i <= target; i++) {
                frames.add(Files.writeString(out.resolve(String.format("frame_%04d.png", i)), "png"));
            }
            return new FrameSet(out, frames, target);
        };
    }

    private static Answer<FrameSet> blockUntilInterrupted(CountDownLatch started) {
        return inv -> {
            started.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                throw new SampleException(SampleException.Reason.EXTRACTION_CANCELLED, "interrupted", e);
            }
            throw new AssertionError("extraction was not interrupted");
        };
    }

    private static LandmarkSequence poses(int n) {
        LandmarkSet pose = LandmarkSet.of(Collections.nCopies(33, new LandmarkPoint(0.4, 0.6, 0.0)));
        return new LandmarkSequence(Collections.nCopies(n, pose));
    }

    private void assertRunsRootEmpty() {
        try (Stream<Path> runs = Files.list(workspace.runsRoot())) {
            assertThat(runs).isEmpty();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}
