package com.example.posematch_backend.service;

import com.example.posematch_backend.config.AnalysisProperties;
import com.example.posematch_backend.dto.FrameSet;
import com.example.posematch_backend.dto.LandmarkSequence;
import com.example.posematch_backend.dto.LandmarkSet;
import com.example.posematch_backend.engine.Interfaces.PoseEstimator;
import com.example.posematch_backend.exception.AnalysisException;
import com.example.posematch_backend.exception.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * Runs the pose estimator over every frame of a {@link FrameSet}, keeping frame index alignment.
 * <p>
 * One estimator session is held per FrameSet and released on every exit path. Inference calls are bounded
 * process-wide by {@code analysis.pose-concurrency}.
 */
@Service
public class PoseSequenceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PoseSequenceService.class);

    private final PoseEstimator poseEstimator;
    private final Semaphore inferencePermits;

    public PoseSequenceService(PoseEstimator poseEstimator, AnalysisProperties properties) {
        this.poseEstimator = poseEstimator;
        this.inferencePermits = new Semaphore(Math.max(1, properties.getPoseConcurrency()), true);
    }

    public LandmarkSequence estimate(FrameSet frameSet) {
        List<LandmarkSet> landmarks = new ArrayList<>(frameSet.size());
        // padded frames repeat the same path, the pose for it is computed once
        Map<Path, LandmarkSet> byFrame = new HashMap<>();

        try (PoseEstimator.PoseSession session = poseEstimator.openSession()) {
            for (int i = 0; i < frameSet.size(); i++) {
                Path frame = frameSet.get(i);
                LandmarkSet result = byFrame.get(frame);
                if (result == null) {
                    result = estimateOne(session, frame);
                    byFrame.put(frame, result);
                }
                landmarks.add(result);
            }
        }

        LandmarkSequence sequence = new LandmarkSequence(landmarks);
        LOGGER.debug("poses dir={} frames={} detected={} unique={}",
                frameSet.directory(), sequence.size(), sequence.detectedCount(), byFrame.size());
        return sequence;
    }

    private LandmarkSet estimateOne(PoseEstimator.PoseSession session, Path frame) {
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(null);
        }
        try {
            inferencePermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(e);
        }
        try {
            LandmarkSet result = session.estimate(frame);
            return result == null ? LandmarkSet.ABSENT : result;
        } finally {
            inferencePermits.release();
        }
    }

    private static AnalysisException cancelled(InterruptedException cause) {
        return new AnalysisException(ErrorKind.CANCELLED, "RUN_CANCELLED", "Pose estimation interrupted", cause);
    }
}
