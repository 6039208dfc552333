package com.example.posematch_backend.engine.Interfaces;

import com.example.posematch_backend.dto.LandmarkSet;

import java.nio.file.Path;

/**
 * External pose-landmark detector. Callers acquire a {@link PoseSession} per batch of frames and must close it.
 */
public interface PoseEstimator {

    PoseSession openSession();

    interface PoseSession extends AutoCloseable {

        /**
         * @return 33 normalized landmarks, or {@link LandmarkSet#ABSENT} when no pose is visible.
         */
        LandmarkSet estimate(Path frame);

        @Override
        void close();
    }
}
