package com.example.posematch_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one analysis run. {@code FAILED} is reachable from every non-terminal state and cleanup
 * ({@code CLEANED}) follows both {@code SCORED} and {@code FAILED}.
 */
public enum RunState {
    CREATED,
    METADATA_VALIDATED,
    FRAMES_EXTRACTED,
    POSES_ESTIMATED,
    SCORED,
    FAILED,
    CLEANED;

    public boolean canTransitionTo(RunState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == CLEANED;
    }

    private Set<RunState> allowedNext() {
        return switch (this) {
            case CREATED -> EnumSet.of(METADATA_VALIDATED, FAILED);
            case METADATA_VALIDATED -> EnumSet.of(FRAMES_EXTRACTED, FAILED);
            case FRAMES_EXTRACTED -> EnumSet.of(POSES_ESTIMATED, FAILED);
            case POSES_ESTIMATED -> EnumSet.of(SCORED, FAILED);
            case SCORED -> EnumSet.of(CLEANED, FAILED);
            case FAILED -> EnumSet.of(CLEANED);
            case CLEANED -> EnumSet.noneOf(RunState.class);
        };
    }
}
