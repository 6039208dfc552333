package com.example.posematch_backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and concurrency settings for an analysis run.
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private int defaultTargetFrames = 30;
    private int minTargetFrames = 10;
    private int maxTargetFrames = 60;
    @Positive
    private double maxShortDurationSeconds = 5.0;
    @Min(1)
    private long runTimeoutSeconds = 300;
    @Min(1)
    private int poseConcurrency = 1;
    @Min(2)
    private int executorThreads = 4;
    private int executorQueueCapacity = 20;

    public int getDefaultTargetFrames() {
        return defaultTargetFrames;
    }

    public void setDefaultTargetFrames(int defaultTargetFrames) {
        this.defaultTargetFrames = defaultTargetFrames;
    }

    public int getMinTargetFrames() {
        return minTargetFrames;
    }

    public void setMinTargetFrames(int minTargetFrames) {
        this.minTargetFrames = minTargetFrames;
    }

    public int getMaxTargetFrames() {
        return maxTargetFrames;
    }

    public void setMaxTargetFrames(int maxTargetFrames) {
        this.maxTargetFrames = maxTargetFrames;
    }

    public double getMaxShortDurationSeconds() {
        return maxShortDurationSeconds;
    }

    public void setMaxShortDurationSeconds(double maxShortDurationSeconds) {
        this.maxShortDurationSeconds = maxShortDurationSeconds;
    }

    public long getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public void setRunTimeoutSeconds(long runTimeoutSeconds) {
        this.runTimeoutSeconds = runTimeoutSeconds;
    }

    public int getPoseConcurrency() {
        return poseConcurrency;
    }

    public void setPoseConcurrency(int poseConcurrency) {
        this.poseConcurrency = poseConcurrency;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    /**
     * Applies the accepted range: a value outside [min, max] falls back to the default.
     *
     * @param requested value sent by the caller, may be {@code null}.
     * @return frame count to use for the run.
     */
    public int resolveTargetFrames(Integer requested) {
        if (requested == null || requested < minTargetFrames || requested > maxTargetFrames) {
            return defaultTargetFrames;
        }
        return requested;
    }
}
