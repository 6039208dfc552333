package com.example.posematch_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pose")
public class PoseProperties {
    private String baseUrl = "http://127.0.0.1:8010";
    private int modelComplexity = 1;
    private double minDetectionConfidence = 0.5;
    private long timeoutSeconds = 30;
    private int connectTimeoutSeconds = 5;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getModelComplexity() {
        return modelComplexity;
    }

    public void setModelComplexity(int modelComplexity) {
        this.modelComplexity = modelComplexity;
    }

    public double getMinDetectionConfidence() {
        return minDetectionConfidence;
    }

    public void setMinDetectionConfidence(double minDetectionConfidence) {
        this.minDetectionConfidence = minDetectionConfidence;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }
}
