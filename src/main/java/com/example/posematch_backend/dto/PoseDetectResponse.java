package com.example.posematch_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Payload of the pose sidecar for one frame. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PoseDetectResponse(boolean detected, List<Landmark> landmarks) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Landmark(double x, double y, double z, Double visibility) {}
}
