package com.example.posematch_backend.dto;

/**
 * One normalized body landmark. {@code visibility} is optional and informational only.
 */
public record LandmarkPoint(double x, double y, double z, Double visibility) {

    public LandmarkPoint(double x, double y, double z) {
        this(x, y, z, null);
    }

    public double distanceTo(LandmarkPoint other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
