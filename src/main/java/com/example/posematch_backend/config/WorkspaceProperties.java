package com.example.posematch_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "workspace.local")
public class WorkspaceProperties {
    private String baseDir = "./data";
    private String runsPrefix = "runs";
    private String uploadsPrefix = "uploads";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getRunsPrefix() { return runsPrefix; }
    public void setRunsPrefix(String runsPrefix) { this.runsPrefix = runsPrefix; }

    public String getUploadsPrefix() { return uploadsPrefix; }
    public void setUploadsPrefix(String uploadsPrefix) { this.uploadsPrefix = uploadsPrefix; }
}
