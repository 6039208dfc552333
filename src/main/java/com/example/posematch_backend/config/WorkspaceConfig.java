package com.example.posematch_backend.config;

import com.example.posematch_backend.service.WorkspaceService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(WorkspaceProperties.class)
@Configuration
public class WorkspaceConfig {

    /**
     * Run scratch directories and upload copies live side by side under {@code workspace.local.base-dir}.
     * Neither may contain the other.
     */
    @Bean
    public WorkspaceService workspaceService(WorkspaceProperties properties) {
        Path base = Path.of(properties.getBaseDir()).toAbsolutePath().normalize();
        Path runs = base.resolve(properties.getRunsPrefix()).normalize();
        Path uploads = base.resolve(properties.getUploadsPrefix()).normalize();
        if (runs.equals(base) || uploads.equals(base) || runs.startsWith(uploads) || uploads.startsWith(runs)) {
            throw new IllegalStateException("workspace.local runs and uploads directories must not overlap under "
                    + base + " (runs=" + runs + ", uploads=" + uploads + ")");
        }
        return new WorkspaceService(runs, uploads);
    }
}
