package com.example.posematch_backend.config;

import com.example.posematch_backend.service.WorkspaceService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceConfigTest {

    @TempDir
    private Path tempDir;

    @Test
    void wiresRunsAndUploadsUnderBaseDir() {
        WorkspaceProperties props = properties("runs", "uploads");

        WorkspaceService service = new WorkspaceConfig().workspaceService(props);

        assertThat(service.runsRoot()).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("runs"));
        assertThat(service.uploadsRoot()).isEqualTo(tempDir.toAbsolutePath().normalize().resolve("uploads"));
        assertThat(service.runsRoot()).isDirectory();
        assertThat(service.uploadsRoot()).isDirectory();
    }

    @Test
    void uploadsInsideRunsRootIsRejected() {
        WorkspaceProperties props = properties("data", "data/uploads");

        assertThatThrownBy(() -> new WorkspaceConfig().workspaceService(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must not overlap");
    }

    @Test
    void sharedDirectoryIsRejected() {
        WorkspaceProperties props = properties("scratch", "./scratch");

        assertThatThrownBy(() -> new WorkspaceConfig().workspaceService(props))
                .isInstanceOf(IllegalStateException.class);
    }

    private WorkspaceProperties properties(String runs, String uploads) {
        WorkspaceProperties props = new WorkspaceProperties();
        props.setBaseDir(tempDir.toString());
        props.setRunsPrefix(runs);
        props.setUploadsPrefix(uploads);
        return props;
    }
}
