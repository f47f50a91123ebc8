package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.dto.CacheStatusResponse;
import github.sarthakdev143.reel_export.dto.ClearCacheResponse;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultCacheMaintenanceServiceTest {

    @Mock
    private RenderExecutor renderExecutor;

    @TempDir
    Path tempDir;

    private ReelExportProperties properties;
    private InMemoryJobRegistry jobRegistry;
    private DefaultCacheMaintenanceService service;

    @BeforeEach
    void setUp() {
        properties = new ReelExportProperties();
        properties.setUploadsDir(tempDir.resolve("uploads").toString());
        properties.setOutputsDir(tempDir.resolve("outputs").toString());
        properties.setExportsDir(tempDir.resolve("exports").toString());
        jobRegistry = new InMemoryJobRegistry();
        service = new DefaultCacheMaintenanceService(properties, jobRegistry, renderExecutor);
    }

    @Test
    void statusCountsEntriesAcrossWorkspaceDirectories() throws Exception {
        Files.createDirectories(properties.outputsPath());
        Files.createDirectories(properties.exportsPath());
        Files.writeString(properties.outputsPath().resolve("processed-1.mp4"), "a");
        Files.writeString(properties.exportsPath().resolve("2-reel.mp4"), "b");

        CacheStatusResponse status = service.status();

        assertThat(status.hasCache()).isTrue();
        assertThat(status.fileCount()).isEqualTo(2);
    }

    @Test
    void statusIsEmptyWhenDirectoriesAreMissing() {
        assertThat(service.status()).isEqualTo(new CacheStatusResponse(false, 0));
    }

    @Test
    void clearStopsEncodersForgetsJobsAndDeletesFiles() throws Exception {
        Files.createDirectories(properties.outputsPath());
        Path workspace = Files.createDirectories(properties.uploadsPath().resolve("export-1"));
        Files.writeString(workspace.resolve("0-a.mp4"), "a");
        Files.writeString(properties.outputsPath().resolve("processed-1.mp4"), "b");
        String jobId = jobRegistry.create(JobKind.EXPORT, "reel.mp4", id -> Path.of(id + ".mp4")).jobId();
        when(renderExecutor.cancelAll()).thenReturn(1);

        ClearCacheResponse response = service.clear();

        assertThat(response).isEqualTo(new ClearCacheResponse(true, 2));
        assertThat(jobRegistry.find(jobId)).isEmpty();
        assertThat(properties.outputsPath()).isEmptyDirectory();
        assertThat(properties.uploadsPath()).isEmptyDirectory();
        verify(renderExecutor).cancelAll();
    }
}
