package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.dto.CacheStatusResponse;
import github.sarthakdev143.reel_export.dto.ClearCacheResponse;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.service.CacheMaintenanceService;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class DefaultCacheMaintenanceService implements CacheMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultCacheMaintenanceService.class);

    private final ReelExportProperties properties;
    private final JobRegistry jobRegistry;
    private final RenderExecutor renderExecutor;

    public DefaultCacheMaintenanceService(
            ReelExportProperties properties,
            JobRegistry jobRegistry,
            RenderExecutor renderExecutor) {
        this.properties = properties;
        this.jobRegistry = jobRegistry;
        this.renderExecutor = renderExecutor;
    }

    @Override
    public CacheStatusResponse status() {
        int fileCount = 0;
        for (Path directory : workspaceDirectories()) {
            fileCount += WorkspaceFiles.countEntries(directory);
        }
        return new CacheStatusResponse(fileCount > 0, fileCount);
    }

    @Override
    public ClearCacheResponse clear() {
        int stoppedEncoders = renderExecutor.cancelAll();
        List<RenderJob> forgottenJobs = jobRegistry.removeAll();

        int deleted = 0;
        for (Path directory : workspaceDirectories()) {
            deleted += WorkspaceFiles.clearDirectory(directory);
        }

        logger.info(
                "Cache cleared: {} files deleted, {} jobs forgotten, {} encoders stopped",
                deleted,
                forgottenJobs.size(),
                stoppedEncoders);
        return new ClearCacheResponse(true, deleted);
    }

    private List<Path> workspaceDirectories() {
        return List.of(properties.outputsPath(), properties.exportsPath(), properties.uploadsPath());
    }
}
