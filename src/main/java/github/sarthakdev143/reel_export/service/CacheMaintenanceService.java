package github.sarthakdev143.reel_export.service;

import github.sarthakdev143.reel_export.dto.CacheStatusResponse;
import github.sarthakdev143.reel_export.dto.ClearCacheResponse;

public interface CacheMaintenanceService {

    CacheStatusResponse status();

    /**
     * Deletes every upload, intermediate and output artifact and forgets every job.
     */
    ClearCacheResponse clear();
}
