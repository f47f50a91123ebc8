package github.sarthakdev143.reel_export.controller;

import github.sarthakdev143.reel_export.dto.HealthResponse;
import github.sarthakdev143.reel_export.service.CacheMaintenanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class MaintenanceController {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceController.class);

    private final CacheMaintenanceService cacheMaintenanceService;

    public MaintenanceController(CacheMaintenanceService cacheMaintenanceService) {
        this.cacheMaintenanceService = cacheMaintenanceService;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", "Server is running");
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String root() {
        return "Reel export server is running";
    }

    @GetMapping("/cache-status")
    public ResponseEntity<?> cacheStatus() {
        try {
            return ResponseEntity.ok(cacheMaintenanceService.status());
        } catch (Exception e) {
            logger.error("Could not read cache status", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/clear-cache")
    public ResponseEntity<?> clearCache() {
        try {
            return ResponseEntity.ok(cacheMaintenanceService.clear());
        } catch (Exception e) {
            logger.error("Could not clear cache", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("success", false, "error", String.valueOf(e.getMessage())));
        }
    }
}
