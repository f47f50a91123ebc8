package github.sarthakdev143.reel_export.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_export.dto.ExportSubmissionResponse;
import github.sarthakdev143.reel_export.dto.TimelineRequest;
import github.sarthakdev143.reel_export.model.ContainerFormat;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.service.ExportService;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.impl.JobProgressBroadcaster;
import github.sarthakdev143.reel_export.service.impl.TimelineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
public class ExportController {

    private static final Logger logger = LoggerFactory.getLogger(ExportController.class);
    private static final int MAX_UPLOADS = 50;

    private final ExportService exportService;
    private final TimelineValidator timelineValidator;
    private final JobRegistry jobRegistry;
    private final JobProgressBroadcaster progressBroadcaster;
    private final ObjectMapper objectMapper;

    public ExportController(
            ExportService exportService,
            TimelineValidator timelineValidator,
            JobRegistry jobRegistry,
            JobProgressBroadcaster progressBroadcaster,
            ObjectMapper objectMapper) {
        this.exportService = exportService;
        this.timelineValidator = timelineValidator;
        this.jobRegistry = jobRegistry;
        this.progressBroadcaster = progressBroadcaster;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> export(
            @RequestParam(value = "timeline", required = false) String timelineJson,
            @RequestParam(value = "videos", required = false) List<MultipartFile> videos,
            @RequestParam(value = "filename", required = false) String filename,
            @RequestParam(value = "format", required = false) String formatInput) {
        try {
            Timeline timeline = timelineValidator.toTimeline(parseTimeline(timelineJson));
            ContainerFormat format = ContainerFormat.fromInput(formatInput);
            List<MultipartFile> uploads = videos == null ? List.of() : videos;
            if (uploads.size() > MAX_UPLOADS) {
                throw new IllegalArgumentException("At most " + MAX_UPLOADS + " media files can be uploaded.");
            }

            String exportId = exportService.submitExport(timeline, uploads, filename, format);
            return ResponseEntity.accepted().body(new ExportSubmissionResponse(exportId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Could not accept export request", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start export. Please try again.");
        }
    }

    @GetMapping(value = "/export-progress/{exportId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter exportProgress(@PathVariable String exportId) {
        return progressBroadcaster.subscribe(exportId, JobKind.EXPORT, "Export not found");
    }

    @GetMapping("/download-export/{exportId}")
    public ResponseEntity<?> downloadExport(@PathVariable String exportId) {
        return JobArtifactResponses.serve(
                jobRegistry.find(exportId).filter(job -> job.kind() == JobKind.EXPORT),
                true,
                "Export not ready or not found");
    }

    private TimelineRequest parseTimeline(String timelineJson) {
        if (timelineJson == null || timelineJson.isBlank()) {
            throw new IllegalArgumentException("timeline is required.");
        }
        try {
            return objectMapper.readValue(timelineJson, TimelineRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("timeline must be valid JSON: " + e.getOriginalMessage());
        }
    }
}
