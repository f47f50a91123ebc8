package github.sarthakdev143.reel_export.controller;

import github.sarthakdev143.reel_export.dto.JobProgressEvent;
import github.sarthakdev143.reel_export.dto.JobSubmissionResponse;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.service.JobCancellationService;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.VideoProcessingService;
import github.sarthakdev143.reel_export.service.impl.JobProgressBroadcaster;
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

@RestController
public class VideoJobController {

    private static final Logger logger = LoggerFactory.getLogger(VideoJobController.class);
    private static final int MIN_TARGET_FPS = 1;
    private static final int MAX_TARGET_FPS = 240;
    private static final double MIN_SPEED = 0.1;
    private static final double MAX_SPEED = 4.0;

    private final VideoProcessingService videoProcessingService;
    private final JobCancellationService jobCancellationService;
    private final JobRegistry jobRegistry;
    private final JobProgressBroadcaster progressBroadcaster;

    public VideoJobController(
            VideoProcessingService videoProcessingService,
            JobCancellationService jobCancellationService,
            JobRegistry jobRegistry,
            JobProgressBroadcaster progressBroadcaster) {
        this.videoProcessingService = videoProcessingService;
        this.jobCancellationService = jobCancellationService;
        this.jobRegistry = jobRegistry;
        this.progressBroadcaster = progressBroadcaster;
    }

    @PostMapping(value = "/process-video", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> processVideo(
            @RequestParam(value = "video", required = false) MultipartFile video,
            @RequestParam(value = "targetFps", required = false) String targetFpsInput,
            @RequestParam(value = "speed", required = false) String speedInput) {
        try {
            validateVideo(video);
            int targetFps = parseTargetFps(targetFpsInput);
            double speed = parseSpeed(speedInput);

            String jobId = videoProcessingService.submitJob(video, targetFps, speed);
            return ResponseEntity.accepted().body(new JobSubmissionResponse(jobId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Could not accept process-video request", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start video processing. Please try again.");
        }
    }

    @GetMapping(value = "/progress/{jobId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter progress(@PathVariable String jobId) {
        return progressBroadcaster.subscribe(jobId, JobKind.PROCESS_VIDEO, "Job not found");
    }

    @GetMapping("/download/{jobId}")
    public ResponseEntity<?> download(@PathVariable String jobId) {
        return JobArtifactResponses.serve(jobRegistry.find(jobId), false, "File not ready or not found");
    }

    @PostMapping("/cancel/{jobId}")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        JobCancellationService.Outcome outcome = jobCancellationService.cancel(jobId);
        switch (outcome) {
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
            case ALREADY_FINISHED:
                return ResponseEntity.status(HttpStatus.CONFLICT).body("Job " + jobId + " has already finished.");
            default:
                return jobRegistry.find(jobId)
                        .<ResponseEntity<?>>map(job -> ResponseEntity.ok(JobProgressEvent.of(job)))
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
        }
    }

    private void validateVideo(MultipartFile video) {
        if (video == null || video.isEmpty()) {
            throw new IllegalArgumentException("video file is required.");
        }
        if (MediaKind.detect(video.getOriginalFilename(), video.getContentType()) != MediaKind.VIDEO) {
            throw new IllegalArgumentException("video must be a video file.");
        }
    }

    private int parseTargetFps(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("targetFps is required.");
        }
        double value;
        try {
            value = Double.parseDouble(input.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("targetFps must be a number.");
        }
        if (!Double.isFinite(value) || value != Math.rint(value)) {
            throw new IllegalArgumentException("targetFps must be a whole number.");
        }
        if (value < MIN_TARGET_FPS || value > MAX_TARGET_FPS) {
            throw new IllegalArgumentException(
                    "targetFps must be between " + MIN_TARGET_FPS + " and " + MAX_TARGET_FPS + ".");
        }
        return (int) value;
    }

    private double parseSpeed(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("speed is required.");
        }
        double value;
        try {
            value = Double.parseDouble(input.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("speed must be a number.");
        }
        if (!Double.isFinite(value) || value < MIN_SPEED || value > MAX_SPEED) {
            throw new IllegalArgumentException("speed must be between " + MIN_SPEED + " and " + MAX_SPEED + ".");
        }
        return value;
    }
}
