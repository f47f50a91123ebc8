package github.sarthakdev143.reel_export.service;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

public interface VideoProcessingService {

    /**
     * Accepts an uploaded video for interpolation and time remapping and returns its job id immediately.
     */
    String submitJob(MultipartFile video, int targetFps, double speed) throws IOException;
}
