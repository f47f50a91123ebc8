package github.sarthakdev143.reel_export.model;

import java.util.List;

/**
 * Fixed encoder settings per artifact type. Only the container is chosen by the caller.
 */
public enum OutputProfile {
    FINAL_EXPORT(true, List.of(
            "-c:v", "libx264",
            "-preset", "medium",
            "-crf", "18",
            "-maxrate", "15M",
            "-bufsize", "30M",
            "-profile:v", "high",
            "-level", "4.2",
            "-pix_fmt", "yuv420p",
            "-g", "60",
            "-c:a", "aac",
            "-b:a", "320k",
            "-ar", "48000",
            "-ac", "2")),
    PROCESSED_CLIP(true, List.of(
            "-c:v", "libx264",
            "-pix_fmt", "yuv420p",
            "-max_muxing_queue_size", "9999",
            "-ac", "2",
            "-ar", "48000",
            "-c:a", "aac",
            "-b:a", "320k")),
    // 10-bit 4:2:2 ProRes HQ with PCM audio, used for per-clip chunks.
    INTERMEDIATE_CHUNK(false, List.of(
            "-r", "30",
            "-vsync", "cfr",
            "-c:v", "prores_ks",
            "-profile:v", "3",
            "-pix_fmt", "yuv422p10le",
            "-vendor", "ap10",
            "-c:a", "pcm_s16le",
            "-ac", "2",
            "-ar", "48000"));

    private final boolean deliverable;
    private final List<String> encoderArguments;

    OutputProfile(boolean deliverable, List<String> encoderArguments) {
        this.deliverable = deliverable;
        this.encoderArguments = encoderArguments;
    }

    /**
     * Whether the artifact is handed to a user, which makes web-playback flags worthwhile.
     */
    public boolean deliverable() {
        return deliverable;
    }

    public List<String> encoderArguments() {
        return encoderArguments;
    }
}
