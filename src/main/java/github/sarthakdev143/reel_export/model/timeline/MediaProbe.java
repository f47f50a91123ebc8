package github.sarthakdev143.reel_export.model.timeline;

public record MediaProbe(
        double durationSec,
        boolean hasVideo,
        boolean hasAudio) {
}
