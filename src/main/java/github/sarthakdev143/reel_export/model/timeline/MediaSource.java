package github.sarthakdev143.reel_export.model.timeline;

import github.sarthakdev143.reel_export.model.MediaKind;

import java.nio.file.Path;

/**
 * A resolved media file. {@code durationSec} is the probed duration, or 0 for stills.
 */
public record MediaSource(
        String mediaId,
        Path path,
        MediaKind kind,
        double durationSec,
        boolean hasAudio) {

    public boolean isStill() {
        return kind == MediaKind.IMAGE;
    }
}
