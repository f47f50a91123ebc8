package github.sarthakdev143.reel_export.model.timeline;

import github.sarthakdev143.reel_export.model.TrackKind;

import java.util.List;

public record Track(
        String trackId,
        TrackKind kind,
        List<Clip> clips,
        double volume,
        boolean muted) {

    public Track {
        clips = clips == null ? List.of() : List.copyOf(clips);
    }
}
