package github.sarthakdev143.reel_export.model.timeline;

import github.sarthakdev143.reel_export.model.LayoutType;

import java.util.List;

public record Timeline(
        List<Track> videoTracks,
        List<Track> audioTracks,
        double durationSec,
        LayoutType layout) {

    public Timeline {
        videoTracks = videoTracks == null ? List.of() : List.copyOf(videoTracks);
        audioTracks = audioTracks == null ? List.of() : List.copyOf(audioTracks);
    }
}
