package github.sarthakdev143.reel_export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrackKind {
    VIDEO,
    AUDIO;

    @JsonCreator
    public static TrackKind fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }

        try {
            return TrackKind.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("track type must be one of video, audio.");
        }
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
