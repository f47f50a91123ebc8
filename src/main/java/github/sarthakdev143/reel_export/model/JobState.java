package github.sarthakdev143.reel_export.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    PROCESSING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
