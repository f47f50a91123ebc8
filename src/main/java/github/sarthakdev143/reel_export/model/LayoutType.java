package github.sarthakdev143.reel_export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum LayoutType {
    SOLO("solo"),
    DUET_VERTICAL("duet-vertical"),
    DUET_HORIZONTAL("duet-horizontal"),
    TRIO_STACK("trio-stack");

    private final String apiValue;

    LayoutType(String apiValue) {
        this.apiValue = apiValue;
    }

    @JsonCreator
    public static LayoutType fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }

        String normalized = input.trim();
        for (LayoutType layout : values()) {
            if (layout.apiValue.equalsIgnoreCase(normalized) || layout.name().equalsIgnoreCase(normalized)) {
                return layout;
            }
        }
        throw new IllegalArgumentException("template.layout must be one of "
                + Arrays.stream(values()).map(LayoutType::toApiValue).collect(Collectors.joining(", "))
                + ".");
    }

    @JsonValue
    public String toApiValue() {
        return apiValue;
    }
}
