package github.sarthakdev143.reel_export.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum TransitionType {
    CROSS_DISSOLVE("cross-dissolve", "fade"),
    ADDITIVE_DISSOLVE("additive-dissolve", "fade"),
    BLUR_DISSOLVE("blur-dissolve", "pixelize"),
    NON_ADDITIVE_DISSOLVE("non-additive-dissolve", "fade"),
    SMOOTH_CUT("smooth-cut", "fade"),
    DIP_TO_BLACK("dip-to-black", "fadeblack"),
    DIP_TO_WHITE("dip-to-white", "fadewhite"),
    FADE_IN("fade-in", "fade"),
    FADE_OUT("fade-out", "fade");

    private final String apiValue;
    private final String xfadeTransition;

    TransitionType(String apiValue, String xfadeTransition) {
        this.apiValue = apiValue;
        this.xfadeTransition = xfadeTransition;
    }

    @JsonCreator
    public static TransitionType fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }

        String normalized = input.trim();
        for (TransitionType type : values()) {
            if (type.apiValue.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("transition type must be one of "
                + Arrays.stream(values()).map(TransitionType::toApiValue).collect(Collectors.joining(", "))
                + ".");
    }

    @JsonValue
    public String toApiValue() {
        return apiValue;
    }

    /**
     * Name of the xfade effect used when this transition blends two clips.
     */
    public String xfadeTransition() {
        return xfadeTransition;
    }

    /**
     * Color used by fade-in/fade-out at the start and end of the chain.
     */
    public String fadeColor() {
        return this == DIP_TO_WHITE ? "white" : "black";
    }
}
