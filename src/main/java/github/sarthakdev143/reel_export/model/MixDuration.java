package github.sarthakdev143.reel_export.model;

import java.util.Locale;

public enum MixDuration {
    SHORTEST,
    FIRST,
    LONGEST;

    public String toFilterValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
