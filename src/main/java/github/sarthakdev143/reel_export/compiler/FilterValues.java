package github.sarthakdev143.reel_export.compiler;

import java.util.Locale;

/**
 * Number formatting shared by every graph builder so that identical timelines serialize identically.
 */
public final class FilterValues {

    private FilterValues() {
    }

    public static String seconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    public static String decimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    public static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String milliseconds(double seconds) {
        return Long.toString(Math.round(seconds * 1000.0));
    }
}
