package github.sarthakdev143.reel_export.integration.video;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the key=value lines ffmpeg writes with {@code -progress pipe:1}.
 */
public class FfmpegProgressParser {

    static final double MAX_RUNNING_PERCENT = 99.0;
    private static final Pattern PROGRESS_LINE = Pattern.compile("^[a-z_0-9]+=\\S*$");
    private static final Pattern OUT_TIME = Pattern.compile("^(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)$");

    private final double expectedDurationSec;

    public FfmpegProgressParser(double expectedDurationSec) {
        this.expectedDurationSec = expectedDurationSec;
    }

    public static boolean isProgressLine(String line) {
        return line != null && PROGRESS_LINE.matcher(line.trim()).matches();
    }

    /**
     * Processed output time in seconds, if the line carries one.
     */
    public OptionalDouble processedSeconds(String line) {
        if (line == null) {
            return OptionalDouble.empty();
        }
        String trimmed = line.trim();
        int separator = trimmed.indexOf('=');
        if (separator < 0) {
            return OptionalDouble.empty();
        }
        String key = trimmed.substring(0, separator);
        String value = trimmed.substring(separator + 1);
        if (value.isEmpty() || "N/A".equals(value)) {
            return OptionalDouble.empty();
        }

        try {
            switch (key) {
                // ffmpeg reports out_time_ms in microseconds as well.
                case "out_time_us":
                case "out_time_ms":
                    return OptionalDouble.of(Long.parseLong(value) / 1_000_000.0);
                case "out_time":
                    return parseClock(value);
                default:
                    return OptionalDouble.empty();
            }
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Percentage of the expected output duration, clamped to {@code [0, 99]}.
     */
    public OptionalDouble percent(String line) {
        OptionalDouble seconds = processedSeconds(line);
        if (seconds.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(toPercent(seconds.getAsDouble()));
    }

    double toPercent(double processedSeconds) {
        if (!(expectedDurationSec > 0.0)) {
            return 0.0;
        }
        double percent = processedSeconds / expectedDurationSec * 100.0;
        return Math.max(0.0, Math.min(MAX_RUNNING_PERCENT, percent));
    }

    private OptionalDouble parseClock(String value) {
        Matcher matcher = OUT_TIME.matcher(value);
        if (!matcher.matches()) {
            return OptionalDouble.empty();
        }
        double hours = Double.parseDouble(matcher.group(1));
        double minutes = Double.parseDouble(matcher.group(2));
        double seconds = Double.parseDouble(matcher.group(3));
        return OptionalDouble.of(hours * 3600.0 + minutes * 60.0 + seconds);
    }
}
