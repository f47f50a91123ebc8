package github.sarthakdev143.reel_export.compiler;

/**
 * Raised when a timeline cannot be compiled: unsupported layout, overlapping clips, unresolved media.
 */
public class InvalidTimelineException extends IllegalArgumentException {

    public InvalidTimelineException(String message) {
        super(message);
    }
}
