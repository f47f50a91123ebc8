package github.sarthakdev143.reel_export.service;

/**
 * Receives encoder progress as a percentage of the expected output duration.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(double percent);

    /**
     * Maps this listener's 0-100 range onto {@code [from, to]} of the receiving listener.
     */
    static ProgressListener scaled(ProgressListener target, double from, double to) {
        return percent -> target.onProgress(from + (to - from) * (percent / 100.0));
    }
}
