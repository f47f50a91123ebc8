package github.sarthakdev143.reel_export.model.timeline;

/**
 * Pan/zoom sample; {@code x} and {@code y} are normalized crop centers, {@code time} is relative to the clip's source start.
 */
public record ReframeKeyframe(
        double time,
        double x,
        double y,
        double scale) {
}
