package github.sarthakdev143.reel_export.model.timeline;

/**
 * Per-clip grade. Neutral values: brightness 1, contrast 1, saturation 1, exposure 0, sharpness 0.
 */
public record ColorGrading(
        double brightness,
        double contrast,
        double saturation,
        double exposure,
        double sharpness) {

    public static final ColorGrading NEUTRAL = new ColorGrading(1.0, 1.0, 1.0, 0.0, 0.0);

    public double effectiveBrightness() {
        return (brightness - 1.0) + exposure * 0.5;
    }
}
