package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterChain;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.ColorGrading;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.ReframeKeyframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the isolated video and audio sub-graph of one clip.
 * <p>
 * Video stages run in a fixed order because each one relies on the shape produced by the previous:
 * trim, reframe or center crop to the output frame, pixel/frame-rate normalization, color grade.
 * Audio is trimmed to the same window, or synthesized as silence when the source has none.
 */
public class ClipGraphBuilder {

    static final int FRAME_WIDTH = 1080;
    static final int FRAME_HEIGHT = 1920;
    static final int FRAME_RATE = 30;
    static final int SAMPLE_RATE = 48000;
    static final String PIXEL_FORMAT = "yuv420p";
    private static final double NEUTRAL_TOLERANCE = 0.001;
    private static final double STILL_LOOP_PADDING_SECONDS = 0.5;
    private static final double MIN_EQ_BRIGHTNESS = -1.0;
    private static final double MAX_EQ_BRIGHTNESS = 1.0;

    /**
     * Encoder input for the clip's source. Stills are looped long enough to cover the trim window.
     */
    public GraphInput inputFor(Clip clip, MediaSource source) {
        if (source.isStill()) {
            return new GraphInput(source.path(), List.of(
                    "-loop", "1",
                    "-t", FilterValues.seconds(clip.sourceEnd() + STILL_LOOP_PADDING_SECONDS)));
        }
        return GraphInput.of(source.path());
    }

    public ClipStreams build(
            int inputIndex,
            Clip clip,
            MediaSource source,
            double trackVolume,
            boolean trackMuted,
            FilterGraph.Builder graph) {
        StreamLabel videoOut = StreamLabel.of("v" + inputIndex);
        StreamLabel audioOut = StreamLabel.of("a" + inputIndex);

        graph.add(FilterChain.of(StreamLabel.videoInput(inputIndex), videoFilters(clip), videoOut));
        graph.add(audioChain(inputIndex, clip, source, effectiveVolume(clip, trackVolume, trackMuted), audioOut));

        return new ClipStreams(videoOut, audioOut, clip.durationSec());
    }

    List<Filter> videoFilters(Clip clip) {
        List<Filter> filters = new ArrayList<>();
        filters.add(Filter.named("trim")
                .option("start", FilterValues.seconds(clip.sourceStart()))
                .option("duration", FilterValues.seconds(clip.durationSec())));
        filters.add(Filter.named("setpts").positional("PTS-STARTPTS"));

        filters.add(Filter.named("scale")
                .positional(Integer.toString(FRAME_WIDTH))
                .positional(Integer.toString(FRAME_HEIGHT))
                .option("force_original_aspect_ratio", "increase"));
        filters.add(cropFilter(clip.reframeKeyframes()));

        filters.add(Filter.named("setsar").positional("1"));
        filters.add(Filter.named("fps").positional(Integer.toString(FRAME_RATE)));
        filters.add(Filter.named("format").positional(PIXEL_FORMAT));

        ColorGrading grading = clip.colorGrading();
        if (grading != null) {
            appendColorGrade(grading, filters);
        }
        return filters;
    }

    private Filter cropFilter(List<ReframeKeyframe> keyframes) {
        int width = FRAME_WIDTH;
        int height = FRAME_HEIGHT;
        String yExpression = "(ih-" + height + ")/2";

        if (keyframes.isEmpty()) {
            return Filter.named("crop")
                    .positional(Integer.toString(width))
                    .positional(Integer.toString(height))
                    .positional("(iw-" + width + ")/2")
                    .positional(yExpression);
        }

        // Static pan: the crop follows the mean keyframe X. Keyframe scale and Y are not animated on export.
        double averageX = keyframes.stream()
                .mapToDouble(keyframe -> Math.max(0.0, Math.min(1.0, keyframe.x())))
                .average()
                .orElse(0.5);
        String xExpression = "max(0,min(iw-" + width + ",(" + FilterValues.decimal(averageX) + "*iw)-(" + width + "/2)))";

        return Filter.named("crop")
                .positional(Integer.toString(width))
                .positional(Integer.toString(height))
                .positional(xExpression)
                .positional(yExpression);
    }

    private void appendColorGrade(ColorGrading grading, List<Filter> filters) {
        // eq refuses brightness outside [-1, 1]; brightness plus exposure can exceed it.
        double brightness = Math.max(MIN_EQ_BRIGHTNESS, Math.min(MAX_EQ_BRIGHTNESS, grading.effectiveBrightness()));
        Filter eq = Filter.named("eq");
        boolean adjusted = false;
        if (Math.abs(brightness) > NEUTRAL_TOLERANCE) {
            eq = eq.option("brightness", FilterValues.decimal(brightness));
            adjusted = true;
        }
        if (Math.abs(grading.contrast() - 1.0) > NEUTRAL_TOLERANCE) {
            eq = eq.option("contrast", FilterValues.decimal(grading.contrast()));
            adjusted = true;
        }
        if (Math.abs(grading.saturation() - 1.0) > NEUTRAL_TOLERANCE) {
            eq = eq.option("saturation", FilterValues.decimal(grading.saturation()));
            adjusted = true;
        }
        if (adjusted) {
            filters.add(eq);
        }

        if (grading.sharpness() > 0.0) {
            filters.add(Filter.named("unsharp")
                    .positional("5")
                    .positional("5")
                    .positional(FilterValues.twoDecimals(grading.sharpness() * 1.5))
                    .positional("5")
                    .positional("5")
                    .positional("0.0"));
        }
    }

    private FilterChain audioChain(int inputIndex, Clip clip, MediaSource source, double volume, StreamLabel audioOut) {
        String duration = FilterValues.seconds(clip.durationSec());
        if (!source.hasAudio()) {
            return FilterChain.source(Filter.named("anullsrc")
                    .option("channel_layout", "stereo")
                    .option("sample_rate", SAMPLE_RATE)
                    .option("duration", duration), audioOut);
        }

        return FilterChain.of(StreamLabel.audioInput(inputIndex), List.of(
                Filter.named("atrim")
                        .option("start", FilterValues.seconds(clip.sourceStart()))
                        .option("duration", duration),
                Filter.named("asetpts").positional("PTS-STARTPTS"),
                Filter.named("aresample").positional(Integer.toString(SAMPLE_RATE)),
                Filter.named("volume").positional(FilterValues.decimal(volume))), audioOut);
    }

    static double effectiveVolume(Clip clip, double trackVolume, boolean trackMuted) {
        if (trackMuted || clip.muted()) {
            return 0.0;
        }
        return trackVolume * clip.volume();
    }
}
