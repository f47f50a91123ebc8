package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterChain;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Frame interpolation followed by time remapping for a single uploaded video.
 * Interpolation runs first so the remapped stream has enough frames and never shows dropped-frame gaps.
 */
public class RetimeGraphBuilder {

    static final double MIN_TEMPO_STAGE = 0.5;
    static final double MAX_TEMPO_STAGE = 2.0;
    private static final double TEMPO_TOLERANCE = 1e-9;
    private static final StreamLabel VIDEO_OUT = StreamLabel.of("v_out");
    private static final StreamLabel AUDIO_OUT = StreamLabel.of("a_out");

    public CompiledGraph build(MediaSource source, int targetFps, double speed) {
        if (!(speed > 0.0) || !Double.isFinite(speed)) {
            throw new IllegalArgumentException("speed must be a positive finite number.");
        }

        FilterGraph.Builder graph = FilterGraph.builder();
        graph.add(FilterChain.of(StreamLabel.videoInput(0), List.of(
                Filter.named("minterpolate")
                        .option("fps", targetFps)
                        .option("mi_mode", "mci")
                        .option("mc_mode", "aobmc")
                        .option("me_mode", "bidir")
                        .option("vsbmc", 1)
                        .option("scd", "fdiff"),
                Filter.named("setpts").positional(FilterValues.twoDecimals(1.0 / speed) + "*PTS")), VIDEO_OUT));

        StreamLabel audioOut = null;
        if (source.hasAudio()) {
            List<Filter> audioFilters = new ArrayList<>();
            for (double factor : tempoStages(speed)) {
                audioFilters.add(Filter.named("atempo").positional(formatTempo(factor)));
            }
            audioFilters.add(Filter.named("volume").positional("0.98"));
            audioFilters.add(Filter.named("aresample").positional(Integer.toString(ClipGraphBuilder.SAMPLE_RATE)).option("async", 1));
            graph.add(FilterChain.of(StreamLabel.audioInput(0), audioFilters, AUDIO_OUT));
            audioOut = AUDIO_OUT;
        }

        return new CompiledGraph(
                List.of(GraphInput.of(source.path())),
                graph.build(),
                VIDEO_OUT,
                audioOut,
                source.durationSec() / speed,
                List.of());
    }

    /**
     * Splits a tempo factor into stages that each stay inside the filter's supported range.
     * The product of the stages equals {@code speed}.
     */
    static List<Double> tempoStages(double speed) {
        List<Double> stages = new ArrayList<>();
        double remaining = speed;
        while (remaining < MIN_TEMPO_STAGE - TEMPO_TOLERANCE) {
            stages.add(MIN_TEMPO_STAGE);
            remaining /= MIN_TEMPO_STAGE;
        }
        while (remaining > MAX_TEMPO_STAGE + TEMPO_TOLERANCE) {
            stages.add(MAX_TEMPO_STAGE);
            remaining /= MAX_TEMPO_STAGE;
        }
        if (Math.abs(remaining - 1.0) > TEMPO_TOLERANCE || stages.isEmpty()) {
            stages.add(remaining);
        }
        return stages;
    }

    private static String formatTempo(double factor) {
        String formatted = FilterValues.decimal(factor);
        // 0.500 -> 0.5, 2.000 -> 2.0
        while (formatted.endsWith("0") && !formatted.endsWith(".0")) {
            formatted = formatted.substring(0, formatted.length() - 1);
        }
        return formatted;
    }
}
