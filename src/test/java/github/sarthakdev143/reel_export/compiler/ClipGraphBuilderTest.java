package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.ColorGrading;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.ReframeKeyframe;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ClipGraphBuilderTest {

    private final ClipGraphBuilder builder = new ClipGraphBuilder();

    @Test
    void videoChainTrimsCropsAndNormalizesInFixedOrder() {
        FilterGraph.Builder graph = FilterGraph.builder();

        ClipStreams streams = builder.build(0, clip(2.0, 7.0, null, List.of(), 1.0, false), video(), 1.0, false, graph);

        assertThat(streams.durationSec()).isEqualTo(5.0);
        assertThat(graph.build().serialize()).startsWith(
                "[0:v]trim=start=2.000:duration=5.000,setpts=PTS-STARTPTS,"
                        + "scale=1080:1920:force_original_aspect_ratio=increase,"
                        + "crop=1080:1920:(iw-1080)/2:(ih-1920)/2,"
                        + "setsar=1,fps=30,format=yuv420p[v0];");
    }

    @Test
    void reframeCropFollowsClampedAverageKeyframeX() {
        List<ReframeKeyframe> keyframes = List.of(
                new ReframeKeyframe(0.0, -1.0, 0.2, 2.0),
                new ReframeKeyframe(1.0, 1.5, 0.8, 1.0));

        String filters = serialize(builder.videoFilters(clip(0.0, 4.0, null, keyframes, 1.0, false)));

        assertThat(filters).contains("crop=1080:1920:max(0\\,min(iw-1080\\,(0.500*iw)-(1080/2))):(ih-1920)/2");
        assertThat(filters).doesNotContain("zoompan");
    }

    @Test
    void colorGradeIsOnlyEmittedForNonNeutralValues() {
        String neutral = serialize(builder.videoFilters(clip(0.0, 4.0, ColorGrading.NEUTRAL, List.of(), 1.0, false)));
        String graded = serialize(builder.videoFilters(
                clip(0.0, 4.0, new ColorGrading(1.2, 1.0, 1.5, 0.2, 0.5), List.of(), 1.0, false)));

        assertThat(neutral).doesNotContain("eq=").doesNotContain("unsharp");
        assertThat(graded).endsWith("eq=brightness=0.300:saturation=1.500,unsharp=5:5:0.75:5:5:0.0");
    }

    @Test
    void brightnessPlusExposureIsClampedToTheEqRange() {
        String brightest = serialize(builder.videoFilters(
                clip(0.0, 4.0, new ColorGrading(2.0, 1.0, 1.0, 1.0, 0.0), List.of(), 1.0, false)));
        String darkest = serialize(builder.videoFilters(
                clip(0.0, 4.0, new ColorGrading(0.0, 1.0, 1.0, -1.0, 0.0), List.of(), 1.0, false)));

        assertThat(brightest).endsWith("eq=brightness=1.000");
        assertThat(darkest).endsWith("eq=brightness=-1.000");
    }

    @Test
    void audioChainAppliesTrackAndClipVolume() {
        FilterGraph.Builder graph = FilterGraph.builder();

        builder.build(3, clip(2.0, 7.0, null, List.of(), 0.8, false), video(), 0.5, false, graph);

        assertThat(graph.build().serialize()).endsWith(
                "[3:a]atrim=start=2.000:duration=5.000,asetpts=PTS-STARTPTS,aresample=48000,volume=0.400[a3]");
    }

    @Test
    void mutedClipKeepsItsAudioSlotAtZeroVolume() {
        assertThat(ClipGraphBuilder.effectiveVolume(clip(0.0, 1.0, null, List.of(), 0.8, true), 1.0, false)).isZero();
        assertThat(ClipGraphBuilder.effectiveVolume(clip(0.0, 1.0, null, List.of(), 0.8, false), 1.0, true)).isZero();
        assertThat(ClipGraphBuilder.effectiveVolume(clip(0.0, 1.0, null, List.of(), 0.8, false), 0.5, false)).isEqualTo(0.4);
    }

    @Test
    void imageClipGetsSilenceMatchingItsDurationAndALoopedInput() {
        Clip clip = clip(0.0, 3.0, null, List.of(), 1.0, false);
        MediaSource image = new MediaSource("photo.png", Path.of("/tmp/photo.png"), MediaKind.IMAGE, 0.0, false);
        FilterGraph.Builder graph = FilterGraph.builder();

        ClipStreams streams = builder.build(0, clip, image, 1.0, false, graph);

        assertThat(graph.build().serialize())
                .endsWith("anullsrc=channel_layout=stereo:sample_rate=48000:duration=3.000[a0]");
        assertThat(streams.durationSec()).isEqualTo(clip.durationSec());
        assertThat(builder.inputFor(clip, image).options()).containsExactly("-loop", "1", "-t", "3.500");
        assertThat(builder.inputFor(clip, video()).options()).isEmpty();
    }

    private String serialize(List<Filter> filters) {
        return filters.stream().map(Filter::serialize).collect(Collectors.joining(","));
    }

    private Clip clip(
            double sourceStart,
            double sourceEnd,
            ColorGrading grading,
            List<ReframeKeyframe> keyframes,
            double volume,
            boolean muted) {
        return new Clip("c1", "clip.mp4", sourceStart, sourceEnd, 0.0, null, null, grading, keyframes, volume, muted, null);
    }

    private MediaSource video() {
        return new MediaSource("clip.mp4", Path.of("/tmp/clip.mp4"), MediaKind.VIDEO, 30.0, true);
    }
}
