package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.model.LayoutType;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.MixDuration;
import github.sarthakdev143.reel_export.model.TrackKind;
import github.sarthakdev143.reel_export.model.TransitionType;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.model.timeline.Track;
import github.sarthakdev143.reel_export.model.timeline.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineCompilerTest {

    private TimelineCompiler compiler;
    private Map<String, MediaSource> sources;

    @BeforeEach
    void setUp() {
        compiler = new TimelineCompiler(MixDuration.SHORTEST);
        sources = new HashMap<>();
        sources.put("a", video("a.mp4"));
        sources.put("b", video("b.mp4"));
    }

    @Test
    void compilesCrossDissolveTimelineToFinalPorts() {
        Timeline timeline = timeline(List.of(
                clip("a", 0.0, 5.0, null, new Transition(TransitionType.CROSS_DISSOLVE, 2.0)),
                clip("b", 5.0, 5.0, null, null)), List.of());

        CompiledGraph graph = compiler.compile(timeline, sources);

        assertThat(graph.durationSec()).isEqualTo(8.0);
        assertThat(graph.videoOutput().name()).isEqualTo("v_final");
        assertThat(graph.audioOutput().name()).isEqualTo("a_mixed");
        assertThat(graph.inputs()).extracting(GraphInput::path)
                .containsExactly(Path.of("/media/a.mp4"), Path.of("/media/b.mp4"));
        assertThat(graph.filterComplex())
                .contains("xfade=transition=fade:duration=2.000:offset=3.000[vm1]")
                .contains("[vm1]null[v_final]")
                .contains("[am1]aresample=48000[a_final]")
                .endsWith("[a_final]anull[a_mixed]");
    }

    @Test
    void compilingTwiceYieldsTheSameGraph() {
        Timeline timeline = timeline(List.of(
                clip("a", 0.0, 4.0, new Transition(TransitionType.FADE_IN, 1.0), null),
                clip("b", 4.0, 3.0, null, new Transition(TransitionType.FADE_OUT, 1.0))), List.of());

        assertThat(compiler.compile(timeline, sources).filterComplex())
                .isEqualTo(compiler.compile(timeline, sources).filterComplex());
    }

    @Test
    void ordersClipsByTimelineStartAndCollapsesGaps() {
        Timeline timeline = timeline(List.of(
                clip("b", 20.0, 3.0, null, null),
                clip("a", 0.0, 2.0, null, null)), List.of());

        CompiledGraph graph = compiler.compile(timeline, sources);

        assertThat(graph.durationSec()).isEqualTo(5.0);
        assertThat(graph.inputs()).extracting(GraphInput::path)
                .containsExactly(Path.of("/media/a.mp4"), Path.of("/media/b.mp4"));
    }

    @Test
    void musicTrackInputsFollowTheVideoClips() {
        sources.put("music", new MediaSource("song.mp3", Path.of("/media/song.mp3"), MediaKind.AUDIO, 60.0, true));
        sources.put("muted", new MediaSource("voice.mp3", Path.of("/media/voice.mp3"), MediaKind.AUDIO, 60.0, true));
        Track music = new Track("music-track", TrackKind.AUDIO, List.of(clip("music", 1.0, 4.0, null, null)), 0.5, false);
        Track mutedTrack = new Track("voice-track", TrackKind.AUDIO, List.of(clip("muted", 0.0, 4.0, null, null)), 1.0, true);
        Timeline timeline = timeline(List.of(
                clip("a", 0.0, 3.0, null, null),
                clip("b", 3.0, 3.0, null, null)), List.of(music, mutedTrack));

        CompiledGraph graph = compiler.compile(timeline, sources);

        assertThat(graph.inputs()).hasSize(3);
        assertThat(graph.inputs().get(2).path()).isEqualTo(Path.of("/media/song.mp3"));
        assertThat(graph.filterComplex())
                .contains("[2:a]atrim=start=0.000:duration=4.000,asetpts=PTS-STARTPTS,adelay=1000|1000")
                .contains("amix=inputs=2:duration=shortest:dropout_transition=2[a_mixed]")
                .doesNotContain("voice");
    }

    @Test
    void rejectsEmptyVideoTrack() {
        assertThatThrownBy(() -> compiler.compile(timeline(List.of(), List.of()), sources))
                .isInstanceOf(InvalidTimelineException.class)
                .hasMessage("No clips to export.");
    }

    @Test
    void rejectsOverlappingClips() {
        Timeline timeline = timeline(List.of(
                clip("a", 0.0, 5.0, null, null),
                clip("b", 4.0, 5.0, null, null)), List.of());

        assertThatThrownBy(() -> compiler.compile(timeline, sources))
                .isInstanceOf(InvalidTimelineException.class)
                .hasMessageContaining("overlap");
    }

    @Test
    void rejectsLayoutsOtherThanSolo() {
        Track track = new Track("video", TrackKind.VIDEO, List.of(clip("a", 0.0, 2.0, null, null)), 1.0, false);
        Timeline timeline = new Timeline(List.of(track), List.of(), 2.0, LayoutType.DUET_VERTICAL);

        assertThatThrownBy(() -> compiler.compile(timeline, sources))
                .isInstanceOf(InvalidTimelineException.class)
                .hasMessageContaining("duet-vertical");
    }

    @Test
    void rejectsSecondVideoTrackWithClips() {
        Track first = new Track("v1", TrackKind.VIDEO, List.of(clip("a", 0.0, 2.0, null, null)), 1.0, false);
        Track second = new Track("v2", TrackKind.VIDEO, List.of(clip("b", 0.0, 2.0, null, null)), 1.0, false);

        assertThatThrownBy(() -> compiler.compile(new Timeline(List.of(first, second), List.of(), 2.0, null), sources))
                .isInstanceOf(InvalidTimelineException.class);
    }

    @Test
    void reportsClipWithoutResolvedMedia() {
        Timeline timeline = timeline(List.of(clip("missing", 0.0, 2.0, null, null)), List.of());

        assertThatThrownBy(() -> compiler.compile(timeline, sources))
                .isInstanceOf(InvalidTimelineException.class)
                .hasMessage("Video file not found for clip missing.");
    }

    @Test
    void rejectsAudioOnlyMediaOnTheVideoTrack() {
        sources.put("a", new MediaSource("a.mp3", Path.of("/media/a.mp3"), MediaKind.AUDIO, 10.0, true));

        assertThatThrownBy(() -> compiler.compile(timeline(List.of(clip("a", 0.0, 2.0, null, null)), List.of()), sources))
                .isInstanceOf(InvalidTimelineException.class)
                .hasMessageContaining("audio-only");
    }

    @Test
    void compileClipBuildsAStandaloneChunkGraph() {
        CompiledGraph graph = compiler.compileClip(clip("a", 3.0, 2.5, null, null), sources.get("a"), 1.0, false);

        assertThat(graph.videoOutput().name()).isEqualTo("v0");
        assertThat(graph.audioOutput().name()).isEqualTo("a0");
        assertThat(graph.durationSec()).isEqualTo(2.5);
        assertThat(graph.filterComplex()).doesNotContain("xfade").doesNotContain("amix");
    }

    private Timeline timeline(List<Clip> clips, List<Track> audioTracks) {
        Track video = new Track("video", TrackKind.VIDEO, clips, 1.0, false);
        return new Timeline(List.of(video), audioTracks, 0.0, LayoutType.SOLO);
    }

    private Clip clip(String id, double timelineStart, double duration, Transition start, Transition end) {
        return new Clip(id, id, 0.0, duration, timelineStart, start, end, null, List.of(), 1.0, false, null);
    }

    private MediaSource video(String filename) {
        return new MediaSource(filename, Path.of("/media/" + filename), MediaKind.VIDEO, 30.0, true);
    }
}
