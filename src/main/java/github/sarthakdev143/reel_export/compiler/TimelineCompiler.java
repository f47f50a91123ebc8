package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterChain;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;
import github.sarthakdev143.reel_export.model.LayoutType;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.MixDuration;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.model.timeline.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Side-effect free {@code compile(Timeline) -> graph}. Never mutates the timeline and never starts a process,
 * so compiling the same timeline twice yields the same graph.
 */
public class TimelineCompiler {

    private static final Logger logger = LoggerFactory.getLogger(TimelineCompiler.class);
    private static final double OVERLAP_TOLERANCE_SECONDS = 1e-6;
    static final StreamLabel VIDEO_FINAL = StreamLabel.of("v_final");
    static final StreamLabel AUDIO_FINAL = StreamLabel.of("a_final");

    private final ClipGraphBuilder clipGraphBuilder;
    private final TransitionChainBuilder transitionChainBuilder;
    private final AudioMixStage audioMixStage;

    public TimelineCompiler(MixDuration mixDuration) {
        this(new ClipGraphBuilder(), new TransitionChainBuilder(), new AudioMixStage(mixDuration));
    }

    public TimelineCompiler(
            ClipGraphBuilder clipGraphBuilder,
            TransitionChainBuilder transitionChainBuilder,
            AudioMixStage audioMixStage) {
        this.clipGraphBuilder = clipGraphBuilder;
        this.transitionChainBuilder = transitionChainBuilder;
        this.audioMixStage = audioMixStage;
    }

    /**
     * @param sourcesByClipId resolved media for every clip on every track, keyed by clip id
     * @throws InvalidTimelineException for unsupported layouts, overlapping clips or unresolved media
     */
    public CompiledGraph compile(Timeline timeline, Map<String, MediaSource> sourcesByClipId) {
        Track videoTrack = requireSoloVideoTrack(timeline);
        List<Clip> clips = orderedClips(videoTrack);
        if (clips.isEmpty()) {
            throw new InvalidTimelineException("No clips to export.");
        }
        requireNoOverlap(videoTrack, clips);

        FilterGraph.Builder graph = FilterGraph.builder();
        List<GraphInput> inputs = new ArrayList<>();
        List<ClipStreams> streams = new ArrayList<>();

        for (int index = 0; index < clips.size(); index++) {
            Clip clip = clips.get(index);
            MediaSource source = requireSource(clip, sourcesByClipId);
            if (source.kind() == MediaKind.AUDIO) {
                throw new InvalidTimelineException("Clip " + clip.clipId() + " on the video track references an audio-only file.");
            }
            inputs.add(clipGraphBuilder.inputFor(clip, source));
            streams.add(clipGraphBuilder.build(index, clip, source, videoTrack.volume(), videoTrack.muted(), graph));
            logger.debug(
                    "Clip {}: start={} end={} duration={} still={}",
                    index,
                    clip.sourceStart(),
                    clip.sourceEnd(),
                    clip.durationSec(),
                    source.isStill());
        }

        ChainResult chain = transitionChainBuilder.fold(clips, streams, graph);
        graph.add(FilterChain.of(chain.video(), List.of(Filter.named("null")), VIDEO_FINAL));
        graph.add(FilterChain.of(
                chain.audio(),
                List.of(Filter.named("aresample").positional(Integer.toString(ClipGraphBuilder.SAMPLE_RATE))),
                AUDIO_FINAL));

        List<SecondaryAudioClip> secondaryClips = new ArrayList<>();
        for (Track audioTrack : timeline.audioTracks()) {
            List<Clip> audioClips = orderedClips(audioTrack);
            requireNoOverlap(audioTrack, audioClips);
            if (audioTrack.muted()) {
                continue;
            }
            for (Clip clip : audioClips) {
                if (clip.muted()) {
                    continue;
                }
                MediaSource source = requireSource(clip, sourcesByClipId);
                if (!source.hasAudio()) {
                    throw new InvalidTimelineException("Clip " + clip.clipId() + " on an audio track has no audio stream.");
                }
                secondaryClips.add(new SecondaryAudioClip(inputs.size(), clip, source, audioTrack.volume()));
                inputs.add(GraphInput.of(source.path()));
            }
        }
        StreamLabel mixed = audioMixStage.mix(AUDIO_FINAL, secondaryClips, graph);

        logger.info(
                "Compiled timeline: clips={} musicClips={} chainEnd={}s fallbacks={}",
                clips.size(),
                secondaryClips.size(),
                chain.chainEndSec(),
                chain.fallbackCount());

        return new CompiledGraph(inputs, graph.build(), VIDEO_FINAL, mixed, chain.chainEndSec(), chain.boundaries());
    }

    /**
     * Single-clip graph used to render one intermediate chunk.
     */
    public CompiledGraph compileClip(Clip clip, MediaSource source, double trackVolume, boolean trackMuted) {
        FilterGraph.Builder graph = FilterGraph.builder();
        ClipStreams streams = clipGraphBuilder.build(0, clip, source, trackVolume, trackMuted, graph);
        return new CompiledGraph(
                List.of(clipGraphBuilder.inputFor(clip, source)),
                graph.build(),
                streams.video(),
                streams.audio(),
                streams.durationSec(),
                List.of());
    }

    private Track requireSoloVideoTrack(Timeline timeline) {
        LayoutType layout = timeline.layout() == null ? LayoutType.SOLO : timeline.layout();
        if (layout != LayoutType.SOLO) {
            throw new InvalidTimelineException("Only the solo layout with one video track is supported, got " + layout.toApiValue() + ".");
        }
        if (timeline.videoTracks().isEmpty()) {
            throw new InvalidTimelineException("The timeline has no video track.");
        }
        for (int index = 1; index < timeline.videoTracks().size(); index++) {
            if (!timeline.videoTracks().get(index).clips().isEmpty()) {
                throw new InvalidTimelineException("The solo layout supports a single video track with clips.");
            }
        }
        return timeline.videoTracks().get(0);
    }

    private List<Clip> orderedClips(Track track) {
        List<Clip> ordered = new ArrayList<>(track.clips());
        ordered.sort(Comparator.comparingDouble(Clip::timelineStart));
        return ordered;
    }

    private void requireNoOverlap(Track track, List<Clip> orderedClips) {
        for (int index = 1; index < orderedClips.size(); index++) {
            Clip previous = orderedClips.get(index - 1);
            Clip current = orderedClips.get(index);
            if (current.timelineStart() < previous.timelineEnd() - OVERLAP_TOLERANCE_SECONDS) {
                throw new InvalidTimelineException("Clips " + previous.clipId() + " and " + current.clipId()
                        + " overlap on track " + track.trackId() + ".");
            }
        }
    }

    private MediaSource requireSource(Clip clip, Map<String, MediaSource> sourcesByClipId) {
        MediaSource source = sourcesByClipId.get(clip.clipId());
        if (source == null) {
            throw new InvalidTimelineException("Video file not found for clip " + clip.clipId() + ".");
        }
        return source;
    }
}
