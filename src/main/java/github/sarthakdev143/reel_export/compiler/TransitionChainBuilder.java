package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterChain;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds ordered per-clip streams into one continuous video and one continuous audio stream.
 * <p>
 * {@code chainEnd} is the duration of the stream built so far. A cross-fade starts at
 * {@code chainEnd - d} and leaves {@code offset + nextDuration}; a hard cut adds the next clip's
 * full duration. Overlaps that would need a negative offset fall back to a hard cut.
 */
public class TransitionChainBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TransitionChainBuilder.class);

    public ChainResult fold(List<Clip> clips, List<ClipStreams> streams, FilterGraph.Builder graph) {
        if (clips.isEmpty() || clips.size() != streams.size()) {
            throw new IllegalArgumentException("Every clip needs exactly one stream pair to build a chain.");
        }

        StreamLabel video = streams.get(0).video();
        StreamLabel audio = streams.get(0).audio();
        double chainEnd = streams.get(0).durationSec();
        List<ChainBoundary> boundaries = new ArrayList<>();

        boolean fadeInApplied = false;
        Transition opening = clips.get(0).transitionStart();
        if (opening != null && opening.isActive()) {
            StreamLabel fadedVideo = StreamLabel.of("v0_faded");
            StreamLabel fadedAudio = StreamLabel.of("a0_faded");
            graph.add(FilterChain.of(video, List.of(fade("in", 0.0, opening)), fadedVideo));
            graph.add(FilterChain.of(audio, List.of(audioFade("in", 0.0, opening)), fadedAudio));
            video = fadedVideo;
            audio = fadedAudio;
            fadeInApplied = true;
        }

        for (int index = 0; index < clips.size() - 1; index++) {
            Transition transition = resolveBoundaryTransition(clips.get(index), clips.get(index + 1));
            ClipStreams next = streams.get(index + 1);
            StreamLabel mergedVideo = StreamLabel.of("vm" + (index + 1));
            StreamLabel mergedAudio = StreamLabel.of("am" + (index + 1));

            if (transition == null) {
                concat(video, audio, next, mergedVideo, mergedAudio, graph);
                chainEnd += next.durationSec();
                boundaries.add(new ChainBoundary(index, BoundaryKind.CONCAT, null, 0.0, 0.0, chainEnd));
            } else {
                double offset = chainEnd - transition.durationSec();
                if (offset < 0.0) {
                    logger.warn(
                            "Transition {} -> {} needs {}s but only {}s are built; falling back to a hard cut",
                            index,
                            index + 1,
                            transition.durationSec(),
                            chainEnd);
                    concat(video, audio, next, mergedVideo, mergedAudio, graph);
                    chainEnd += next.durationSec();
                    boundaries.add(new ChainBoundary(
                            index,
                            BoundaryKind.FALLBACK_CONCAT,
                            transition.type(),
                            transition.durationSec(),
                            0.0,
                            chainEnd));
                } else {
                    graph.add(FilterChain.of(
                            List.of(video, next.video()),
                            Filter.named("xfade")
                                    .option("transition", transition.type().xfadeTransition())
                                    .option("duration", FilterValues.seconds(transition.durationSec()))
                                    .option("offset", FilterValues.seconds(offset)),
                            mergedVideo));
                    graph.add(FilterChain.of(
                            List.of(audio, next.audio()),
                            Filter.named("acrossfade")
                                    .option("d", FilterValues.seconds(transition.durationSec()))
                                    .option("c1", "tri")
                                    .option("c2", "tri"),
                            mergedAudio));
                    chainEnd = offset + next.durationSec();
                    boundaries.add(new ChainBoundary(
                            index,
                            BoundaryKind.CROSSFADE,
                            transition.type(),
                            transition.durationSec(),
                            offset,
                            chainEnd));
                }
            }
            video = mergedVideo;
            audio = mergedAudio;
        }

        boolean fadeOutApplied = false;
        Transition closing = clips.get(clips.size() - 1).transitionEnd();
        if (closing != null && closing.isActive()) {
            double fadeOutStart = chainEnd - closing.durationSec();
            if (fadeOutStart > 0.0) {
                StreamLabel fadedVideo = StreamLabel.of("v_final_faded");
                StreamLabel fadedAudio = StreamLabel.of("a_final_faded");
                graph.add(FilterChain.of(video, List.of(fade("out", fadeOutStart, closing)), fadedVideo));
                graph.add(FilterChain.of(audio, List.of(audioFade("out", fadeOutStart, closing)), fadedAudio));
                video = fadedVideo;
                audio = fadedAudio;
                fadeOutApplied = true;
            } else {
                logger.warn(
                        "Skipping {}s fade-out: the chain is only {}s long",
                        closing.durationSec(),
                        chainEnd);
            }
        }

        return new ChainResult(video, audio, chainEnd, boundaries, fadeInApplied, fadeOutApplied);
    }

    /**
     * The earlier clip's outgoing transition wins over the later clip's incoming one.
     */
    static Transition resolveBoundaryTransition(Clip current, Clip next) {
        if (current.transitionEnd() != null && current.transitionEnd().isActive()) {
            return current.transitionEnd();
        }
        if (next.transitionStart() != null && next.transitionStart().isActive()) {
            return next.transitionStart();
        }
        return null;
    }

    private void concat(
            StreamLabel video,
            StreamLabel audio,
            ClipStreams next,
            StreamLabel mergedVideo,
            StreamLabel mergedAudio,
            FilterGraph.Builder graph) {
        graph.add(FilterChain.of(
                List.of(video, next.video()),
                Filter.named("concat").option("n", 2).option("v", 1).option("a", 0),
                mergedVideo));
        graph.add(FilterChain.of(
                List.of(audio, next.audio()),
                Filter.named("concat").option("n", 2).option("v", 0).option("a", 1),
                mergedAudio));
    }

    private Filter fade(String direction, double start, Transition transition) {
        return Filter.named("fade")
                .option("t", direction)
                .option("st", FilterValues.seconds(start))
                .option("d", FilterValues.seconds(transition.durationSec()))
                .option("color", transition.type().fadeColor());
    }

    private Filter audioFade(String direction, double start, Transition transition) {
        return Filter.named("afade")
                .option("t", direction)
                .option("st", FilterValues.seconds(start))
                .option("d", FilterValues.seconds(transition.durationSec()));
    }
}
