package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.Filter;
import github.sarthakdev143.reel_export.compiler.graph.FilterChain;
import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;
import github.sarthakdev143.reel_export.model.MixDuration;
import github.sarthakdev143.reel_export.model.timeline.Clip;

import java.util.ArrayList;
import java.util.List;

/**
 * Places secondary audio clips on the timeline by delay alone and mixes them into the master audio.
 */
public class AudioMixStage {

    static final StreamLabel MIXED = StreamLabel.of("a_mixed");

    private final MixDuration mixDuration;

    public AudioMixStage(MixDuration mixDuration) {
        this.mixDuration = mixDuration;
    }

    public StreamLabel mix(StreamLabel master, List<SecondaryAudioClip> secondaryClips, FilterGraph.Builder graph) {
        if (secondaryClips.isEmpty()) {
            graph.add(FilterChain.of(master, List.of(Filter.named("anull")), MIXED));
            return MIXED;
        }

        List<StreamLabel> mixInputs = new ArrayList<>();
        mixInputs.add(master);
        for (SecondaryAudioClip secondary : secondaryClips) {
            mixInputs.add(place(secondary, graph));
        }

        graph.add(FilterChain.of(
                mixInputs,
                Filter.named("amix")
                        .option("inputs", mixInputs.size())
                        .option("duration", mixDuration.toFilterValue())
                        .option("dropout_transition", 2),
                MIXED));
        return MIXED;
    }

    private StreamLabel place(SecondaryAudioClip secondary, FilterGraph.Builder graph) {
        Clip clip = secondary.clip();
        int inputIndex = secondary.inputIndex();
        String delay = FilterValues.milliseconds(clip.timelineStart());
        StreamLabel out = StreamLabel.of("a" + inputIndex + "_out");

        graph.add(FilterChain.of(StreamLabel.audioInput(inputIndex), List.of(
                Filter.named("atrim")
                        .option("start", FilterValues.seconds(clip.sourceStart()))
                        .option("duration", FilterValues.seconds(clip.durationSec())),
                Filter.named("asetpts").positional("PTS-STARTPTS"),
                Filter.named("adelay").positional(delay + "|" + delay),
                Filter.named("volume").positional(FilterValues.decimal(secondary.trackVolume() * clip.volume())),
                Filter.named("aresample").positional(Integer.toString(ClipGraphBuilder.SAMPLE_RATE))), out));
        return out;
    }
}
