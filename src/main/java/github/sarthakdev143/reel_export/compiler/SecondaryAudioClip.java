package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;

/**
 * A music or voice clip from an audio track, bound to the encoder input that carries it.
 */
public record SecondaryAudioClip(
        int inputIndex,
        Clip clip,
        MediaSource source,
        double trackVolume) {
}
