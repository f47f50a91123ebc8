package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;

/**
 * Output ports of one clip's isolated sub-graph together with its effective duration.
 */
public record ClipStreams(
        StreamLabel video,
        StreamLabel audio,
        double durationSec) {
}
