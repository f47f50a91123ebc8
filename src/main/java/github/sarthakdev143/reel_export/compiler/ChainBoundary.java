package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.model.TransitionType;

/**
 * How the boundary between clip {@code index} and {@code index + 1} was joined.
 * {@code offset} is only meaningful for {@link BoundaryKind#CROSSFADE}.
 */
public record ChainBoundary(
        int index,
        BoundaryKind kind,
        TransitionType transitionType,
        double transitionDurationSec,
        double offsetSec,
        double chainEndSec) {
}
