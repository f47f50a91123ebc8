package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;

import java.util.List;

public record ChainResult(
        StreamLabel video,
        StreamLabel audio,
        double chainEndSec,
        List<ChainBoundary> boundaries,
        boolean fadeInApplied,
        boolean fadeOutApplied) {

    public ChainResult {
        boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
    }

    public long fallbackCount() {
        return boundaries.stream().filter(boundary -> boundary.kind() == BoundaryKind.FALLBACK_CONCAT).count();
    }
}
