package github.sarthakdev143.reel_export.compiler;

public enum BoundaryKind {
    CROSSFADE,
    CONCAT,
    /** A transition was requested but the built chain was too short to overlap. */
    FALLBACK_CONCAT
}
