package github.sarthakdev143.reel_export.model;

public enum ExportStrategy {
    /** One encoder run over the whole compiled timeline. */
    SINGLE_PASS,
    /** Every clip is normalized into an intermediate chunk before the final pass. */
    CHUNKED
}
