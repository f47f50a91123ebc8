package github.sarthakdev143.reel_export.model;

public enum JobKind {
    PROCESS_VIDEO,
    EXPORT
}
