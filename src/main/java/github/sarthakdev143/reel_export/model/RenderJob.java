package github.sarthakdev143.reel_export.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Immutable snapshot of one render job. The registry replaces snapshots atomically per id.
 */
public record RenderJob(
        String jobId,
        JobKind kind,
        JobState state,
        double progress,
        Path outputPath,
        String filename,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt) {

    public RenderJob withProgress(double newProgress, Instant now) {
        return new RenderJob(jobId, kind, state, newProgress, outputPath, filename, errorMessage, createdAt, now);
    }

    public RenderJob withTerminalState(JobState newState, double newProgress, String newErrorMessage, Instant now) {
        return new RenderJob(jobId, kind, newState, newProgress, outputPath, filename, newErrorMessage, createdAt, now);
    }
}
