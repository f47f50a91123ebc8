package github.sarthakdev143.reel_export.service;

import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.RenderJob;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lifecycle store for render jobs. Every mutation is atomic for its job id; terminal states are final.
 */
public interface JobRegistry {

    /**
     * Registers a new {@code processing} job under a fresh opaque id.
     *
     * @param filename download name; defaults to the artifact's file name when null
     * @param outputLocator maps the assigned id to the job's artifact path
     */
    RenderJob create(JobKind kind, String filename, Function<String, Path> outputLocator);

    Optional<RenderJob> find(String jobId);

    /**
     * Raises progress while the job is processing. Values are clamped below 100 and never decrease.
     */
    void updateProgress(String jobId, double percent);

    /**
     * @return true if this call moved the job out of {@code processing}
     */
    boolean markDone(String jobId);

    /**
     * @return true if this call moved the job out of {@code processing}
     */
    boolean markFailed(String jobId, String errorMessage);

    List<RenderJob> removeAll();
}
