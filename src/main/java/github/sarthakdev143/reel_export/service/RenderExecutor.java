package github.sarthakdev143.reel_export.service;

import github.sarthakdev143.reel_export.compiler.CompiledGraph;
import github.sarthakdev143.reel_export.model.OutputProfile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs a compiled graph through the external encoder. Blocks the calling worker until the encoder exits.
 */
public interface RenderExecutor {

    /**
     * @throws IOException when the encoder cannot start, exits non-zero, times out or is cancelled
     */
    void render(String jobId, CompiledGraph graph, OutputProfile profile, Path outputPath, ProgressListener listener)
            throws IOException, InterruptedException;

    /**
     * Destroys the encoder currently running for the job.
     *
     * @return false if no encoder is running for it
     */
    boolean cancel(String jobId);

    int cancelAll();
}
