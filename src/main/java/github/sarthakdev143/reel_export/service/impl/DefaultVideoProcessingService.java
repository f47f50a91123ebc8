package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.compiler.CompiledGraph;
import github.sarthakdev143.reel_export.compiler.RetimeGraphBuilder;
import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.OutputProfile;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.model.timeline.MediaProbe;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.MediaProber;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import github.sarthakdev143.reel_export.service.VideoProcessingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Service
public class DefaultVideoProcessingService implements VideoProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultVideoProcessingService.class);

    private final RetimeGraphBuilder retimeGraphBuilder;
    private final MediaProber mediaProber;
    private final RenderExecutor renderExecutor;
    private final JobRegistry jobRegistry;
    private final TaskExecutor taskExecutor;
    private final ReelExportProperties properties;
    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public DefaultVideoProcessingService(
            RetimeGraphBuilder retimeGraphBuilder,
            MediaProber mediaProber,
            RenderExecutor renderExecutor,
            JobRegistry jobRegistry,
            @Qualifier("renderTaskExecutor") TaskExecutor taskExecutor,
            ReelExportProperties properties,
            MeterRegistry meterRegistry) {
        this.retimeGraphBuilder = retimeGraphBuilder;
        this.mediaProber = mediaProber;
        this.renderExecutor = renderExecutor;
        this.jobRegistry = jobRegistry;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        this.submittedCounter = meterRegistry.counter("reel_export.jobs.submitted", "kind", "process_video");
        this.completedCounter = meterRegistry.counter("reel_export.jobs.completed", "kind", "process_video");
        this.failedCounter = meterRegistry.counter("reel_export.jobs.failed", "kind", "process_video");
    }

    @Override
    public String submitJob(MultipartFile video, int targetFps, double speed) throws IOException {
        Path uploadsDir = Files.createDirectories(properties.uploadsPath());
        Path outputsDir = Files.createDirectories(properties.outputsPath());
        Path inputPath = uploadsDir.resolve(UUID.randomUUID() + "-"
                + WorkspaceFiles.sanitizeFilename(video.getOriginalFilename(), "video.mp4"));

        try {
            video.transferTo(inputPath);
        } catch (IOException e) {
            WorkspaceFiles.deleteIfExists(inputPath);
            throw e;
        }

        RenderJob job = jobRegistry.create(
                JobKind.PROCESS_VIDEO,
                null,
                jobId -> outputsDir.resolve("processed-" + jobId + ".mp4"));
        submittedCounter.increment();

        logger.info("Accepted process-video job {} targetFps={} speed={} input={}", job.jobId(), targetFps, speed, inputPath);

        try {
            taskExecutor.execute(() -> processJob(job.jobId(), inputPath, job.outputPath(), targetFps, speed));
        } catch (RuntimeException e) {
            jobRegistry.markFailed(job.jobId(), "Job could not be scheduled.");
            failedCounter.increment();
            WorkspaceFiles.deleteIfExists(inputPath);
            throw e;
        }
        return job.jobId();
    }

    private void processJob(String jobId, Path inputPath, Path outputPath, int targetFps, double speed) {
        try {
            MediaProbe probe;
            try {
                probe = mediaProber.probe(inputPath);
            } catch (IOException e) {
                throw new IOException("Failed to read video metadata", e);
            }
            if (!probe.hasVideo()) {
                throw new IOException("Uploaded file has no video stream.");
            }

            MediaSource source = new MediaSource(
                    inputPath.getFileName().toString(),
                    inputPath,
                    MediaKind.VIDEO,
                    probe.durationSec(),
                    probe.hasAudio());
            CompiledGraph graph = retimeGraphBuilder.build(source, targetFps, speed);

            if (jobRegistry.find(jobId).map(job -> job.state().isTerminal()).orElse(true)) {
                throw new IOException("Job cancelled.");
            }
            renderExecutor.render(
                    jobId,
                    graph,
                    OutputProfile.PROCESSED_CLIP,
                    outputPath,
                    percent -> jobRegistry.updateProgress(jobId, percent));

            if (jobRegistry.markDone(jobId)) {
                completedCounter.increment();
                logger.info("Completed process-video job {} output={}", jobId, outputPath);
            } else {
                WorkspaceFiles.deleteIfExists(outputPath);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(jobId, outputPath, "Video processing was interrupted.", e);
        } catch (Exception e) {
            fail(jobId, outputPath, e.getMessage() == null ? "Video processing failed. Check server logs." : e.getMessage(), e);
        } finally {
            WorkspaceFiles.deleteIfExists(inputPath);
        }
    }

    private void fail(String jobId, Path outputPath, String message, Exception cause) {
        if (jobRegistry.markFailed(jobId, message)) {
            failedCounter.increment();
            logger.error("Video processing job {} failed", jobId, cause);
        } else {
            logger.info("Video processing job {} stopped after it was cancelled: {}", jobId, cause.getMessage());
        }
        WorkspaceFiles.deleteIfExists(outputPath);
    }
}
