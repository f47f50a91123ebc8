package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.compiler.BoundaryKind;
import github.sarthakdev143.reel_export.compiler.CompiledGraph;
import github.sarthakdev143.reel_export.compiler.TimelineCompiler;
import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.ContainerFormat;
import github.sarthakdev143.reel_export.model.ExportStrategy;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.OutputProfile;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.model.TrackKind;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.ColorGrading;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.model.timeline.Track;
import github.sarthakdev143.reel_export.service.ExportService;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.ProgressListener;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import github.sarthakdev143.reel_export.service.UploadedMedia;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class DefaultExportService implements ExportService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultExportService.class);
    private static final String DEFAULT_FILENAME = "export";
    private static final double CHUNK_PHASE_END_PERCENT = 50.0;

    private final TimelineCompiler timelineCompiler;
    private final MediaSourceResolver mediaSourceResolver;
    private final RenderExecutor renderExecutor;
    private final JobRegistry jobRegistry;
    private final TaskExecutor taskExecutor;
    private final ReelExportProperties properties;
    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter fallbackCounter;

    public DefaultExportService(
            TimelineCompiler timelineCompiler,
            MediaSourceResolver mediaSourceResolver,
            RenderExecutor renderExecutor,
            JobRegistry jobRegistry,
            @Qualifier("renderTaskExecutor") TaskExecutor taskExecutor,
            ReelExportProperties properties,
            MeterRegistry meterRegistry) {
        this.timelineCompiler = timelineCompiler;
        this.mediaSourceResolver = mediaSourceResolver;
        this.renderExecutor = renderExecutor;
        this.jobRegistry = jobRegistry;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        this.submittedCounter = meterRegistry.counter("reel_export.jobs.submitted", "kind", "export");
        this.completedCounter = meterRegistry.counter("reel_export.jobs.completed", "kind", "export");
        this.failedCounter = meterRegistry.counter("reel_export.jobs.failed", "kind", "export");
        this.fallbackCounter = meterRegistry.counter("reel_export.transitions.fallback");
    }

    @Override
    public String submitExport(
            Timeline timeline,
            List<MultipartFile> mediaFiles,
            String filename,
            ContainerFormat format) throws IOException {
        String baseName = stripExtension(WorkspaceFiles.sanitizeFilename(filename, DEFAULT_FILENAME), format);
        Path exportsDir = Files.createDirectories(properties.exportsPath());
        Path workspace = Files.createDirectories(properties.uploadsPath());
        workspace = Files.createTempDirectory(workspace, "export-");

        List<UploadedMedia> uploads;
        try {
            uploads = storeUploads(mediaFiles, workspace);
        } catch (IOException e) {
            WorkspaceFiles.deleteRecursively(workspace);
            throw e;
        }

        String downloadName = baseName + "." + format.extension();
        RenderJob job = jobRegistry.create(
                JobKind.EXPORT,
                downloadName,
                jobId -> exportsDir.resolve(jobId + "-" + downloadName));
        submittedCounter.increment();

        logger.info(
                "Accepted export {} format={} strategy={} uploads={} clips={}",
                job.jobId(),
                format.extension(),
                properties.getExportStrategy(),
                uploads.size(),
                timeline.videoTracks().isEmpty() ? 0 : timeline.videoTracks().get(0).clips().size());

        Path finalWorkspace = workspace;
        try {
            taskExecutor.execute(() -> processExport(job.jobId(), timeline, uploads, finalWorkspace, job.outputPath()));
        } catch (RuntimeException e) {
            jobRegistry.markFailed(job.jobId(), "Export could not be scheduled.");
            failedCounter.increment();
            WorkspaceFiles.deleteRecursively(workspace);
            throw e;
        }
        return job.jobId();
    }

    private void processExport(
            String jobId,
            Timeline timeline,
            List<UploadedMedia> uploads,
            Path workspace,
            Path outputPath) {
        ProgressListener progress = percent -> jobRegistry.updateProgress(jobId, percent);
        try {
            Map<String, MediaSource> sources = mediaSourceResolver.resolve(timeline, uploads);
            CompiledGraph graph = timelineCompiler.compile(timeline, sources);
            int fallbacks = (int) graph.boundaries().stream()
                    .filter(boundary -> boundary.kind() == BoundaryKind.FALLBACK_CONCAT)
                    .count();
            if (fallbacks > 0) {
                fallbackCounter.increment(fallbacks);
            }

            if (properties.getExportStrategy() == ExportStrategy.CHUNKED) {
                graph = renderChunks(jobId, timeline, sources, workspace, progress);
                progress = ProgressListener.scaled(progress, CHUNK_PHASE_END_PERCENT, 100.0);
            }

            requireActive(jobId);
            renderExecutor.render(jobId, graph, OutputProfile.FINAL_EXPORT, outputPath, progress);

            if (jobRegistry.markDone(jobId)) {
                completedCounter.increment();
                logger.info("Completed export {} output={} duration={}s", jobId, outputPath, graph.durationSec());
            } else {
                WorkspaceFiles.deleteIfExists(outputPath);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(jobId, outputPath, "Export was interrupted.", e);
        } catch (Exception e) {
            fail(jobId, outputPath, failureMessage(e), e);
        } finally {
            WorkspaceFiles.deleteRecursively(workspace);
        }
    }

    /**
     * Normalizes every video-track clip into an intermediate chunk and recompiles the timeline against them.
     */
    private CompiledGraph renderChunks(
            String jobId,
            Timeline timeline,
            Map<String, MediaSource> sources,
            Path workspace,
            ProgressListener progress) throws IOException, InterruptedException {
        Track videoTrack = timeline.videoTracks().get(0);
        List<Clip> clips = new ArrayList<>(videoTrack.clips());
        clips.sort(Comparator.comparingDouble(Clip::timelineStart));

        List<Clip> chunkClips = new ArrayList<>();
        Map<String, MediaSource> chunkSources = new HashMap<>(sources);
        double phaseShare = CHUNK_PHASE_END_PERCENT / clips.size();
        for (int index = 0; index < clips.size(); index++) {
            Clip clip = clips.get(index);
            Path chunkPath = workspace.resolve("chunk_" + index + ".mov");
            CompiledGraph chunkGraph = timelineCompiler.compileClip(
                    clip,
                    sources.get(clip.clipId()),
                    videoTrack.volume(),
                    videoTrack.muted());

            requireActive(jobId);
            renderExecutor.render(
                    jobId,
                    chunkGraph,
                    OutputProfile.INTERMEDIATE_CHUNK,
                    chunkPath,
                    ProgressListener.scaled(progress, index * phaseShare, (index + 1) * phaseShare));
            logger.debug("Export {} rendered chunk {} of {}", jobId, index + 1, clips.size());

            chunkClips.add(new Clip(
                    clip.clipId(),
                    clip.mediaId(),
                    0.0,
                    clip.durationSec(),
                    clip.timelineStart(),
                    clip.transitionStart(),
                    clip.transitionEnd(),
                    ColorGrading.NEUTRAL,
                    List.of(),
                    1.0,
                    false,
                    null));
            chunkSources.put(clip.clipId(), new MediaSource(
                    clip.mediaId(),
                    chunkPath,
                    MediaKind.VIDEO,
                    clip.durationSec(),
                    true));
        }

        List<Track> videoTracks = new ArrayList<>(timeline.videoTracks());
        videoTracks.set(0, new Track(videoTrack.trackId(), TrackKind.VIDEO, chunkClips, 1.0, false));
        Timeline chunkTimeline = new Timeline(videoTracks, timeline.audioTracks(), timeline.durationSec(), timeline.layout());
        return timelineCompiler.compile(chunkTimeline, chunkSources);
    }

    private List<UploadedMedia> storeUploads(List<MultipartFile> mediaFiles, Path workspace) throws IOException {
        List<UploadedMedia> uploads = new ArrayList<>();
        if (mediaFiles == null) {
            return uploads;
        }
        for (int index = 0; index < mediaFiles.size(); index++) {
            MultipartFile file = mediaFiles.get(index);
            if (file == null || file.isEmpty()) {
                continue;
            }
            String originalFilename = file.getOriginalFilename() == null ? "upload-" + index : file.getOriginalFilename();
            Path target = workspace.resolve(index + "-" + WorkspaceFiles.sanitizeFilename(originalFilename, "upload"));
            file.transferTo(target);
            uploads.add(new UploadedMedia(originalFilename, target, file.getContentType()));
        }
        return uploads;
    }

    private void requireActive(String jobId) throws IOException {
        boolean active = jobRegistry.find(jobId)
                .map(job -> !job.state().isTerminal())
                .orElse(false);
        if (!active) {
            throw new IOException("Job cancelled.");
        }
    }

    private void fail(String jobId, Path outputPath, String message, Exception cause) {
        if (jobRegistry.markFailed(jobId, message)) {
            failedCounter.increment();
            logger.error("Export {} failed", jobId, cause);
        } else {
            logger.info("Export {} stopped after it was cancelled: {}", jobId, cause.getMessage());
        }
        WorkspaceFiles.deleteIfExists(outputPath);
    }

    private String failureMessage(Exception e) {
        if (e instanceof IllegalArgumentException || e instanceof IOException) {
            return e.getMessage();
        }
        return "Export failed. Check server logs.";
    }

    private String stripExtension(String filename, ContainerFormat format) {
        String suffix = "." + format.extension();
        if (filename.toLowerCase(Locale.ROOT).endsWith(suffix) && filename.length() > suffix.length()) {
            return filename.substring(0, filename.length() - suffix.length());
        }
        return filename;
    }
}
