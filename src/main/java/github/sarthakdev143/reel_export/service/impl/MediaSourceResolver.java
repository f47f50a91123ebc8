package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.compiler.InvalidTimelineException;
import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.MediaKind;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.MediaProbe;
import github.sarthakdev143.reel_export.model.timeline.MediaSource;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.model.timeline.Track;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.MediaProber;
import github.sarthakdev143.reel_export.service.UploadedMedia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds every clip of a timeline to the media file it plays, probing each distinct file once.
 * Clips whose media cannot be found are left unbound so the compiler can report them.
 */
@Component
public class MediaSourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(MediaSourceResolver.class);
    private static final double TRIM_TOLERANCE_SECONDS = 0.05;

    private final MediaProber mediaProber;
    private final JobRegistry jobRegistry;

    public MediaSourceResolver(MediaProber mediaProber, JobRegistry jobRegistry) {
        this.mediaProber = mediaProber;
        this.jobRegistry = jobRegistry;
    }

    /**
     * @return resolved media keyed by clip id
     * @throws IOException when a referenced file exists but its metadata cannot be read
     */
    public Map<String, MediaSource> resolve(Timeline timeline, List<UploadedMedia> uploads)
            throws IOException, InterruptedException {
        List<Track> tracks = new ArrayList<>(timeline.videoTracks());
        tracks.addAll(timeline.audioTracks());

        Map<Path, MediaSource> probedByPath = new HashMap<>();
        Map<String, MediaSource> sourcesByClipId = new LinkedHashMap<>();
        for (Track track : tracks) {
            for (Clip clip : track.clips()) {
                Optional<MediaSource> source = resolveClip(clip, uploads, probedByPath);
                if (source.isPresent()) {
                    warnIfTrimExceedsSource(clip, source.get());
                    sourcesByClipId.put(clip.clipId(), source.get());
                }
            }
        }
        return sourcesByClipId;
    }

    private Optional<MediaSource> resolveClip(
            Clip clip,
            List<UploadedMedia> uploads,
            Map<Path, MediaSource> probedByPath) throws IOException, InterruptedException {
        Optional<Path> processed = processedArtifact(clip);
        if (processed.isPresent()) {
            Path path = processed.get();
            String mediaId = clip.mediaId() == null ? clip.processedJobId() : clip.mediaId();
            MediaSource cached = probedByPath.get(path);
            if (cached == null) {
                cached = probe(mediaId, path, MediaKind.VIDEO);
                probedByPath.put(path, cached);
            }
            return Optional.of(cached);
        }

        Optional<UploadedMedia> upload = findUpload(clip.mediaId(), uploads);
        if (upload.isEmpty()) {
            return Optional.empty();
        }

        UploadedMedia media = upload.get();
        MediaSource cached = probedByPath.get(media.path());
        if (cached == null) {
            MediaKind kind = MediaKind.detect(media.originalFilename(), media.contentType());
            cached = kind == MediaKind.IMAGE
                    ? new MediaSource(clip.mediaId(), media.path(), MediaKind.IMAGE, 0.0, false)
                    : probe(clip.mediaId(), media.path(), kind);
            probedByPath.put(media.path(), cached);
        }
        return Optional.of(cached);
    }

    private Optional<Path> processedArtifact(Clip clip) {
        if (clip.processedJobId() == null) {
            return Optional.empty();
        }
        Optional<Path> artifact = jobRegistry.find(clip.processedJobId())
                .filter(job -> job.state() == JobState.DONE)
                .map(RenderJob::outputPath)
                .filter(Files::isRegularFile);
        if (artifact.isEmpty()) {
            logger.info(
                    "Processed video {} for clip {} is not available; using the uploaded file",
                    clip.processedJobId(),
                    clip.clipId());
        }
        return artifact;
    }

    /**
     * Exact filename first, then the filename without extension, then any filename containing the id.
     */
    static Optional<UploadedMedia> findUpload(String mediaId, List<UploadedMedia> uploads) {
        if (mediaId == null || mediaId.isBlank()) {
            return Optional.empty();
        }
        for (UploadedMedia upload : uploads) {
            if (mediaId.equals(upload.originalFilename())) {
                return Optional.of(upload);
            }
        }
        for (UploadedMedia upload : uploads) {
            if (mediaId.equals(stripExtension(upload.originalFilename()))) {
                return Optional.of(upload);
            }
        }
        for (UploadedMedia upload : uploads) {
            if (upload.originalFilename() != null && upload.originalFilename().contains(mediaId)) {
                return Optional.of(upload);
            }
        }
        return Optional.empty();
    }

    private MediaSource probe(String mediaId, Path path, MediaKind declaredKind)
            throws IOException, InterruptedException {
        MediaProbe probe;
        try {
            probe = mediaProber.probe(path);
        } catch (IOException e) {
            throw new IOException("Failed to read media metadata for " + mediaId + ".", e);
        }
        if (declaredKind == MediaKind.VIDEO && !probe.hasVideo()) {
            return new MediaSource(mediaId, path, MediaKind.AUDIO, probe.durationSec(), probe.hasAudio());
        }
        if (declaredKind == MediaKind.AUDIO && !probe.hasAudio()) {
            throw new InvalidTimelineException("Audio file " + mediaId + " has no audio stream.");
        }
        return new MediaSource(mediaId, path, declaredKind, probe.durationSec(), probe.hasAudio());
    }

    private void warnIfTrimExceedsSource(Clip clip, MediaSource source) {
        if (!source.isStill() && source.durationSec() > 0.0
                && clip.sourceEnd() > source.durationSec() + TRIM_TOLERANCE_SECONDS) {
            logger.warn(
                    "Clip {} ends at {}s but {} is only {}s long",
                    clip.clipId(),
                    clip.sourceEnd(),
                    source.mediaId(),
                    source.durationSec());
        }
    }

    private static String stripExtension(String filename) {
        if (filename == null) {
            return null;
        }
        int extensionIndex = filename.lastIndexOf('.');
        return extensionIndex <= 0 ? filename : filename.substring(0, extensionIndex);
    }
}
