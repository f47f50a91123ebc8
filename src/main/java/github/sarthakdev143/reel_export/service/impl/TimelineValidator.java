package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.dto.ClipRequest;
import github.sarthakdev143.reel_export.dto.ColorGradingRequest;
import github.sarthakdev143.reel_export.dto.ReframeKeyframeRequest;
import github.sarthakdev143.reel_export.dto.TimelineRequest;
import github.sarthakdev143.reel_export.dto.TrackRequest;
import github.sarthakdev143.reel_export.dto.TransitionRequest;
import github.sarthakdev143.reel_export.model.LayoutType;
import github.sarthakdev143.reel_export.model.TrackKind;
import github.sarthakdev143.reel_export.model.TransitionType;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.ColorGrading;
import github.sarthakdev143.reel_export.model.timeline.ReframeKeyframe;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import github.sarthakdev143.reel_export.model.timeline.Track;
import github.sarthakdev143.reel_export.model.timeline.Transition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the submitted timeline document into an immutable {@link Timeline}.
 * <p>
 * Only request-shape problems are rejected here. Whether media resolves, clips overlap or the layout can be
 * rendered is decided later, inside the job.
 */
@Component
public class TimelineValidator {

    private static final String DOWNLOAD_PATH_MARKER = "/download/";
    private static final int MAX_CLIPS_PER_TRACK = 50;
    private static final double MIN_VOLUME = 0.0;
    private static final double MAX_VOLUME = 2.0;
    private static final double MIN_GRADE = 0.0;
    private static final double MAX_GRADE = 2.0;
    private static final double MIN_EXPOSURE = -1.0;
    private static final double MAX_EXPOSURE = 1.0;
    private static final double MIN_SHARPNESS = 0.0;
    private static final double MAX_SHARPNESS = 1.0;
    private static final double EPSILON = 1e-9;

    public Timeline toTimeline(TimelineRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("timeline is required.");
        }
        if (request.videoTracks() == null || request.videoTracks().isEmpty()) {
            throw new IllegalArgumentException("timeline.videoTracks must contain at least one track.");
        }

        LayoutType layout = request.template() == null
                ? LayoutType.SOLO
                : LayoutType.fromInput(request.template().layout());
        Set<String> clipIds = new HashSet<>();

        List<Track> videoTracks = new ArrayList<>();
        for (int index = 0; index < request.videoTracks().size(); index++) {
            videoTracks.add(normalizeTrack(
                    "timeline.videoTracks[" + index + "]",
                    request.videoTracks().get(index),
                    TrackKind.VIDEO,
                    clipIds));
        }

        List<Track> audioTracks = new ArrayList<>();
        List<TrackRequest> audioRequests = request.audioTracks() == null ? List.of() : request.audioTracks();
        for (int index = 0; index < audioRequests.size(); index++) {
            audioTracks.add(normalizeTrack(
                    "timeline.audioTracks[" + index + "]",
                    audioRequests.get(index),
                    TrackKind.AUDIO,
                    clipIds));
        }

        double duration = request.duration() == null
                ? computedDuration(videoTracks, audioTracks)
                : nonNegativeOrDefault(request.duration(), 0.0, "timeline.duration");

        return new Timeline(videoTracks, audioTracks, duration, layout == null ? LayoutType.SOLO : layout);
    }

    private Track normalizeTrack(String path, TrackRequest track, TrackKind expectedKind, Set<String> clipIds) {
        if (track == null) {
            throw new IllegalArgumentException(path + " must not be null.");
        }

        TrackKind kind = TrackKind.fromInput(track.type());
        if (kind != null && kind != expectedKind) {
            throw new IllegalArgumentException(path + ".type must be " + expectedKind.toApiValue() + ".");
        }

        List<ClipRequest> clipRequests = track.clips() == null ? List.of() : track.clips();
        if (clipRequests.size() > MAX_CLIPS_PER_TRACK) {
            throw new IllegalArgumentException(path + ".clips supports at most " + MAX_CLIPS_PER_TRACK + " clips.");
        }

        String trackId = track.id() == null || track.id().isBlank() ? path : track.id().trim();
        List<Clip> clips = new ArrayList<>();
        for (int index = 0; index < clipRequests.size(); index++) {
            Clip clip = normalizeClip(path + ".clips[" + index + "]", clipRequests.get(index), trackId, index);
            if (!clipIds.add(clip.clipId())) {
                throw new IllegalArgumentException(path + ".clips[" + index + "].id " + clip.clipId() + " is used twice.");
            }
            clips.add(clip);
        }

        return new Track(
                trackId,
                expectedKind,
                clips,
                valueInRangeOrDefault(track.volume(), 1.0, MIN_VOLUME, MAX_VOLUME, path + ".volume"),
                Boolean.TRUE.equals(track.muted()));
    }

    private Clip normalizeClip(String path, ClipRequest clip, String trackId, int index) {
        if (clip == null) {
            throw new IllegalArgumentException(path + " must not be null.");
        }

        String processedJobId = parseProcessedJobId(path, clip.processedVideoUrl());
        String mediaId = clip.mediaFileId() == null ? null : clip.mediaFileId().trim();
        if ((mediaId == null || mediaId.isEmpty()) && processedJobId == null) {
            throw new IllegalArgumentException(path + ".mediaFileId is required.");
        }

        double sourceStart = nonNegativeOrDefault(clip.sourceStart(), 0.0, path + ".sourceStart");
        double sourceEnd = requireFinite(clip.sourceEnd(), path + ".sourceEnd");
        if (sourceEnd <= sourceStart + EPSILON) {
            throw new IllegalArgumentException(path + ".sourceEnd must be greater than sourceStart.");
        }
        double timelineStart = nonNegativeOrDefault(clip.timelineStart(), 0.0, path + ".timelineStart");

        String clipId = clip.id() == null || clip.id().isBlank()
                ? trackId + "-clip-" + index
                : clip.id().trim();

        return new Clip(
                clipId,
                mediaId,
                sourceStart,
                sourceEnd,
                timelineStart,
                normalizeTransition(path + ".transitionStart", clip.transitionStart()),
                normalizeTransition(path + ".transitionEnd", clip.transitionEnd()),
                normalizeColorGrading(path + ".colorGrading", clip.colorGrading()),
                normalizeKeyframes(path + ".reframeKeyframes", clip.reframeKeyframes()),
                valueInRangeOrDefault(clip.volume(), 1.0, MIN_VOLUME, MAX_VOLUME, path + ".volume"),
                Boolean.TRUE.equals(clip.muted()),
                processedJobId);
    }

    private Transition normalizeTransition(String path, TransitionRequest transition) {
        if (transition == null) {
            return null;
        }
        TransitionType type;
        try {
            type = TransitionType.fromInput(transition.type());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ".type: " + e.getMessage());
        }
        if (type == null) {
            return null;
        }
        return new Transition(type, nonNegativeOrDefault(transition.duration(), 0.0, path + ".duration"));
    }

    private ColorGrading normalizeColorGrading(String path, ColorGradingRequest grading) {
        if (grading == null) {
            return null;
        }
        return new ColorGrading(
                valueInRangeOrDefault(grading.brightness(), 1.0, MIN_GRADE, MAX_GRADE, path + ".brightness"),
                valueInRangeOrDefault(grading.contrast(), 1.0, MIN_GRADE, MAX_GRADE, path + ".contrast"),
                valueInRangeOrDefault(grading.saturation(), 1.0, MIN_GRADE, MAX_GRADE, path + ".saturation"),
                valueInRangeOrDefault(grading.exposure(), 0.0, MIN_EXPOSURE, MAX_EXPOSURE, path + ".exposure"),
                valueInRangeOrDefault(grading.sharpness(), 0.0, MIN_SHARPNESS, MAX_SHARPNESS, path + ".sharpness"));
    }

    private List<ReframeKeyframe> normalizeKeyframes(String path, List<ReframeKeyframeRequest> keyframes) {
        if (keyframes == null || keyframes.isEmpty()) {
            return List.of();
        }

        List<ReframeKeyframe> normalized = new ArrayList<>();
        for (int index = 0; index < keyframes.size(); index++) {
            ReframeKeyframeRequest keyframe = keyframes.get(index);
            String keyframePath = path + "[" + index + "]";
            if (keyframe == null) {
                throw new IllegalArgumentException(keyframePath + " must not be null.");
            }
            normalized.add(new ReframeKeyframe(
                    nonNegativeOrDefault(keyframe.time(), 0.0, keyframePath + ".time"),
                    requireFinite(keyframe.x(), keyframePath + ".x"),
                    keyframe.y() == null ? 0.5 : requireFinite(keyframe.y(), keyframePath + ".y"),
                    keyframe.scale() == null ? 1.0 : requireFinite(keyframe.scale(), keyframePath + ".scale")));
        }
        return normalized;
    }

    private String parseProcessedJobId(String path, String processedVideoUrl) {
        if (processedVideoUrl == null || processedVideoUrl.isBlank()) {
            return null;
        }
        int markerIndex = processedVideoUrl.lastIndexOf(DOWNLOAD_PATH_MARKER);
        String jobId = markerIndex < 0 ? "" : processedVideoUrl.substring(markerIndex + DOWNLOAD_PATH_MARKER.length()).trim();
        if (jobId.isEmpty() || jobId.contains("/")) {
            throw new IllegalArgumentException(path + ".processedVideoUrl must have the form /download/<jobId>.");
        }
        return jobId;
    }

    private double computedDuration(List<Track> videoTracks, List<Track> audioTracks) {
        double end = 0.0;
        for (Track track : videoTracks) {
            for (Clip clip : track.clips()) {
                end = Math.max(end, clip.timelineEnd());
            }
        }
        for (Track track : audioTracks) {
            for (Clip clip : track.clips()) {
                end = Math.max(end, clip.timelineEnd());
            }
        }
        return end;
    }

    private double nonNegativeOrDefault(Double value, double defaultValue, String fieldName) {
        if (value == null) {
            return defaultValue;
        }
        double normalized = requireFinite(value, fieldName);
        if (normalized < 0.0) {
            throw new IllegalArgumentException(fieldName + " must be greater than or equal to 0.");
        }
        return normalized;
    }

    private double requireFinite(Double value, String fieldName) {
        if (value == null || !Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be a finite number.");
        }
        return value;
    }

    private double valueInRangeOrDefault(
            Double value,
            double defaultValue,
            double minValue,
            double maxValue,
            String fieldName) {
        if (value == null) {
            return defaultValue;
        }

        double normalized = requireFinite(value, fieldName);
        if (normalized < minValue || normalized > maxValue) {
            throw new IllegalArgumentException(
                    fieldName
                            + " must be between "
                            + minValue
                            + " and "
                            + maxValue
                            + ".");
        }
        return normalized;
    }
}
