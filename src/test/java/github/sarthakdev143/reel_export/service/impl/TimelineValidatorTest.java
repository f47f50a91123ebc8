package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.dto.ClipRequest;
import github.sarthakdev143.reel_export.dto.ColorGradingRequest;
import github.sarthakdev143.reel_export.dto.ReframeKeyframeRequest;
import github.sarthakdev143.reel_export.dto.TemplateRequest;
import github.sarthakdev143.reel_export.dto.TimelineRequest;
import github.sarthakdev143.reel_export.dto.TrackRequest;
import github.sarthakdev143.reel_export.dto.TransitionRequest;
import github.sarthakdev143.reel_export.model.LayoutType;
import github.sarthakdev143.reel_export.model.TransitionType;
import github.sarthakdev143.reel_export.model.timeline.Clip;
import github.sarthakdev143.reel_export.model.timeline.ColorGrading;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineValidatorTest {

    private TimelineValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TimelineValidator();
    }

    @Test
    void toTimelineAppliesDefaults() {
        ClipRequest clip = new ClipRequest(
                null,
                "beach.mp4",
                null,
                4.0,
                2.0,
                null,
                null,
                new ColorGradingRequest(1.2, null, null, null, null),
                List.of(new ReframeKeyframeRequest(0.0, 0.3, null, null)),
                null,
                null,
                null);

        Timeline timeline = validator.toTimeline(new TimelineRequest(
                List.of(new TrackRequest("main", "video", List.of(clip), null, null)),
                null,
                null,
                null));

        assertThat(timeline.layout()).isEqualTo(LayoutType.SOLO);
        assertThat(timeline.audioTracks()).isEmpty();
        assertThat(timeline.durationSec()).isEqualTo(6.0);
        Clip normalized = timeline.videoTracks().get(0).clips().get(0);
        assertThat(normalized.clipId()).isEqualTo("main-clip-0");
        assertThat(normalized.sourceStart()).isZero();
        assertThat(normalized.volume()).isEqualTo(1.0);
        assertThat(normalized.muted()).isFalse();
        assertThat(normalized.colorGrading()).isEqualTo(new ColorGrading(1.2, 1.0, 1.0, 0.0, 0.0));
        assertThat(normalized.reframeKeyframes()).singleElement().satisfies(keyframe -> {
            assertThat(keyframe.y()).isEqualTo(0.5);
            assertThat(keyframe.scale()).isEqualTo(1.0);
        });
    }

    @Test
    void toTimelineParsesTransitionsAndProcessedVideoReference() {
        ClipRequest clip = new ClipRequest(
                "c1",
                null,
                1.0,
                3.0,
                0.0,
                new TransitionRequest("fade-in", 0.5),
                new TransitionRequest("dip-to-white", null),
                null,
                null,
                0.5,
                true,
                "http://localhost:8080/download/job-42");

        Clip normalized = validator.toTimeline(timelineWith(clip)).videoTracks().get(0).clips().get(0);

        assertThat(normalized.processedJobId()).isEqualTo("job-42");
        assertThat(normalized.mediaId()).isNull();
        assertThat(normalized.transitionStart().type()).isEqualTo(TransitionType.FADE_IN);
        assertThat(normalized.transitionStart().durationSec()).isEqualTo(0.5);
        assertThat(normalized.transitionEnd().type()).isEqualTo(TransitionType.DIP_TO_WHITE);
        assertThat(normalized.transitionEnd().isActive()).isFalse();
        assertThat(normalized.muted()).isTrue();
    }

    @Test
    void toTimelineRejectsMissingVideoTracks() {
        assertThatThrownBy(() -> validator.toTimeline(new TimelineRequest(List.of(), null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timeline.videoTracks must contain at least one track.");
        assertThatThrownBy(() -> validator.toTimeline(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timeline is required.");
    }

    @Test
    void toTimelineRejectsClipWithoutMedia() {
        ClipRequest clip = new ClipRequest("c1", " ", 0.0, 2.0, 0.0, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(timelineWith(clip)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timeline.videoTracks[0].clips[0].mediaFileId is required.");
    }

    @Test
    void toTimelineRejectsEmptyTrimWindow() {
        ClipRequest clip = new ClipRequest("c1", "a.mp4", 3.0, 3.0, 0.0, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(timelineWith(clip)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceEnd must be greater than sourceStart");
    }

    @Test
    void toTimelineRejectsUnknownTransitionType() {
        ClipRequest clip = new ClipRequest(
                "c1", "a.mp4", 0.0, 2.0, 0.0, null, new TransitionRequest("spin", 1.0), null, null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(timelineWith(clip)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("timeline.videoTracks[0].clips[0].transitionEnd.type: transition type must be one of");
    }

    @Test
    void toTimelineRejectsOutOfRangeGrading() {
        ClipRequest clip = new ClipRequest(
                "c1", "a.mp4", 0.0, 2.0, 0.0, null, null,
                new ColorGradingRequest(null, null, null, null, 1.5), null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(timelineWith(clip)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colorGrading.sharpness must be between 0.0 and 1.0");
    }

    @Test
    void toTimelineRejectsDuplicateClipIdsAcrossTracks() {
        ClipRequest video = new ClipRequest("same", "a.mp4", 0.0, 2.0, 0.0, null, null, null, null, null, null, null);
        ClipRequest music = new ClipRequest("same", "song.mp3", 0.0, 2.0, 0.0, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(new TimelineRequest(
                List.of(new TrackRequest("v", "video", List.of(video), null, null)),
                List.of(new TrackRequest("m", "audio", List.of(music), null, null)),
                null,
                null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is used twice");
    }

    @Test
    void toTimelineRejectsTrackOfWrongType() {
        ClipRequest clip = new ClipRequest("c1", "a.mp4", 0.0, 2.0, 0.0, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.toTimeline(new TimelineRequest(
                List.of(new TrackRequest("v", "audio", List.of(clip), null, null)), null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timeline.videoTracks[0].type must be video.");
    }

    @Test
    void toTimelineKeepsNonSoloLayoutForTheCompilerToReject() {
        ClipRequest clip = new ClipRequest("c1", "a.mp4", 0.0, 2.0, 0.0, null, null, null, null, null, null, null);

        Timeline timeline = validator.toTimeline(new TimelineRequest(
                List.of(new TrackRequest("v", "video", List.of(clip), null, null)),
                null,
                12.0,
                new TemplateRequest("t1", "Split", "duet-vertical")));

        assertThat(timeline.layout()).isEqualTo(LayoutType.DUET_VERTICAL);
        assertThat(timeline.durationSec()).isEqualTo(12.0);
    }

    private TimelineRequest timelineWith(ClipRequest clip) {
        return new TimelineRequest(
                List.of(new TrackRequest("main", "video", List.of(clip), null, null)),
                null,
                null,
                null);
    }
}
