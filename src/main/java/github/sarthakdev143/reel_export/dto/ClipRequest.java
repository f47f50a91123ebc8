package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClipRequest(
        String id,
        String mediaFileId,
        Double sourceStart,
        Double sourceEnd,
        Double timelineStart,
        TransitionRequest transitionStart,
        TransitionRequest transitionEnd,
        ColorGradingRequest colorGrading,
        List<ReframeKeyframeRequest> reframeKeyframes,
        Double volume,
        @JsonProperty("isMuted") Boolean muted,
        String processedVideoUrl) {
}
