package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimelineRequest(
        List<TrackRequest> videoTracks,
        List<TrackRequest> audioTracks,
        Double duration,
        TemplateRequest template) {
}
