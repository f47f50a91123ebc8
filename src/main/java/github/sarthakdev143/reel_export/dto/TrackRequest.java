package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackRequest(
        String id,
        String type,
        List<ClipRequest> clips,
        Double volume,
        @JsonProperty("isMuted") Boolean muted) {
}
