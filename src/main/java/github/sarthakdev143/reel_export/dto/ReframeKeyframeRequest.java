package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReframeKeyframeRequest(
        Double time,
        Double x,
        Double y,
        Double scale) {
}
