package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ColorGradingRequest(
        Double brightness,
        Double contrast,
        Double saturation,
        Double exposure,
        Double sharpness) {
}
