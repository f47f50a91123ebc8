package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateRequest(
        String id,
        String name,
        String layout) {
}
