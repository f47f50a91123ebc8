package github.sarthakdev143.reel_export.dto;

public record HealthResponse(
        String status,
        String message) {
}
