package github.sarthakdev143.reel_export.dto;

public record JobSubmissionResponse(String jobId) {
}
