package github.sarthakdev143.reel_export.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.RenderJob;

/**
 * Payload of one progress stream message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobProgressEvent(
        JobState status,
        Double progress,
        String error) {

    public static JobProgressEvent of(RenderJob job) {
        return new JobProgressEvent(job.state(), job.progress(), job.errorMessage());
    }

    public static JobProgressEvent notFound(String message) {
        return new JobProgressEvent(JobState.ERROR, null, message);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
