package github.sarthakdev143.reel_export.service;

public interface JobCancellationService {

    enum Outcome {
        CANCELLED,
        NOT_FOUND,
        ALREADY_FINISHED
    }

    /**
     * Fails a processing job with "Job cancelled." and stops its encoder. Terminal jobs are left untouched.
     */
    Outcome cancel(String jobId);
}
