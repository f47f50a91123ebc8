package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.service.JobCancellationService;
import github.sarthakdev143.reel_export.service.JobRegistry;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class DefaultJobCancellationService implements JobCancellationService {

    static final String CANCELLED_MESSAGE = "Job cancelled.";
    private static final Logger logger = LoggerFactory.getLogger(DefaultJobCancellationService.class);

    private final JobRegistry jobRegistry;
    private final RenderExecutor renderExecutor;
    private final Counter cancelledCounter;

    public DefaultJobCancellationService(
            JobRegistry jobRegistry,
            RenderExecutor renderExecutor,
            MeterRegistry meterRegistry) {
        this.jobRegistry = jobRegistry;
        this.renderExecutor = renderExecutor;
        this.cancelledCounter = meterRegistry.counter("reel_export.jobs.cancelled");
    }

    @Override
    public Outcome cancel(String jobId) {
        Optional<RenderJob> job = jobRegistry.find(jobId);
        if (job.isEmpty()) {
            return Outcome.NOT_FOUND;
        }
        // The registry transition decides the race with a finishing encoder.
        if (!jobRegistry.markFailed(jobId, CANCELLED_MESSAGE)) {
            return Outcome.ALREADY_FINISHED;
        }

        boolean encoderStopped = renderExecutor.cancel(jobId);
        cancelledCounter.increment();
        logger.info("Cancelled job {} kind={} encoderStopped={}", jobId, job.get().kind(), encoderStopped);
        return Outcome.CANCELLED;
    }
}
