package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.dto.JobProgressEvent;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.service.JobRegistry;

import java.io.IOException;
import java.util.Optional;

/**
 * One subscriber's view of a job: each tick copies the job's current state into one event.
 */
class ProgressStream {

    @FunctionalInterface
    interface EventSink {
        void send(JobProgressEvent event) throws IOException;
    }

    private final String jobId;
    private final JobKind kind;
    private final String notFoundMessage;
    private final JobRegistry jobRegistry;
    private final EventSink sink;

    ProgressStream(String jobId, JobKind kind, String notFoundMessage, JobRegistry jobRegistry, EventSink sink) {
        this.jobId = jobId;
        this.kind = kind;
        this.notFoundMessage = notFoundMessage;
        this.jobRegistry = jobRegistry;
        this.sink = sink;
    }

    /**
     * @return false once the stream has delivered its last event
     */
    boolean tick() throws IOException {
        Optional<RenderJob> job = jobRegistry.find(jobId).filter(candidate -> candidate.kind() == kind);
        if (job.isEmpty()) {
            sink.send(JobProgressEvent.notFound(notFoundMessage));
            return false;
        }

        JobProgressEvent event = JobProgressEvent.of(job.get());
        sink.send(event);
        return !event.isTerminal();
    }
}
