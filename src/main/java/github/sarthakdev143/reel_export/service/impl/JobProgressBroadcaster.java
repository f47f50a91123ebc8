package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.service.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls the job registry on a fixed interval and pushes each snapshot to a server-sent event stream.
 * A subscriber that disconnects only stops its own polling; the job keeps running.
 */
@Component
public class JobProgressBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(JobProgressBroadcaster.class);
    private static final long NO_TIMEOUT = 0L;

    private final JobRegistry jobRegistry;
    private final TaskScheduler taskScheduler;
    private final Duration interval;

    public JobProgressBroadcaster(
            JobRegistry jobRegistry,
            @Qualifier("progressTaskScheduler") TaskScheduler taskScheduler,
            ReelExportProperties properties) {
        this.jobRegistry = jobRegistry;
        this.taskScheduler = taskScheduler;
        this.interval = properties.getProgressInterval();
    }

    public SseEmitter subscribe(String jobId, JobKind kind, String notFoundMessage) {
        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        ProgressStream stream = new ProgressStream(
                jobId,
                kind,
                notFoundMessage,
                jobRegistry,
                event -> emitter.send(event, MediaType.APPLICATION_JSON));
        Subscription subscription = new Subscription(jobId, stream, emitter);

        emitter.onCompletion(subscription::stop);
        emitter.onTimeout(subscription::stop);
        emitter.onError(error -> subscription.stop());

        subscription.start(taskScheduler.scheduleAtFixedRate(subscription, interval));
        return emitter;
    }

    private static final class Subscription implements Runnable {

        private final String jobId;
        private final ProgressStream stream;
        private final SseEmitter emitter;
        private final AtomicBoolean stopped = new AtomicBoolean(false);
        private final AtomicReference<ScheduledFuture<?>> schedule = new AtomicReference<>();

        private Subscription(String jobId, ProgressStream stream, SseEmitter emitter) {
            this.jobId = jobId;
            this.stream = stream;
            this.emitter = emitter;
        }

        @Override
        public void run() {
            if (stopped.get()) {
                return;
            }
            try {
                if (!stream.tick()) {
                    stop();
                    emitter.complete();
                }
            } catch (IOException | IllegalStateException e) {
                logger.debug("Progress subscriber for job {} went away: {}", jobId, e.getMessage());
                stop();
            }
        }

        private void start(ScheduledFuture<?> scheduled) {
            schedule.set(scheduled);
            if (stopped.get()) {
                scheduled.cancel(false);
            }
        }

        private void stop() {
            stopped.set(true);
            ScheduledFuture<?> scheduled = schedule.get();
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
