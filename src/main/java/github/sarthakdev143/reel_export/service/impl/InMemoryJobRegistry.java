package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.service.JobRegistry;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

@Component
public class InMemoryJobRegistry implements JobRegistry {

    static final double MAX_RUNNING_PROGRESS = 99.0;

    private final Map<String, RenderJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobRegistry() {
        this(Clock.systemUTC());
    }

    InMemoryJobRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RenderJob create(JobKind kind, String filename, Function<String, Path> outputLocator) {
        Instant now = clock.instant();
        String jobId = UUID.randomUUID().toString();
        Path outputPath = outputLocator.apply(jobId);
        RenderJob job = new RenderJob(
                jobId,
                kind,
                JobState.PROCESSING,
                0.0,
                outputPath,
                filename == null ? outputPath.getFileName().toString() : filename,
                null,
                now,
                now);
        jobs.put(job.jobId(), job);
        return job;
    }

    @Override
    public Optional<RenderJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public void updateProgress(String jobId, double percent) {
        if (Double.isNaN(percent)) {
            return;
        }
        double clamped = Math.max(0.0, Math.min(MAX_RUNNING_PROGRESS, percent));
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.state().isTerminal() || clamped <= current.progress()) {
                return current;
            }
            return current.withProgress(clamped, clock.instant());
        });
    }

    @Override
    public boolean markDone(String jobId) {
        return transition(jobId, JobState.DONE, null);
    }

    @Override
    public boolean markFailed(String jobId, String errorMessage) {
        return transition(jobId, JobState.ERROR, errorMessage);
    }

    @Override
    public List<RenderJob> removeAll() {
        List<RenderJob> removed = new ArrayList<>();
        for (String jobId : List.copyOf(jobs.keySet())) {
            RenderJob job = jobs.remove(jobId);
            if (job != null) {
                removed.add(job);
            }
        }
        return removed;
    }

    private boolean transition(String jobId, JobState target, String errorMessage) {
        AtomicBoolean applied = new AtomicBoolean(false);
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.state().isTerminal()) {
                return current;
            }
            applied.set(true);
            double progress = target == JobState.DONE ? 100.0 : current.progress();
            return current.withTerminalState(target, progress, errorMessage, clock.instant());
        });
        return applied.get();
    }
}
