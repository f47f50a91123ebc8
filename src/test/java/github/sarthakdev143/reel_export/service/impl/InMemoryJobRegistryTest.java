package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.RenderJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobRegistryTest {

    private InMemoryJobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryJobRegistry(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createStartsProcessingAtZeroWithOutputNamedAfterJob() {
        RenderJob job = registry.create(JobKind.EXPORT, null, jobId -> Path.of("exports", jobId + "-reel.mp4"));

        assertThat(job.state()).isEqualTo(JobState.PROCESSING);
        assertThat(job.progress()).isZero();
        assertThat(job.outputPath()).isEqualTo(Path.of("exports", job.jobId() + "-reel.mp4"));
        assertThat(job.filename()).isEqualTo(job.jobId() + "-reel.mp4");
        assertThat(registry.find(job.jobId())).contains(job);
    }

    @Test
    void progressIsClampedAndNeverMovesBackwards() {
        String jobId = registry.create(JobKind.PROCESS_VIDEO, "clip.mp4", id -> Path.of(id + ".mp4")).jobId();

        registry.updateProgress(jobId, 40.0);
        registry.updateProgress(jobId, 25.0);
        registry.updateProgress(jobId, Double.NaN);
        assertThat(registry.find(jobId).orElseThrow().progress()).isEqualTo(40.0);

        registry.updateProgress(jobId, 150.0);
        assertThat(registry.find(jobId).orElseThrow().progress()).isEqualTo(99.0);
    }

    @Test
    void doneReportsFullProgressAndIsFinal() {
        String jobId = registry.create(JobKind.EXPORT, "reel.mp4", id -> Path.of(id + ".mp4")).jobId();
        registry.updateProgress(jobId, 60.0);

        assertThat(registry.markDone(jobId)).isTrue();
        assertThat(registry.markFailed(jobId, "late failure")).isFalse();
        registry.updateProgress(jobId, 10.0);

        RenderJob job = registry.find(jobId).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.DONE);
        assertThat(job.progress()).isEqualTo(100.0);
        assertThat(job.errorMessage()).isNull();
    }

    @Test
    void failureKeepsProgressAndWinsOverLaterCompletion() {
        String jobId = registry.create(JobKind.EXPORT, "reel.mp4", id -> Path.of(id + ".mp4")).jobId();
        registry.updateProgress(jobId, 30.0);

        assertThat(registry.markFailed(jobId, "Job cancelled.")).isTrue();
        assertThat(registry.markDone(jobId)).isFalse();

        RenderJob job = registry.find(jobId).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.ERROR);
        assertThat(job.progress()).isEqualTo(30.0);
        assertThat(job.errorMessage()).isEqualTo("Job cancelled.");
    }

    @Test
    void unknownIdsAreIgnored() {
        registry.updateProgress("missing", 50.0);

        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.markDone("missing")).isFalse();
    }

    @Test
    void removeAllForgetsEveryJob() {
        registry.create(JobKind.EXPORT, "a.mp4", id -> Path.of(id + ".mp4"));
        registry.create(JobKind.PROCESS_VIDEO, null, id -> Path.of(id + ".mp4"));

        assertThat(registry.removeAll()).hasSize(2);
        assertThat(registry.removeAll()).isEmpty();
    }
}
