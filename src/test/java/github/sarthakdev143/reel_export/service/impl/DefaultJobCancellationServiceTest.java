package github.sarthakdev143.reel_export.service.impl;

import github.sarthakdev143.reel_export.model.JobKind;
import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.RenderJob;
import github.sarthakdev143.reel_export.service.JobCancellationService.Outcome;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultJobCancellationServiceTest {

    @Mock
    private RenderExecutor renderExecutor;

    private InMemoryJobRegistry jobRegistry;
    private DefaultJobCancellationService service;

    @BeforeEach
    void setUp() {
        jobRegistry = new InMemoryJobRegistry();
        service = new DefaultJobCancellationService(jobRegistry, renderExecutor, new SimpleMeterRegistry());
    }

    @Test
    void cancelMarksRunningJobFailedAndStopsTheEncoder() {
        String jobId = jobRegistry.create(JobKind.EXPORT, "reel.mp4", id -> Path.of(id + ".mp4")).jobId();
        when(renderExecutor.cancel(jobId)).thenReturn(true);

        assertThat(service.cancel(jobId)).isEqualTo(Outcome.CANCELLED);

        RenderJob job = jobRegistry.find(jobId).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.ERROR);
        assertThat(job.errorMessage()).isEqualTo("Job cancelled.");
        verify(renderExecutor).cancel(jobId);
    }

    @Test
    void cancelOfFinishedJobLeavesItUntouched() {
        String jobId = jobRegistry.create(JobKind.PROCESS_VIDEO, null, id -> Path.of(id + ".mp4")).jobId();
        jobRegistry.markDone(jobId);

        assertThat(service.cancel(jobId)).isEqualTo(Outcome.ALREADY_FINISHED);
        assertThat(jobRegistry.find(jobId).orElseThrow().state()).isEqualTo(JobState.DONE);
        verifyNoInteractions(renderExecutor);
    }

    @Test
    void cancelOfUnknownJobIsNotFound() {
        assertThat(service.cancel("missing")).isEqualTo(Outcome.NOT_FOUND);
        verifyNoInteractions(renderExecutor);
    }
}
