package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.JobType;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.NotifyOn;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.model.RunStatus;
import com.opsmonitor.monitoring.persistence.MonitoringJobRepository;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunRecorderTest {

    @Mock
    private MonitoringRunRepository runRepository;

    @Mock
    private MonitoringJobRepository jobRepository;

    private MonitoringProperties properties;
    private RunRecorder recorder;

    @BeforeEach
    void setUp() {
        properties = new MonitoringProperties();
        recorder = new RunRecorder(runRepository, jobRepository, properties);
    }

    @Test
    void startRunInsertsRunningRow() {
        MonitoringJob job = job();

        MonitoringJobRun run = recorder.startRun(job);

        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.jobId()).isEqualTo(job.id());
        assertThat(run.orgId()).isEqualTo(job.orgId());
        verify(runRepository).insertRun(run, true);
    }

    @Test
    void overlappingRunsAreInsertedOutsideTheActiveSlot() {
        properties.getScheduler().setAllowOverlappingRuns(true);

        MonitoringJobRun run = recorder.startRun(job());

        verify(runRepository).insertRun(run, false);
    }

    @Test
    void occupiedActiveSlotIsReportedAsRunInProgress() {
        doThrow(new DuplicateKeyException("monitoring_job_runs_active_job_idx"))
            .when(runRepository).insertRun(any(), anyBoolean());

        assertThatThrownBy(() -> recorder.startRun(job())).isInstanceOf(JobRunInProgressException.class);
    }

    @Test
    void pickupRestampsStartTime() {
        MonitoringJobRun queued = MonitoringJobRun.started(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), Instant.now().minusSeconds(600));
        when(runRepository.markRunStarted(eq(queued.id()), any(Instant.class))).thenReturn(1);

        MonitoringJobRun active = recorder.markPickedUp(queued);

        assertThat(active.id()).isEqualTo(queued.id());
        assertThat(active.startedAt()).isAfter(queued.startedAt().plusSeconds(590));
    }

    @Test
    void pickupOfFinalizedRunReturnsNull() {
        MonitoringJobRun queued = MonitoringJobRun.started(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), Instant.now());
        when(runRepository.markRunStarted(eq(queued.id()), any(Instant.class))).thenReturn(0);

        assertThat(recorder.markPickedUp(queued)).isNull();
    }

    @Test
    void startRunFailureIsReportedAsRunCreationFailure() {
        doThrow(new DataAccessResourceFailureException("db down")).when(runRepository).insertRun(any(), anyBoolean());

        assertThatThrownBy(() -> recorder.startRun(job())).isInstanceOf(RunCreationException.class);
    }

    @Test
    void failedRunErrorMessageIsCapped() {
        properties.getRuns().setMaxErrorLength(10);
        MonitoringJobRun run = MonitoringJobRun.started(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), Instant.now().minusSeconds(3));
        when(runRepository.finishRun(eq(run.id()), any(RunOutcome.class), any(), anyLong())).thenReturn(1);

        boolean finished = recorder.finishRun(run, RunOutcome.failed("Agent API error: HTTP 503 overloaded", Instant.now()));

        assertThat(finished).isTrue();
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Long> duration = ArgumentCaptor.forClass(Long.class);
        verify(runRepository).finishRun(eq(run.id()), any(RunOutcome.class), message.capture(), duration.capture());
        assertThat(message.getValue()).isEqualTo("Agent API ");
        assertThat(duration.getValue()).isGreaterThanOrEqualTo(3_000L);
    }

    @Test
    void finishingTerminalRunIsANoOp() {
        MonitoringJobRun run = MonitoringJobRun.started(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), Instant.now());
        when(runRepository.finishRun(eq(run.id()), any(RunOutcome.class), any(), anyLong())).thenReturn(0);

        assertThat(recorder.finishRun(run, RunOutcome.failed("late", Instant.now()))).isFalse();
    }

    @Test
    void jobUpdateFailureIsLoggedNotThrown() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.updateJobAfterRun(eq(jobId), eq(false), any(Instant.class)))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        recorder.updateJobAfterRun(jobId, false);

        verify(jobRepository).updateJobAfterRun(eq(jobId), eq(false), any(Instant.class));
    }

    private static MonitoringJob job() {
        Instant now = Instant.now();
        return new MonitoringJob(
            UUID.randomUUID(), UUID.randomUUID(), "Recorder", null, JobType.CUSTOM, 5, true, Map.of(),
            NotifyOn.NEVER, null, null, now, 0, now, now, null
        );
    }
}
