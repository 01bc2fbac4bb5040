package com.opsmonitor.monitoring.api;

import com.opsmonitor.monitoring.model.CreateMonitoringJobRequest;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobDetail;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.MonitoringJobView;
import com.opsmonitor.monitoring.model.UpdateMonitoringJobRequest;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import com.opsmonitor.monitoring.service.InvalidMonitoringJobException;
import com.opsmonitor.monitoring.service.JobRunInProgressException;
import com.opsmonitor.monitoring.service.MonitoringJobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class MonitoringJobControllerTest {

    @Autowired
    private MonitoringJobController controller;

    @Autowired
    private MonitoringRunRepository runRepository;

    @Test
    void createListGetAndDeleteJob() {
        UUID orgId = UUID.randomUUID();
        MonitoringJob created = controller.createJob(orgId, "user-7", new CreateMonitoringJobRequest(
            "Checkout health",
            "Watch the checkout path",
            "health_check",
            15,
            null,
            Map.of("services", List.of("checkout")),
            "issues",
            null
        ));

        List<MonitoringJobView> jobs = controller.listJobs(orgId);
        assertThat(jobs).singleElement().satisfies(view -> {
            assertThat(view.job().id()).isEqualTo(created.id());
            assertThat(view.latestRun()).isNull();
        });

        MonitoringJobRun run = MonitoringJobRun.started(UUID.randomUUID(), created.id(), orgId, Instant.now());
        runRepository.insertRun(run, true);
        MonitoringJobDetail detail = controller.getJob(orgId, created.id());
        assertThat(detail.job().createdBy()).isEqualTo("user-7");
        assertThat(detail.runs()).extracting(MonitoringJobRun::id).containsExactly(run.id());
        assertThat(controller.getRun(orgId, created.id(), run.id()).id()).isEqualTo(run.id());

        assertThat(controller.deleteJob(orgId, created.id())).containsEntry("success", true);
        assertThatThrownBy(() -> controller.getJob(orgId, created.id())).isInstanceOf(MonitoringJobNotFoundException.class);
    }

    @Test
    void patchDisablesJob() {
        UUID orgId = UUID.randomUUID();
        MonitoringJob created = controller.createJob(orgId, null, new CreateMonitoringJobRequest(
            "Errors", null, "error_scanner", 30, true, null, null, null
        ));

        MonitoringJob updated = controller.updateJob(
            orgId,
            created.id(),
            new UpdateMonitoringJobRequest("Errors (paused)", null, null, false, null, "never", null)
        );

        assertThat(updated.name()).isEqualTo("Errors (paused)");
        assertThat(updated.enabled()).isFalse();
        assertThat(updated.nextRunAt()).isNull();
        assertThat(controller.getJob(orgId, created.id()).job().nextRunAt()).isNull();
    }

    @Test
    void invalidCreateIsRejected() {
        assertThatThrownBy(() -> controller.createJob(UUID.randomUUID(), null, new CreateMonitoringJobRequest(
            "Fast", null, "custom", 1, true, null, null, null
        ))).isInstanceOf(InvalidMonitoringJobException.class);
    }

    @Test
    void manualTriggerIsRefusedWhileRunInProgress() {
        UUID orgId = UUID.randomUUID();
        MonitoringJob created = controller.createJob(orgId, null, new CreateMonitoringJobRequest(
            "Busy", null, "custom", 15, true, Map.of("prompt", "Check queues"), null, null
        ));
        runRepository.insertRun(MonitoringJobRun.started(UUID.randomUUID(), created.id(), orgId, Instant.now()), true);

        assertThatThrownBy(() -> controller.triggerRun(orgId, created.id())).isInstanceOf(JobRunInProgressException.class);
        assertThatThrownBy(() -> controller.triggerRun(UUID.randomUUID(), created.id()))
            .isInstanceOf(MonitoringJobNotFoundException.class);
    }
}
