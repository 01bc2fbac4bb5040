package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.CreateMonitoringJobRequest;
import com.opsmonitor.monitoring.model.JobType;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobDetail;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.MonitoringJobView;
import com.opsmonitor.monitoring.model.NotifyOn;
import com.opsmonitor.monitoring.model.UpdateMonitoringJobRequest;
import com.opsmonitor.monitoring.persistence.MonitoringJobRepository;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Tenant-scoped job management. Keeps {@code nextRunAt} set exactly when a job is enabled.
 */
@Service
public class MonitoringJobService {
    private static final Logger log = LoggerFactory.getLogger(MonitoringJobService.class);
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final MonitoringJobRepository jobRepository;
    private final MonitoringRunRepository runRepository;
    private final MonitoringProperties properties;

    public MonitoringJobService(
        MonitoringJobRepository jobRepository,
        MonitoringRunRepository runRepository,
        MonitoringProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.properties = properties;
    }

    public List<MonitoringJobView> listJobs(UUID orgId) {
        List<MonitoringJob> jobs = jobRepository.findJobsForOrg(orgId);
        Map<UUID, MonitoringJobRun> latestRuns = runRepository.findLatestRunsForOrg(orgId);
        List<MonitoringJobView> views = new ArrayList<>(jobs.size());
        for (MonitoringJob job : jobs) {
            views.add(new MonitoringJobView(job, latestRuns.get(job.id())));
        }
        return views;
    }

    public MonitoringJobDetail getJob(UUID orgId, UUID jobId) {
        MonitoringJob job = requireJob(orgId, jobId);
        List<MonitoringJobRun> runs = runRepository.findRunsForJob(orgId, jobId, properties.getRuns().getHistoryLimit());
        return new MonitoringJobDetail(job, runs);
    }

    public MonitoringJobRun getRun(UUID orgId, UUID jobId, UUID runId) {
        MonitoringJobRun run = runRepository.findRun(orgId, jobId, runId);
        if (run == null) {
            throw new MonitoringJobNotFoundException("Monitoring job run not found: " + runId);
        }
        return run;
    }

    public MonitoringJob createJob(UUID orgId, CreateMonitoringJobRequest request, String createdBy) {
        if (request == null) {
            throw new InvalidMonitoringJobException("Request body is required");
        }
        String name = validateName(request.name());
        String description = validateDescription(request.description());
        JobType jobType = parseJobType(request.jobType());
        if (request.scheduleIntervalMinutes() == null) {
            throw new InvalidMonitoringJobException("scheduleIntervalMinutes is required");
        }
        int interval = validateInterval(request.scheduleIntervalMinutes());
        boolean enabled = request.enabled() == null || request.enabled();
        NotifyOn notifyOn = request.notifyOn() == null ? NotifyOn.ISSUES : parseNotifyOn(request.notifyOn());
        Instant now = Instant.now();

        MonitoringJob job = new MonitoringJob(
            UUID.randomUUID(),
            orgId,
            name,
            description,
            jobType,
            interval,
            enabled,
            request.config(),
            notifyOn,
            blankToNull(request.slackChannelId()),
            null,
            enabled ? now.plusSeconds(interval * 60L) : null,
            0,
            now,
            now,
            blankToNull(createdBy)
        );
        jobRepository.insertJob(job);
        log.info("Created monitoring job {} ({}, {}) for org {}", job.id(), job.name(), jobType.wireValue(), orgId);
        return job;
    }

    public MonitoringJob updateJob(UUID orgId, UUID jobId, UpdateMonitoringJobRequest request) {
        if (request == null) {
            throw new InvalidMonitoringJobException("Request body is required");
        }
        MonitoringJob existing = requireJob(orgId, jobId);
        String name = request.name() == null ? existing.name() : validateName(request.name());
        String description = request.description() == null
            ? existing.description()
            : validateDescription(request.description());
        int interval = request.scheduleIntervalMinutes() == null
            ? existing.scheduleIntervalMinutes()
            : validateInterval(request.scheduleIntervalMinutes());
        NotifyOn notifyOn = request.notifyOn() == null ? existing.notifyOn() : parseNotifyOn(request.notifyOn());
        Map<String, Object> config = request.config() == null ? existing.config() : request.config();
        String slackChannelId = request.slackChannelId() == null
            ? existing.slackChannelId()
            : blankToNull(request.slackChannelId());

        Instant now = Instant.now();
        boolean enabled = existing.enabled();
        Instant nextRunAt = existing.nextRunAt();
        if (Boolean.TRUE.equals(request.enabled())) {
            enabled = true;
            nextRunAt = now.plusSeconds(interval * 60L);
        } else if (Boolean.FALSE.equals(request.enabled())) {
            enabled = false;
            nextRunAt = null;
        }

        MonitoringJob updated = new MonitoringJob(
            existing.id(),
            existing.orgId(),
            name,
            description,
            existing.jobType(),
            interval,
            enabled,
            config,
            notifyOn,
            slackChannelId,
            existing.lastRunAt(),
            nextRunAt,
            existing.consecutiveFailures(),
            existing.createdAt(),
            now,
            existing.createdBy()
        );
        if (jobRepository.updateJob(updated, request.enabled() != null) == 0) {
            throw new MonitoringJobNotFoundException("Monitoring job not found: " + jobId);
        }
        return updated;
    }

    public void deleteJob(UUID orgId, UUID jobId) {
        if (jobRepository.deleteJob(orgId, jobId) == 0) {
            throw new MonitoringJobNotFoundException("Monitoring job not found: " + jobId);
        }
        log.info("Deleted monitoring job {} for org {}", jobId, orgId);
    }

    private MonitoringJob requireJob(UUID orgId, UUID jobId) {
        MonitoringJob job = jobRepository.findJob(orgId, jobId);
        if (job == null) {
            throw new MonitoringJobNotFoundException("Monitoring job not found: " + jobId);
        }
        return job;
    }

    private String validateName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            throw new InvalidMonitoringJobException("name must be 1-" + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }

    private String validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidMonitoringJobException(
                "description must be at most " + MAX_DESCRIPTION_LENGTH + " characters"
            );
        }
        return description;
    }

    private int validateInterval(int interval) {
        if (interval < MonitoringJob.MIN_INTERVAL_MINUTES || interval > MonitoringJob.MAX_INTERVAL_MINUTES) {
            throw new InvalidMonitoringJobException(
                "scheduleIntervalMinutes must be between "
                    + MonitoringJob.MIN_INTERVAL_MINUTES
                    + " and "
                    + MonitoringJob.MAX_INTERVAL_MINUTES
            );
        }
        return interval;
    }

    private JobType parseJobType(String raw) {
        JobType jobType = JobType.fromWire(raw);
        if (jobType == null) {
            throw new InvalidMonitoringJobException("jobType must be one of " + Arrays.stream(JobType.values())
                .map(JobType::wireValue)
                .collect(Collectors.joining(", ")));
        }
        return jobType;
    }

    private NotifyOn parseNotifyOn(String raw) {
        NotifyOn notifyOn = NotifyOn.fromWire(raw);
        if (notifyOn == null) {
            throw new InvalidMonitoringJobException("notifyOn must be one of " + Arrays.stream(NotifyOn.values())
                .map(NotifyOn::wireValue)
                .collect(Collectors.joining(", ")));
        }
        return notifyOn;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
