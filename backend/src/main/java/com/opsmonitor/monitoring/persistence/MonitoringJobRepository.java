package com.opsmonitor.monitoring.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsmonitor.monitoring.model.JobType;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.NotifyOn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class MonitoringJobRepository {
    private static final Logger log = LoggerFactory.getLogger(MonitoringJobRepository.class);
    private static final TypeReference<Map<String, Object>> CONFIG_MAP = new TypeReference<>() {};
    private static final String JOB_COLUMNS = """
        id, org_id, name, description, job_type, schedule_interval_minutes, enabled, config,
        notify_on, slack_channel_id, last_run_at, next_run_at, consecutive_failures,
        created_at, updated_at, created_by
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public MonitoringJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public void insertJob(MonitoringJob job) {
        jdbc.update(
            """
                INSERT INTO monitoring_jobs (
                    id, org_id, name, description, job_type, schedule_interval_minutes, enabled, config,
                    notify_on, slack_channel_id, last_run_at, next_run_at, consecutive_failures,
                    created_at, updated_at, created_by
                )
                VALUES (
                    :id, :orgId, :name, :description, :jobType, :scheduleIntervalMinutes, :enabled, :config,
                    :notifyOn, :slackChannelId, :lastRunAt, :nextRunAt, :consecutiveFailures,
                    :createdAt, :updatedAt, :createdBy
                )
                """,
            jobParams(job)
        );
    }

    /**
     * Writes the user-editable settings of a job. Scheduler-owned state (last run, failure streak) is
     * never touched, and {@code enabled}/{@code next_run_at} only when the caller changed the schedule,
     * so a concurrent claim or run outcome is not reverted.
     */
    public int updateJob(MonitoringJob job, boolean scheduleChanged) {
        String scheduleColumns = scheduleChanged
            ? """
                    enabled = :enabled,
                    next_run_at = :nextRunAt,
                """
            : "";
        return jdbc.update(
            """
                UPDATE monitoring_jobs
                SET name = :name,
                    description = :description,
                    schedule_interval_minutes = :scheduleIntervalMinutes,
                    config = :config,
                    notify_on = :notifyOn,
                    slack_channel_id = :slackChannelId,
                """
                + scheduleColumns
                + """
                    updated_at = :updatedAt
                WHERE id = :id
                  AND org_id = :orgId
                """,
            jobParams(job)
        );
    }

    public int deleteJob(UUID orgId, UUID jobId) {
        return jdbc.update(
            """
                DELETE FROM monitoring_jobs
                WHERE id = :jobId
                  AND org_id = :orgId
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("orgId", orgId)
        );
    }

    public MonitoringJob findJob(UUID orgId, UUID jobId) {
        List<MonitoringJob> jobs = jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM monitoring_jobs
                WHERE id = :jobId
                  AND org_id = :orgId
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("orgId", orgId),
            jobRowMapper()
        );
        return jobs.isEmpty() ? null : jobs.get(0);
    }

    public List<MonitoringJob> findJobsForOrg(UUID orgId) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM monitoring_jobs
                WHERE org_id = :orgId
                ORDER BY created_at DESC, id
                """,
            new MapSqlParameterSource().addValue("orgId", orgId),
            jobRowMapper()
        );
    }

    /**
     * Enabled jobs across all tenants whose next run is due, oldest first.
     */
    public List<MonitoringJob> findDueJobs(Instant now, int limit) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM monitoring_jobs
                WHERE enabled = TRUE
                  AND next_run_at IS NOT NULL
                  AND next_run_at <= :now
                ORDER BY next_run_at ASC, id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("limit", Math.max(1, limit)),
            jobRowMapper()
        );
    }

    public long countDueJobs(Instant now) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM monitoring_jobs
                WHERE enabled = TRUE
                  AND next_run_at IS NOT NULL
                  AND next_run_at <= :now
                """,
            new MapSqlParameterSource().addValue("now", toTimestamp(now)),
            Long.class
        );
        return count == null ? 0L : count;
    }

    /**
     * Moves a due job's next run forward, but only if nobody else did since it was read.
     *
     * @return whether this caller owns the dispatch
     */
    public boolean claimDueJob(UUID jobId, Instant observedNextRunAt, Instant nextRunAt) {
        int updated = jdbc.update(
            """
                UPDATE monitoring_jobs
                SET next_run_at = :nextRunAt,
                    updated_at = :now
                WHERE id = :jobId
                  AND enabled = TRUE
                  AND next_run_at = :observedNextRunAt
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("observedNextRunAt", toTimestamp(observedNextRunAt))
                .addValue("nextRunAt", toTimestamp(nextRunAt))
                .addValue("now", toTimestamp(Instant.now()))
        );
        return updated == 1;
    }

    /**
     * Success resets the failure streak and reschedules an enabled job; failure only counts.
     */
    @Transactional
    public boolean updateJobAfterRun(UUID jobId, boolean success, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now));
        if (!success) {
            int updated = jdbc.update(
                """
                    UPDATE monitoring_jobs
                    SET last_run_at = :now,
                        consecutive_failures = consecutive_failures + 1,
                        updated_at = :now
                    WHERE id = :jobId
                    """,
                params
            );
            return updated == 1;
        }

        List<Integer> intervals = jdbc.query(
            """
                SELECT schedule_interval_minutes
                FROM monitoring_jobs
                WHERE id = :jobId
                """,
            params,
            (rs, rowNum) -> rs.getInt("schedule_interval_minutes")
        );
        if (intervals.isEmpty()) {
            return false;
        }
        jdbc.update(
            """
                UPDATE monitoring_jobs
                SET last_run_at = :now,
                    consecutive_failures = 0,
                    updated_at = :now
                WHERE id = :jobId
                """,
            params
        );
        jdbc.update(
            """
                UPDATE monitoring_jobs
                SET next_run_at = :nextRunAt
                WHERE id = :jobId
                  AND enabled = TRUE
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("nextRunAt", toTimestamp(now.plusSeconds(intervals.get(0) * 60L)))
        );
        return true;
    }

    private MapSqlParameterSource jobParams(MonitoringJob job) {
        return new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("orgId", job.orgId())
            .addValue("name", job.name())
            .addValue("description", job.description())
            .addValue("jobType", job.jobType().wireValue())
            .addValue("scheduleIntervalMinutes", job.scheduleIntervalMinutes())
            .addValue("enabled", job.enabled())
            .addValue("config", writeConfig(job.config()))
            .addValue("notifyOn", job.notifyOn().wireValue())
            .addValue("slackChannelId", job.slackChannelId())
            .addValue("lastRunAt", toTimestamp(job.lastRunAt()))
            .addValue("nextRunAt", toTimestamp(job.nextRunAt()))
            .addValue("consecutiveFailures", job.consecutiveFailures())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()))
            .addValue("createdBy", job.createdBy());
    }

    private RowMapper<MonitoringJob> jobRowMapper() {
        return (rs, rowNum) -> new MonitoringJob(
            rs.getObject("id", UUID.class),
            rs.getObject("org_id", UUID.class),
            rs.getString("name"),
            rs.getString("description"),
            JobType.fromWire(rs.getString("job_type")),
            rs.getInt("schedule_interval_minutes"),
            rs.getBoolean("enabled"),
            readConfig(rs.getString("config")),
            NotifyOn.fromWire(rs.getString("notify_on")),
            rs.getString("slack_channel_id"),
            toInstant(rs.getTimestamp("last_run_at")),
            toInstant(rs.getTimestamp("next_run_at")),
            rs.getInt("consecutive_failures"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getString("created_by")
        );
    }

    private Map<String, Object> readConfig(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> config = objectMapper.readValue(json, CONFIG_MAP);
            return config == null ? Map.of() : config;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable monitoring job config: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private String writeConfig(Map<String, Object> config) {
        try {
            return objectMapper.writeValueAsString(config == null ? Map.of() : config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Monitoring job config is not serializable", e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
