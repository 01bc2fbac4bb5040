package com.opsmonitor.monitoring.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsmonitor.monitoring.model.AlertSeverity;
import com.opsmonitor.monitoring.model.Finding;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class MonitoringRunRepository {
    private static final Logger log = LoggerFactory.getLogger(MonitoringRunRepository.class);
    private static final TypeReference<List<Finding>> FINDING_LIST = new TypeReference<>() {};
    private static final String RUN_COLUMNS = """
        id, job_id, org_id, status, summary, findings, error_message, alert_sent, alert_severity,
        started_at, completed_at, duration_ms
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public MonitoringRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts a run. An exclusive running run occupies its job's active slot until it finishes, so a
     * second exclusive insert for the same job fails with {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insertRun(MonitoringJobRun run, boolean exclusive) {
        boolean occupiesSlot = exclusive && run.status() == RunStatus.RUNNING;
        jdbc.update(
            """
                INSERT INTO monitoring_job_runs (
                    id, job_id, org_id, status, summary, findings, error_message, alert_sent, alert_severity,
                    started_at, completed_at, duration_ms, active_job_id
                )
                VALUES (
                    :id, :jobId, :orgId, :status, :summary, :findings, :errorMessage, :alertSent, :alertSeverity,
                    :startedAt, :completedAt, :durationMs, :activeJobId
                )
                """,
            new MapSqlParameterSource()
                .addValue("id", run.id())
                .addValue("jobId", run.jobId())
                .addValue("activeJobId", occupiesSlot ? run.jobId() : null)
                .addValue("orgId", run.orgId())
                .addValue("status", run.status().wireValue())
                .addValue("summary", run.summary())
                .addValue("findings", writeFindings(run.findings()))
                .addValue("errorMessage", run.errorMessage())
                .addValue("alertSent", run.alertSent())
                .addValue("alertSeverity", run.alertSeverity() == null ? null : run.alertSeverity().wireValue())
                .addValue("startedAt", toTimestamp(run.startedAt()))
                .addValue("completedAt", toTimestamp(run.completedAt()))
                .addValue("durationMs", run.durationMs())
        );
    }

    /**
     * Writes the terminal state of a run. Only a run still marked running is touched, so a run that
     * already finished keeps its first outcome.
     *
     * @return number of rows updated, 0 when the run was missing or already terminal
     */
    public int finishRun(UUID runId, RunOutcome outcome, String errorMessage, long durationMs) {
        return jdbc.update(
            """
                UPDATE monitoring_job_runs
                SET status = :status,
                    summary = :summary,
                    findings = :findings,
                    error_message = :errorMessage,
                    alert_sent = :alertSent,
                    alert_severity = :alertSeverity,
                    completed_at = :completedAt,
                    duration_ms = :durationMs,
                    active_job_id = NULL
                WHERE id = :runId
                  AND status = 'running'
                """,
            finishParams(runId, outcome, errorMessage).addValue("durationMs", Math.max(0L, durationMs))
        );
    }

    /**
     * Restamps a queued run with the moment a worker actually picked it up.
     *
     * @return 0 when the run is no longer running, for example after a stale sweep failed it
     */
    public int markRunStarted(UUID runId, Instant startedAt) {
        return jdbc.update(
            """
                UPDATE monitoring_job_runs
                SET started_at = :startedAt
                WHERE id = :runId
                  AND status = 'running'
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("startedAt", toTimestamp(startedAt))
        );
    }

    public MonitoringJobRun findRunById(UUID runId) {
        List<MonitoringJobRun> runs = jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM monitoring_job_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource().addValue("runId", runId),
            runRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public MonitoringJobRun findRun(UUID orgId, UUID jobId, UUID runId) {
        List<MonitoringJobRun> runs = jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM monitoring_job_runs
                WHERE id = :runId
                  AND job_id = :jobId
                  AND org_id = :orgId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("jobId", jobId)
                .addValue("orgId", orgId),
            runRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public List<MonitoringJobRun> findRunsForJob(UUID orgId, UUID jobId, int limit) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM monitoring_job_runs
                WHERE job_id = :jobId
                  AND org_id = :orgId
                ORDER BY started_at DESC, id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("orgId", orgId)
                .addValue("limit", Math.max(1, limit)),
            runRowMapper()
        );
    }

    /**
     * Most recent run per job for one tenant, keyed by job id.
     */
    public Map<UUID, MonitoringJobRun> findLatestRunsForOrg(UUID orgId) {
        List<MonitoringJobRun> runs = jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM monitoring_job_runs r
                WHERE r.org_id = :orgId
                  AND r.started_at = (
                      SELECT MAX(latest.started_at)
                      FROM monitoring_job_runs latest
                      WHERE latest.job_id = r.job_id
                  )
                ORDER BY r.started_at DESC, r.id
                """,
            new MapSqlParameterSource().addValue("orgId", orgId),
            runRowMapper()
        );
        Map<UUID, MonitoringJobRun> latest = new LinkedHashMap<>();
        for (MonitoringJobRun run : runs) {
            latest.putIfAbsent(run.jobId(), run);
        }
        return latest;
    }

    public boolean hasRunningRun(UUID jobId) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM monitoring_job_runs
                WHERE job_id = :jobId
                  AND status = 'running'
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            Long.class
        );
        return count != null && count > 0;
    }

    public long countRunningRuns() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM monitoring_job_runs WHERE status = 'running'",
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public List<MonitoringJobRun> findStaleRunningRuns(Instant startedBefore) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM monitoring_job_runs
                WHERE status = 'running'
                  AND started_at < :cutoff
                ORDER BY started_at ASC, id
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(startedBefore)),
            runRowMapper()
        );
    }

    private MapSqlParameterSource finishParams(UUID runId, RunOutcome outcome, String errorMessage) {
        return new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("status", outcome.status().wireValue())
            .addValue("summary", outcome.summary())
            .addValue("findings", writeFindings(outcome.findings()))
            .addValue("errorMessage", errorMessage)
            .addValue("alertSent", outcome.alertSent())
            .addValue("alertSeverity", outcome.alertSeverity() == null ? null : outcome.alertSeverity().wireValue())
            .addValue("completedAt", toTimestamp(outcome.completedAt()));
    }

    private RowMapper<MonitoringJobRun> runRowMapper() {
        return (rs, rowNum) -> {
            long duration = rs.getLong("duration_ms");
            Long durationMs = rs.wasNull() ? null : duration;
            return new MonitoringJobRun(
                rs.getObject("id", UUID.class),
                rs.getObject("job_id", UUID.class),
                rs.getObject("org_id", UUID.class),
                RunStatus.fromWire(rs.getString("status")),
                rs.getString("summary"),
                readFindings(rs.getString("findings")),
                rs.getString("error_message"),
                rs.getBoolean("alert_sent"),
                AlertSeverity.fromWire(rs.getString("alert_severity")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                durationMs
            );
        };
    }

    private List<Finding> readFindings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<Finding> findings = objectMapper.readValue(json, FINDING_LIST);
            return findings == null ? List.of() : findings;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable stored findings: {}", e.getMessage());
            return List.of();
        }
    }

    private String writeFindings(List<Finding> findings) {
        try {
            return objectMapper.writeValueAsString(findings == null ? List.of() : findings);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Findings are not serializable", e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
