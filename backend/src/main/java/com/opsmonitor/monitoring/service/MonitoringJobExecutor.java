package com.opsmonitor.monitoring.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.opsmonitor.monitoring.agent.AgentClient;
import com.opsmonitor.monitoring.agent.AgentRunRequest;
import com.opsmonitor.monitoring.agent.AlertContext;
import com.opsmonitor.monitoring.credentials.CredentialLoader;
import com.opsmonitor.monitoring.credentials.Credentials;
import com.opsmonitor.monitoring.model.AlertDecision;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.ParsedAgentResult;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.model.RunTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Runs one job end to end against an already opened run row. Every failure inside the pipeline ends
 * up as a failed run; nothing escapes to the worker pool.
 */
@Service
public class MonitoringJobExecutor {
    private static final Logger log = LoggerFactory.getLogger(MonitoringJobExecutor.class);
    static final String ALERT_SERVICE = "monitoring";
    static final String ALERT_SEVERITY = "info";

    private final CredentialLoader credentialLoader;
    private final PromptBuilder promptBuilder;
    private final AgentClient agentClient;
    private final ResponseParser responseParser;
    private final AlertDecisionEngine alertDecisionEngine;
    private final RunRecorder runRecorder;

    public MonitoringJobExecutor(
        CredentialLoader credentialLoader,
        PromptBuilder promptBuilder,
        AgentClient agentClient,
        ResponseParser responseParser,
        AlertDecisionEngine alertDecisionEngine,
        RunRecorder runRecorder
    ) {
        this.credentialLoader = credentialLoader;
        this.promptBuilder = promptBuilder;
        this.agentClient = agentClient;
        this.responseParser = responseParser;
        this.alertDecisionEngine = alertDecisionEngine;
        this.runRecorder = runRecorder;
    }

    public RunOutcome execute(MonitoringJob job, MonitoringJobRun run, RunTrigger trigger) {
        RunOutcome outcome;
        try {
            outcome = runPipeline(job, trigger);
            log.info(
                "Monitoring job {} ({}) run {} completed: {} findings, alert={}",
                job.id(),
                job.name(),
                run.id(),
                outcome.findings().size(),
                outcome.alertSent()
            );
        } catch (RuntimeException e) {
            log.warn("Monitoring job {} ({}) run {} failed: {}", job.id(), job.name(), run.id(), e.getMessage());
            outcome = RunOutcome.failed(e.getMessage(), Instant.now());
        }
        try {
            runRecorder.finishRun(run, outcome);
        } finally {
            runRecorder.updateJobAfterRun(job.id(), outcome.isSuccess());
        }
        return outcome;
    }

    private RunOutcome runPipeline(MonitoringJob job, RunTrigger trigger) {
        Credentials credentials = credentialLoader.load(job.orgId());
        String prompt = promptBuilder.build(job.jobType(), job.scheduleIntervalMinutes(), job.config());
        Instant startedAt = Instant.now();
        AgentRunRequest request = new AgentRunRequest(
            investigationId(job, startedAt),
            job.orgId(),
            new AlertContext(trigger.alertName(job.name()), ALERT_SERVICE, ALERT_SEVERITY, prompt),
            prompt,
            credentials,
            job.slackChannelId(),
            startedAt
        );

        JsonNode rawOutput = agentClient.run(request);
        ParsedAgentResult parsed = responseParser.parse(rawOutput);
        AlertDecision decision = alertDecisionEngine.decide(parsed.findings(), job.notifyOn(), credentials.hasSlack());
        return RunOutcome.completed(parsed, decision, Instant.now());
    }

    static String investigationId(MonitoringJob job, Instant startedAt) {
        return "monitoring-" + job.id() + "-" + startedAt.toEpochMilli();
    }
}
