package com.opsmonitor.monitoring.service;

import com.opsmonitor.monitoring.model.AlertDecision;
import com.opsmonitor.monitoring.model.AlertSeverity;
import com.opsmonitor.monitoring.model.Finding;
import com.opsmonitor.monitoring.model.FindingType;
import com.opsmonitor.monitoring.model.NotifyOn;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AlertDecisionEngine {

    public AlertDecision decide(List<Finding> findings, NotifyOn notifyOn, boolean hasSlackCredentials) {
        List<Finding> safeFindings = findings == null ? List.of() : findings;
        boolean hasIssues = safeFindings.stream().anyMatch(Finding::isIssue);
        boolean shouldAlert = notifyOn == NotifyOn.ALWAYS || (notifyOn == NotifyOn.ISSUES && hasIssues);
        if (!shouldAlert) {
            return AlertDecision.none();
        }
        return new AlertDecision(true, hasSlackCredentials, severity(safeFindings));
    }

    private AlertSeverity severity(List<Finding> findings) {
        if (findings.stream().anyMatch(finding -> finding.type() == FindingType.ERROR)) {
            return AlertSeverity.CRITICAL;
        }
        if (findings.stream().anyMatch(finding -> finding.type() == FindingType.WARNING)) {
            return AlertSeverity.WARNING;
        }
        return AlertSeverity.INFO;
    }
}
