package com.opsmonitor.monitoring.api;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.SchedulerStatusResponse;
import com.opsmonitor.monitoring.model.TickSummary;
import com.opsmonitor.monitoring.service.JobScheduler;
import com.opsmonitor.monitoring.service.MonitoringSchedulerDaemon;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.springframework.http.HttpStatus.UNAUTHORIZED;

@RestController
@RequestMapping("/api")
public class MonitoringSchedulerController {
    private static final String BEARER_PREFIX = "Bearer ";

    private final JobScheduler jobScheduler;
    private final MonitoringSchedulerDaemon daemon;
    private final MonitoringProperties properties;

    public MonitoringSchedulerController(
        JobScheduler jobScheduler,
        MonitoringSchedulerDaemon daemon,
        MonitoringProperties properties
    ) {
        this.jobScheduler = jobScheduler;
        this.daemon = daemon;
        this.properties = properties;
    }

    /**
     * External cron entry point. Requires the configured bearer secret when one is set.
     */
    @RequestMapping(value = "/cron/monitoring", method = {RequestMethod.GET, RequestMethod.POST})
    public TickSummary cronTick(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        requireCronSecret(authorization);
        return jobScheduler.tick();
    }

    @PostMapping("/scheduler/start")
    public SchedulerStatusResponse start() {
        daemon.start();
        return daemon.getStatus();
    }

    @PostMapping("/scheduler/stop")
    public SchedulerStatusResponse stop() {
        daemon.stop();
        return daemon.getStatus();
    }

    @GetMapping("/scheduler/status")
    public SchedulerStatusResponse status() {
        return daemon.getStatus();
    }

    private void requireCronSecret(String authorization) {
        String secret = properties.getScheduler().getCronSecret();
        if (secret == null) {
            return;
        }
        String presented = authorization != null && authorization.startsWith(BEARER_PREFIX)
            ? authorization.substring(BEARER_PREFIX.length()).trim()
            : "";
        boolean matches = MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            secret.getBytes(StandardCharsets.UTF_8)
        );
        if (!matches) {
            throw new ResponseStatusException(UNAUTHORIZED, "Invalid cron secret");
        }
    }
}
