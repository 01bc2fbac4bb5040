package com.opsmonitor.monitoring.api;

import com.opsmonitor.monitoring.model.IntegrationStatusResponse;
import com.opsmonitor.monitoring.service.IntegrationSecretService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {
    private final IntegrationSecretService secretService;

    public IntegrationController(IntegrationSecretService secretService) {
        this.secretService = secretService;
    }

    @GetMapping
    public IntegrationStatusResponse status(@RequestHeader(MonitoringJobController.ORG_HEADER) UUID orgId) {
        return secretService.getStatus(orgId);
    }

    @PutMapping("/{provider}")
    public IntegrationStatusResponse storeSecrets(
        @RequestHeader(MonitoringJobController.ORG_HEADER) UUID orgId,
        @PathVariable("provider") String provider,
        @RequestBody(required = false) Map<String, String> secrets
    ) {
        return secretService.storeSecrets(orgId, provider, secrets);
    }

    @DeleteMapping("/{provider}")
    public Map<String, Object> deleteSecrets(
        @RequestHeader(MonitoringJobController.ORG_HEADER) UUID orgId,
        @PathVariable("provider") String provider
    ) {
        int removed = secretService.deleteSecrets(orgId, provider);
        return Map.of("provider", provider, "removed", removed);
    }
}
