package com.opsmonitor.monitoring.service;

import com.opsmonitor.monitoring.credentials.CredentialLoader;
import com.opsmonitor.monitoring.credentials.Credentials;
import com.opsmonitor.monitoring.credentials.SecretProvider;
import com.opsmonitor.monitoring.credentials.SecretVault;
import com.opsmonitor.monitoring.model.IntegrationStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Stores and removes tenant integration secrets. Values are write-only through this service; status
 * reports only which providers would be usable by a job run.
 */
@Service
public class IntegrationSecretService {
    private static final Logger log = LoggerFactory.getLogger(IntegrationSecretService.class);

    private final SecretVault vault;
    private final CredentialLoader credentialLoader;

    public IntegrationSecretService(SecretVault vault, CredentialLoader credentialLoader) {
        this.vault = vault;
        this.credentialLoader = credentialLoader;
    }

    public IntegrationStatusResponse getStatus(UUID orgId) {
        Credentials credentials = credentialLoader.load(orgId);
        return new IntegrationStatusResponse(
            orgId,
            credentials.datadog().isPresent(),
            credentials.github().isPresent(),
            credentials.slack().isPresent()
        );
    }

    public IntegrationStatusResponse storeSecrets(UUID orgId, String providerKey, Map<String, String> secrets) {
        SecretProvider provider = requireProvider(providerKey);
        if (secrets == null || secrets.isEmpty()) {
            throw new InvalidIntegrationRequestException("At least one secret is required");
        }
        for (Map.Entry<String, String> entry : secrets.entrySet()) {
            if (!provider.accepts(entry.getKey())) {
                throw new InvalidIntegrationRequestException(
                    "Unsupported secret type for " + provider.key() + ": " + entry.getKey()
                        + " (allowed: " + String.join(", ", provider.secretTypes()) + ")"
                );
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new InvalidIntegrationRequestException("Secret " + entry.getKey() + " must not be blank");
            }
        }
        for (Map.Entry<String, String> entry : secrets.entrySet()) {
            vault.storeSecret(orgId, provider, entry.getKey(), entry.getValue().trim());
        }
        log.info("Stored {} {} secret(s) for org {}", secrets.size(), provider.key(), orgId);
        return getStatus(orgId);
    }

    public int deleteSecrets(UUID orgId, String providerKey) {
        SecretProvider provider = requireProvider(providerKey);
        int removed = vault.deleteProvider(orgId, provider);
        log.info("Removed {} {} secret(s) for org {}", removed, provider.key(), orgId);
        return removed;
    }

    private SecretProvider requireProvider(String providerKey) {
        SecretProvider provider = SecretProvider.fromKey(providerKey);
        if (provider == null) {
            throw new InvalidIntegrationRequestException("Unknown integration provider: " + providerKey);
        }
        return provider;
    }
}
