package com.opsmonitor.monitoring.credentials;

import java.util.UUID;

/**
 * Per-tenant, per-provider secret storage. Implementations may throw on infrastructure failures;
 * a missing secret is reported as {@code null}, never as an exception.
 */
public interface SecretVault {

    String getSecret(UUID orgId, SecretProvider provider, String secretType);

    void storeSecret(UUID orgId, SecretProvider provider, String secretType, String value);

    boolean deleteSecret(UUID orgId, SecretProvider provider, String secretType);

    int deleteProvider(UUID orgId, SecretProvider provider);
}
