package com.opsmonitor.monitoring.credentials;

import com.opsmonitor.config.MonitoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the provider credentials a tenant has connected. Every secret is fetched concurrently;
 * a provider is only returned when all of its required secrets resolve to non-blank values. Vault
 * failures and timeouts degrade to "provider absent". Secret values are never logged.
 */
@Service
public class CredentialLoader {
    private static final Logger log = LoggerFactory.getLogger(CredentialLoader.class);

    private final SecretVault vault;
    private final MonitoringProperties properties;
    private final ExecutorService executor;

    public CredentialLoader(
        SecretVault vault,
        MonitoringProperties properties,
        @Qualifier("credentialExecutor") ExecutorService executor
    ) {
        this.vault = vault;
        this.properties = properties;
        this.executor = executor;
    }

    public Credentials load(UUID orgId) {
        long deadlineNanos = System.nanoTime()
            + TimeUnit.SECONDS.toNanos(properties.getCredentials().getTimeoutSeconds());

        CompletableFuture<Optional<DatadogCredentials>> datadog = loadDatadog(orgId);
        CompletableFuture<Optional<GitHubCredentials>> github = loadGitHub(orgId);
        CompletableFuture<Optional<SlackCredentials>> slack = loadSlack(orgId);

        Credentials credentials = new Credentials(
            await(datadog, SecretProvider.DATADOG, orgId, deadlineNanos),
            await(github, SecretProvider.GITHUB, orgId, deadlineNanos),
            await(slack, SecretProvider.SLACK, orgId, deadlineNanos)
        );
        log.debug("Loaded credentials for org {}: providers={}", orgId, credentials.connectedProviders());
        return credentials;
    }

    private CompletableFuture<Optional<DatadogCredentials>> loadDatadog(UUID orgId) {
        CompletableFuture<String> apiKey = fetch(orgId, SecretProvider.DATADOG, SecretType.API_KEY);
        CompletableFuture<String> appKey = fetch(orgId, SecretProvider.DATADOG, SecretType.APP_KEY);
        CompletableFuture<String> site = fetch(orgId, SecretProvider.DATADOG, SecretType.SITE);
        return CompletableFuture.allOf(apiKey, appKey, site).thenApply(ignored -> {
            if (isBlank(apiKey.join()) || isBlank(appKey.join())) {
                return Optional.empty();
            }
            String resolvedSite = isBlank(site.join())
                ? properties.getDatadog().getDefaultSite()
                : site.join().trim();
            return Optional.of(new DatadogCredentials(apiKey.join(), appKey.join(), resolvedSite));
        });
    }

    private CompletableFuture<Optional<GitHubCredentials>> loadGitHub(UUID orgId) {
        MonitoringProperties.Github github = properties.getGithub();
        if (!github.isConfigured()) {
            log.debug("GitHub App is not configured; skipping GitHub credentials for org {}", orgId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return fetch(orgId, SecretProvider.GITHUB, SecretType.INSTALLATION_ID).thenApply(installationId -> {
            if (isBlank(installationId)) {
                return Optional.empty();
            }
            try {
                long parsed = Long.parseLong(installationId.trim());
                return Optional.of(new GitHubCredentials(github.getAppId(), github.getPrivateKey(), parsed));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric GitHub installation id for org {}", orgId);
                return Optional.empty();
            }
        });
    }

    private CompletableFuture<Optional<SlackCredentials>> loadSlack(UUID orgId) {
        CompletableFuture<String> botToken = fetch(orgId, SecretProvider.SLACK, SecretType.BOT_TOKEN);
        CompletableFuture<String> channelId = fetch(orgId, SecretProvider.SLACK, SecretType.CHANNEL_ID);
        return botToken.thenCombine(channelId, (token, channel) -> {
            if (isBlank(token) || isBlank(channel)) {
                return Optional.<SlackCredentials>empty();
            }
            return Optional.of(new SlackCredentials(token, channel.trim()));
        });
    }

    private CompletableFuture<String> fetch(UUID orgId, SecretProvider provider, String secretType) {
        return CompletableFuture.supplyAsync(() -> vault.getSecret(orgId, provider, secretType), executor);
    }

    private <T> Optional<T> await(
        CompletableFuture<Optional<T>> future,
        SecretProvider provider,
        UUID orgId,
        long deadlineNanos
    ) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            Optional<T> value = future.get(remaining, TimeUnit.NANOSECONDS);
            return value == null ? Optional.empty() : value;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Timed out loading {} credentials for org {}; treating provider as absent", provider.key(), orgId);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            log.warn(
                "Failed to load {} credentials for org {}; treating provider as absent: {}",
                provider.key(),
                orgId,
                cause.getClass().getSimpleName()
            );
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
