package com.opsmonitor.monitoring.credentials;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Request-scoped provider credentials of one tenant. An empty optional means the provider is not
 * connected, which narrows what the agent is told it can do but is never an error.
 */
public record Credentials(
    Optional<DatadogCredentials> datadog,
    Optional<GitHubCredentials> github,
    Optional<SlackCredentials> slack
) {
    public Credentials {
        datadog = datadog == null ? Optional.empty() : datadog;
        github = github == null ? Optional.empty() : github;
        slack = slack == null ? Optional.empty() : slack;
    }

    public static Credentials none() {
        return new Credentials(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public boolean hasSlack() {
        return slack.isPresent();
    }

    public List<SecretProvider> connectedProviders() {
        List<SecretProvider> providers = new ArrayList<>();
        datadog.ifPresent(ignored -> providers.add(SecretProvider.DATADOG));
        github.ifPresent(ignored -> providers.add(SecretProvider.GITHUB));
        slack.ifPresent(ignored -> providers.add(SecretProvider.SLACK));
        return providers;
    }
}
