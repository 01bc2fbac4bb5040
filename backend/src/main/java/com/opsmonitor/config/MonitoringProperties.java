package com.opsmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitoring")
public class MonitoringProperties {
    private Agent agent = new Agent();
    private Scheduler scheduler = new Scheduler();
    private Credentials credentials = new Credentials();
    private Github github = new Github();
    private Datadog datadog = new Datadog();
    private Runs runs = new Runs();

    public Agent getAgent() {
        return agent;
    }

    public void setAgent(Agent agent) {
        this.agent = agent;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public Datadog getDatadog() {
        return datadog;
    }

    public void setDatadog(Datadog datadog) {
        this.datadog = datadog;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }

    public static class Agent {
        private String baseUrl = "http://127.0.0.1:2024";
        private String assistantId = "investigation";
        private int pollIntervalMs = 2000;
        private long maxPollMs = 300_000L;
        private int requestTimeoutSeconds = 30;
        private int maxIterations = 3;

        public String getBaseUrl() {
            return normalizeBaseUrl(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAssistantId() {
            return assistantId == null || assistantId.isBlank() ? "investigation" : assistantId.trim();
        }

        public void setAssistantId(String assistantId) {
            this.assistantId = assistantId;
        }

        public int getPollIntervalMs() {
            return Math.max(1, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(1, pollIntervalMs);
        }

        public long getMaxPollMs() {
            return Math.max(1L, maxPollMs);
        }

        public void setMaxPollMs(long maxPollMs) {
            this.maxPollMs = Math.max(1L, maxPollMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxIterations() {
            return Math.max(1, maxIterations);
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = Math.max(1, maxIterations);
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int tickIntervalMs = 300_000;
        private int workerCount = 5;
        private int maxJobsPerTick = 50;
        private int staleRunMinutes = 10;
        private boolean allowOverlappingRuns = false;
        private String cronSecret;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTickIntervalMs() {
            return Math.max(1000, tickIntervalMs);
        }

        public void setTickIntervalMs(int tickIntervalMs) {
            this.tickIntervalMs = Math.max(1000, tickIntervalMs);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getMaxJobsPerTick() {
            return Math.max(1, maxJobsPerTick);
        }

        public void setMaxJobsPerTick(int maxJobsPerTick) {
            this.maxJobsPerTick = Math.max(1, maxJobsPerTick);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }

        public boolean isAllowOverlappingRuns() {
            return allowOverlappingRuns;
        }

        public void setAllowOverlappingRuns(boolean allowOverlappingRuns) {
            this.allowOverlappingRuns = allowOverlappingRuns;
        }

        public String getCronSecret() {
            return cronSecret == null || cronSecret.isBlank() ? null : cronSecret.trim();
        }

        public void setCronSecret(String cronSecret) {
            this.cronSecret = cronSecret;
        }
    }

    public static class Credentials {
        private int timeoutSeconds = 10;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    /**
     * Deployment-wide GitHub App identity. Tenants only contribute an installation id.
     */
    public static class Github {
        private String appId;
        private String privateKey;

        public String getAppId() {
            return appId == null || appId.isBlank() ? null : appId.trim();
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getPrivateKey() {
            if (privateKey == null || privateKey.isBlank()) {
                return null;
            }
            return privateKey.replace("\\n", "\n");
        }

        public void setPrivateKey(String privateKey) {
            this.privateKey = privateKey;
        }

        public boolean isConfigured() {
            return getAppId() != null && getPrivateKey() != null;
        }
    }

    public static class Datadog {
        private String defaultSite = "datadoghq.com";

        public String getDefaultSite() {
            return defaultSite == null || defaultSite.isBlank() ? "datadoghq.com" : defaultSite.trim();
        }

        public void setDefaultSite(String defaultSite) {
            this.defaultSite = defaultSite;
        }
    }

    public static class Runs {
        private int historyLimit = 20;
        private int maxErrorLength = 1000;

        public int getHistoryLimit() {
            return Math.max(1, historyLimit);
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = Math.max(1, historyLimit);
        }

        public int getMaxErrorLength() {
            return Math.max(1, maxErrorLength);
        }

        public void setMaxErrorLength(int maxErrorLength) {
            this.maxErrorLength = Math.max(1, maxErrorLength);
        }
    }
}
