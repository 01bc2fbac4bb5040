package com.opsmonitor.monitoring.credentials;

public record GitHubCredentials(String appId, String privateKey, long installationId) {
    @Override
    public String toString() {
        return "GitHubCredentials[appId=" + appId + ", privateKey=***, installationId=" + installationId + "]";
    }
}
