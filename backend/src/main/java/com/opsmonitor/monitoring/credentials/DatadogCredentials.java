package com.opsmonitor.monitoring.credentials;

public record DatadogCredentials(String apiKey, String appKey, String site) {
    @Override
    public String toString() {
        return "DatadogCredentials[apiKey=***, appKey=***, site=" + site + "]";
    }
}
