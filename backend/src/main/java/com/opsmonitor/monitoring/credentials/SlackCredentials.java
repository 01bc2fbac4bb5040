package com.opsmonitor.monitoring.credentials;

public record SlackCredentials(String botToken, String channelId) {
    @Override
    public String toString() {
        return "SlackCredentials[botToken=***, channelId=" + channelId + "]";
    }
}
