package com.opsmonitor.monitoring.credentials;

public final class SecretType {
    public static final String API_KEY = "api_key";
    public static final String APP_KEY = "app_key";
    public static final String SITE = "site";
    public static final String INSTALLATION_ID = "installation_id";
    public static final String BOT_TOKEN = "bot_token";
    public static final String CHANNEL_ID = "channel_id";

    private SecretType() {
    }
}
