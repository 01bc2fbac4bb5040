package com.opsmonitor.monitoring.credentials;

import com.opsmonitor.monitoring.model.WireValue;

import java.util.List;

public enum SecretProvider implements WireValue {
    DATADOG("datadog", List.of(SecretType.API_KEY, SecretType.APP_KEY, SecretType.SITE)),
    GITHUB("github", List.of(SecretType.INSTALLATION_ID)),
    SLACK("slack", List.of(SecretType.BOT_TOKEN, SecretType.CHANNEL_ID));

    private final String key;
    private final List<String> secretTypes;

    SecretProvider(String key, List<String> secretTypes) {
        this.key = key;
        this.secretTypes = secretTypes;
    }

    public String key() {
        return key;
    }

    @Override
    public String wireValue() {
        return key;
    }

    /**
     * Secret types a tenant may store for this provider.
     */
    public List<String> secretTypes() {
        return secretTypes;
    }

    public boolean accepts(String secretType) {
        return secretType != null && secretTypes.contains(secretType);
    }

    public static SecretProvider fromKey(String raw) {
        return WireValue.fromWire(SecretProvider.class, raw);
    }
}
