package com.opsmonitor.monitoring.model;

import java.util.Locale;

/**
 * Enum constant with a lowercase wire spelling, shared by JSON payloads and database columns.
 */
public interface WireValue {

    String wireValue();

    /**
     * Case-insensitive lookup by wire spelling.
     *
     * @return the matching constant, or {@code null} for blank or unknown input
     */
    static <E extends Enum<E> & WireValue> E fromWire(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (E value : type.getEnumConstants()) {
            if (value.wireValue().equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
