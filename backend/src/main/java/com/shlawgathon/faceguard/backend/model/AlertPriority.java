package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert priority levels, ordered from least to most urgent.
 */
public enum AlertPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Lenient parse for values coming from the record store; unknown levels map to {@code fallback}.
     */
    public static AlertPriority parseOrDefault(String value, AlertPriority fallback) {
        try {
            AlertPriority parsed = fromValue(value);
            return parsed != null ? parsed : fallback;
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    /**
     * One level higher, saturating at CRITICAL.
     */
    public AlertPriority escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public static AlertPriority max(AlertPriority a, AlertPriority b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
