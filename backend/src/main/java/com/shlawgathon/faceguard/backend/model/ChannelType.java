package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Delivery channel kinds the dispatcher knows how to send through.
 */
public enum ChannelType {
    EMAIL,
    SMS,
    WEBHOOK,
    DASHBOARD;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChannelType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown channel type: " + value));
    }

    /**
     * Parse a channel type name. The record store's "websocket" channel type is the dashboard.
     */
    public static Optional<ChannelType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WEBSOCKET".equals(normalized)) {
            return Optional.of(DASHBOARD);
        }
        for (ChannelType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
