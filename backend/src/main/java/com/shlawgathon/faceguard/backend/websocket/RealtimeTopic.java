package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Broadcast topics a dashboard connection can subscribe to.
 */
public enum RealtimeTopic {
    ALERTS,
    SIGHTINGS,
    SYSTEM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RealtimeTopic fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown topic: " + value));
    }

    public static Optional<RealtimeTopic> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse topic names, ignoring unknown ones. "all", or nothing recognizable, means every topic.
     */
    public static Set<RealtimeTopic> parseAll(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return EnumSet.allOf(RealtimeTopic.class);
        }
        EnumSet<RealtimeTopic> topics = EnumSet.noneOf(RealtimeTopic.class);
        for (String value : values) {
            if ("all".equalsIgnoreCase(value != null ? value.trim() : null)) {
                return EnumSet.allOf(RealtimeTopic.class);
            }
            parse(value).ifPresent(topics::add);
        }
        return topics.isEmpty() ? EnumSet.allOf(RealtimeTopic.class) : topics;
    }
}
