package com.shlawgathon.faceguard.backend.delivery;

import com.shlawgathon.faceguard.backend.model.AlertInstance;

import java.util.Map;

/**
 * One alert addressed to one recipient.
 *
 * @param recipient     email address, phone number or URL; null for the dashboard
 * @param configuration channel configuration from the record store, may be empty
 */
public record OutboundNotification(
        AlertInstance alert,
        String recipient,
        Map<String, Object> configuration,
        String subject,
        String body) {
}
