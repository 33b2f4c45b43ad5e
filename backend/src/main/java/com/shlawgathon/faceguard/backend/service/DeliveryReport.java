package com.shlawgathon.faceguard.backend.service;

/**
 * Outcome of delivering one alert over all of its targets.
 *
 * @param attempted          targets a send was attempted on, including ones skipped by a breaker or rate limit
 * @param confirmed          sends the channel confirmed
 * @param dashboardDelivered whether the dashboard relay accepted the alert
 */
public record DeliveryReport(int attempted, int confirmed, boolean dashboardDelivered) {
}
