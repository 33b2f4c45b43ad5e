package com.shlawgathon.faceguard.backend.websocket;

/**
 * Outbound dashboard message. Serialized as a JSON object whose {@code type}
 * field names the message; the hub adds {@code timestamp} at send time.
 */
public interface RealtimeMessage {

    String getType();
}
