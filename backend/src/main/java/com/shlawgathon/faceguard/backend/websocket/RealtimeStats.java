package com.shlawgathon.faceguard.backend.websocket;

public record RealtimeStats(
        long totalConnections,
        int activeConnections,
        long messagesSent,
        long messagesReceived,
        long broadcasts,
        long failedSends) {
}
