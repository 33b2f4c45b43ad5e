package com.shlawgathon.faceguard.backend.websocket;

/**
 * Outcome of one broadcast pass. {@code failed} connections were disconnected.
 */
public record BroadcastResult(int attempted, int delivered, int failed) {

    public static BroadcastResult empty() {
        return new BroadcastResult(0, 0, 0);
    }
}
