package com.shlawgathon.faceguard.backend.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.websocket.BroadcastResult;
import com.shlawgathon.faceguard.backend.websocket.RealtimeHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Receives relayed realtime events and broadcasts them to the dashboards
 * connected to this node.
 */
@Component
public class RealtimeEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEventSubscriber.class);

    private final ObjectMapper objectMapper;
    private final RealtimeHub hub;

    public RealtimeEventSubscriber(ObjectMapper objectMapper, RealtimeHub hub) {
        this.objectMapper = objectMapper;
        this.hub = hub;
    }

    /**
     * Handle incoming Redis Pub/Sub message.
     * Called by Spring's MessageListenerAdapter.
     */
    public void handleMessage(String message) {
        try {
            var envelope = objectMapper.readValue(message, RealtimeEventPublisher.RealtimeEnvelope.class);
            BroadcastResult result = hub.broadcast(envelope.payload(), envelope.topic());
            log.debug("[PUB/SUB] Relayed {} event to {} of {} local connections",
                    envelope.topic(), result.delivered(), result.attempted());
        } catch (Exception e) {
            log.error("[PUB/SUB] Failed to process message: {}", message, e);
        }
    }
}
