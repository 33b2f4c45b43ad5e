package com.shlawgathon.faceguard.backend.pubsub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.config.RedisMessageConfig;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.RecognitionEvent;
import com.shlawgathon.faceguard.backend.websocket.AlertNotificationMessage;
import com.shlawgathon.faceguard.backend.websocket.AlertStatusMessage;
import com.shlawgathon.faceguard.backend.websocket.PersonSightingMessage;
import com.shlawgathon.faceguard.backend.websocket.RealtimeHub;
import com.shlawgathon.faceguard.backend.websocket.RealtimeMessage;
import com.shlawgathon.faceguard.backend.websocket.RealtimeTopic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes realtime events to Redis Pub/Sub so every backend replica can
 * deliver them to its own dashboard connections. When the relay is disabled or
 * publishing fails the event goes straight to this node's hub.
 */
@Component
public class RealtimeEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RealtimeEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RealtimeHub hub;
    private final boolean relayEnabled;

    public RealtimeEventPublisher(StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            RealtimeHub hub,
            @Value("${faceguard.realtime.relay.enabled:true}") boolean relayEnabled) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.hub = hub;
        this.relayEnabled = relayEnabled;
    }

    /**
     * Publish a message for broadcast on a topic.
     *
     * @return true when the event went through the relay, false when it was delivered locally
     */
    public boolean publish(RealtimeMessage message, RealtimeTopic topic) {
        JsonNode payload = objectMapper.valueToTree(message);
        if (relayEnabled) {
            try {
                String json = objectMapper.writeValueAsString(new RealtimeEnvelope(topic, payload));
                redisTemplate.convertAndSend(RedisMessageConfig.REALTIME_EVENTS_CHANNEL, json);
                log.debug("[PUB/SUB] Published {} on {}", message.getType(), topic);
                return true;
            } catch (Exception e) {
                log.warn("[PUB/SUB] Failed to publish {}, broadcasting locally: {}", message.getType(), e.getMessage());
            }
        }
        hub.broadcast(payload, topic);
        return false;
    }

    public void publishAlert(AlertInstance instance) {
        publish(AlertNotificationMessage.from(instance), RealtimeTopic.ALERTS);
    }

    public void publishAlertAcknowledged(AlertInstance instance) {
        publish(AlertStatusMessage.acknowledged(instance), RealtimeTopic.ALERTS);
    }

    public void publishAlertResolved(AlertInstance instance) {
        publish(AlertStatusMessage.resolved(instance), RealtimeTopic.ALERTS);
    }

    public void publishSighting(RecognitionEvent event) {
        publish(PersonSightingMessage.from(event), RealtimeTopic.SIGHTINGS);
    }

    /**
     * Message wrapper for Redis Pub/Sub.
     */
    public record RealtimeEnvelope(RealtimeTopic topic, JsonNode payload) {
    }
}
