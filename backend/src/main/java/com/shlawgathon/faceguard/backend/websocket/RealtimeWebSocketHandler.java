package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.service.AlertDecisionEngine;
import com.shlawgathon.faceguard.backend.service.AlertInstanceNotFoundException;
import com.shlawgathon.faceguard.backend.service.SystemStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dashboard WebSocket endpoint. Connection bookkeeping lives in
 * {@link RealtimeHub}; this class only translates transport callbacks and
 * inbound client messages.
 */
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

    private final RealtimeHub hub;
    private final ObjectMapper objectMapper;
    private final AlertDecisionEngine alertDecisionEngine;
    private final SystemStatusService systemStatusService;

    public RealtimeWebSocketHandler(RealtimeHub hub,
            ObjectMapper objectMapper,
            AlertDecisionEngine alertDecisionEngine,
            SystemStatusService systemStatusService) {
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.alertDecisionEngine = alertDecisionEngine;
        this.systemStatusService = systemStatusService;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void afterConnectionEstablished(WebSocketSession session) {
        Map<String, Object> metadata = (Map<String, Object>) session.getAttributes()
                .getOrDefault(ClientMetadataHandshakeInterceptor.CLIENT_METADATA_ATTR, Map.of());
        Set<RealtimeTopic> topics = (Set<RealtimeTopic>) session.getAttributes()
                .get(ClientMetadataHandshakeInterceptor.TOPICS_ATTR);
        hub.connect(session, metadata, topics);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        log.debug("[REALTIME] Session {} closed with {}", session.getId(), status);
        hub.disconnect(connectionId);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[REALTIME] Transport error on session {}: {}", session.getId(), exception.getMessage());
        hub.disconnect(connectionId(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            return;
        }
        hub.recordReceived(connectionId);

        JsonNode payload;
        try {
            payload = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            String preview = message.getPayload();
            log.warn("[REALTIME] Invalid JSON from {}: {}", connectionId,
                    preview.substring(0, Math.min(100, preview.length())));
            return;
        }

        String type = payload.path("type").asText("");
        switch (type) {
            case "ping" -> hub.send(connectionId, new PongMessage());
            case "request_status" -> hub.send(connectionId, systemStatusService.currentStatus());
            case "subscribe_alerts" -> handleSubscribe(connectionId, payload);
            case "acknowledge_alert" -> handleAcknowledge(connectionId, payload);
            default -> log.warn("[REALTIME] Unknown message type '{}' from {}", type, connectionId);
        }
    }

    private void handleSubscribe(String connectionId, JsonNode payload) {
        List<String> requested = new ArrayList<>();
        JsonNode topics = payload.has("topics") ? payload.get("topics") : payload.path("alert_types");
        if (topics.isArray()) {
            topics.forEach(topic -> requested.add(topic.asText()));
        }
        Set<RealtimeTopic> parsed = RealtimeTopic.parseAll(requested);
        if (hub.updateSubscriptions(connectionId, parsed)) {
            hub.send(connectionId, SubscriptionConfirmedMessage.builder().topics(parsed).build());
        }
    }

    private void handleAcknowledge(String connectionId, JsonNode payload) {
        String alertId = payload.path("alert_id").asText(null);
        if (alertId == null || alertId.isBlank()) {
            log.warn("[REALTIME] acknowledge_alert without alert_id from {}", connectionId);
            return;
        }
        try {
            alertDecisionEngine.acknowledge(alertId, "dashboard:" + connectionId);
        } catch (AlertInstanceNotFoundException | IllegalStateException e) {
            log.warn("[REALTIME] Acknowledge of {} from {} rejected: {}", alertId, connectionId, e.getMessage());
        } catch (DataAccessException e) {
            log.error("[REALTIME] Acknowledge of {} from {} could not be stored: {}", alertId, connectionId,
                    e.getMessage());
        }
    }

    private static String connectionId(WebSocketSession session) {
        Object id = session.getAttributes().get(RealtimeHub.CONNECTION_ID_ATTR);
        return id != null ? id.toString() : null;
    }
}
