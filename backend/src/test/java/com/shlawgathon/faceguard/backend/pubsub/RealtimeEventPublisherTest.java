package com.shlawgathon.faceguard.backend.pubsub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.config.RedisMessageConfig;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertPriority;
import com.shlawgathon.faceguard.backend.websocket.BroadcastResult;
import com.shlawgathon.faceguard.backend.websocket.RealtimeHub;
import com.shlawgathon.faceguard.backend.websocket.RealtimeTopic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RealtimeEventPublisherTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private StringRedisTemplate redisTemplate;
    private RealtimeHub hub;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        hub = mock(RealtimeHub.class);
        when(hub.broadcast(any(), any())).thenReturn(BroadcastResult.empty());
    }

    @Test
    void shouldPublishEnvelopeThroughRelay() throws Exception {
        // Given
        RealtimeEventPublisher publisher = new RealtimeEventPublisher(redisTemplate, objectMapper, hub, true);
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);

        // When
        publisher.publishAlert(alert());

        // Then
        verify(redisTemplate).convertAndSend(eq(RedisMessageConfig.REALTIME_EVENTS_CHANNEL), captor.capture());
        JsonNode envelope = objectMapper.readTree(captor.getValue());
        assertEquals("alerts", envelope.path("topic").asText());
        assertEquals("alert_notification", envelope.path("payload").path("type").asText());
        assertEquals("a-1", envelope.path("payload").path("alert").path("id").asText());
        verifyNoInteractions(hub);
    }

    @Test
    void shouldBroadcastLocallyWhenRelayFails() {
        // Given
        RealtimeEventPublisher publisher = new RealtimeEventPublisher(redisTemplate, objectMapper, hub, true);
        when(redisTemplate.convertAndSend(anyString(), any()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // When
        publisher.publishAlertResolved(alert());

        // Then
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(hub).broadcast(captor.capture(), eq(RealtimeTopic.ALERTS));
        assertEquals("alert_resolved", ((JsonNode) captor.getValue()).path("type").asText());
    }

    @Test
    void shouldBroadcastLocallyWhenRelayDisabled() {
        RealtimeEventPublisher publisher = new RealtimeEventPublisher(redisTemplate, objectMapper, hub, false);

        publisher.publishAlert(alert());

        verifyNoInteractions(redisTemplate);
        verify(hub).broadcast(any(JsonNode.class), eq(RealtimeTopic.ALERTS));
    }

    @Test
    void shouldRebroadcastRelayedEnvelopeToLocalHub() throws Exception {
        // Given
        RealtimeEventSubscriber subscriber = new RealtimeEventSubscriber(objectMapper, hub);
        String json = objectMapper.writeValueAsString(new RealtimeEventPublisher.RealtimeEnvelope(
                RealtimeTopic.SIGHTINGS, objectMapper.readTree("{\"type\": \"person_sighting\"}")));

        // When
        subscriber.handleMessage(json);

        // Then
        verify(hub).broadcast(any(JsonNode.class), eq(RealtimeTopic.SIGHTINGS));
    }

    @Test
    void shouldDropUnreadableRelayedMessage() {
        RealtimeEventSubscriber subscriber = new RealtimeEventSubscriber(objectMapper, hub);

        subscriber.handleMessage("not json");

        verifyNoInteractions(hub);
    }

    private static AlertInstance alert() {
        return AlertInstance.builder()
                .id("a-1")
                .ruleId("r1")
                .ruleName("Watchlist")
                .priority(AlertPriority.HIGH)
                .message("Watchlist: p1 seen on camera cam-1")
                .triggerPayload(Map.of("camera_id", "cam-1", "confidence", 0.91))
                .notificationChannels(List.of("dashboard"))
                .triggeredAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }
}
