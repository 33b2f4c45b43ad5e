package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RealtimeHubTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private RealtimeHub hub;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        hub = new RealtimeHub(objectMapper, clock, Duration.ofSeconds(5), 512 * 1024);
    }

    @Test
    void shouldGreetNewConnection() throws Exception {
        // Given
        WebSocketSession session = session("s1");

        // When
        String connectionId = hub.connect(session, Map.of("client_type", "dashboard"), null);

        // Then
        JsonNode welcome = lastMessage(session);
        assertEquals("connection_established", welcome.path("type").asText());
        assertEquals(connectionId, welcome.path("connection_id").asText());
        assertEquals(connectionId, session.getAttributes().get(RealtimeHub.CONNECTION_ID_ATTR));
        assertEquals(EnumSet.allOf(RealtimeTopic.class), hub.getConnection(connectionId).orElseThrow()
                .getSubscribedTopics());
        assertEquals(1, hub.activeConnections());
    }

    @Test
    void shouldOnlyReachSubscribersOfTopic() throws Exception {
        // Given
        WebSocketSession alerts = session("s1");
        WebSocketSession sightings = session("s2");
        hub.connect(alerts, Map.of(), Set.of(RealtimeTopic.ALERTS));
        hub.connect(sightings, Map.of(), Set.of(RealtimeTopic.SIGHTINGS));

        // When
        BroadcastResult result = hub.broadcast(new PongMessage(), RealtimeTopic.ALERTS);

        // Then
        assertEquals(1, result.attempted());
        assertEquals(1, result.delivered());
        verify(alerts, times(2)).sendMessage(any());
        verify(sightings, times(1)).sendMessage(any());
    }

    @Test
    void shouldReachEveryoneWithoutTopic() {
        hub.connect(session("s1"), Map.of(), Set.of(RealtimeTopic.ALERTS));
        hub.connect(session("s2"), Map.of(), Set.of(RealtimeTopic.SYSTEM));

        BroadcastResult result = hub.broadcast(new PongMessage(), null);

        assertEquals(2, result.delivered());
    }

    @Test
    void shouldDropFailingConnectionWithoutAffectingOthers() throws Exception {
        // Given
        WebSocketSession broken = session("s1");
        WebSocketSession healthy = session("s2");
        String brokenId = hub.connect(broken, Map.of(), null);
        hub.connect(healthy, Map.of(), null);
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());

        // When
        BroadcastResult result = hub.broadcast(new PongMessage(), RealtimeTopic.ALERTS);

        // Then
        assertEquals(2, result.attempted());
        assertEquals(1, result.delivered());
        assertEquals(1, result.failed());
        assertTrue(hub.getConnection(brokenId).isEmpty());
        assertEquals(1, hub.activeConnections());
        assertEquals("pong", lastMessage(healthy).path("type").asText());
        assertEquals(1, hub.stats().failedSends());
    }

    @Test
    void shouldDisconnectIdempotently() throws Exception {
        // Given
        WebSocketSession session = session("s1");
        String connectionId = hub.connect(session, Map.of(), null);

        // When
        hub.disconnect(connectionId);
        hub.disconnect(connectionId);
        hub.disconnect(null);

        // Then
        verify(session, times(1)).close(CloseStatus.GOING_AWAY);
        assertEquals(0, hub.activeConnections());
        assertFalse(hub.send(connectionId, new PongMessage()));
    }

    @Test
    void shouldStampTimestampAtSendTime() throws Exception {
        // Given
        WebSocketSession session = session("s1");
        String connectionId = hub.connect(session, Map.of(), null);
        clock.advance(Duration.ofMinutes(3));

        // When
        hub.send(connectionId, new PongMessage());

        // Then
        assertEquals("2024-03-01T10:03:00Z", lastMessage(session).path("timestamp").asText());
    }

    @Test
    void shouldReplaceSubscriptions() {
        String connectionId = hub.connect(session("s1"), Map.of(), null);

        assertTrue(hub.updateSubscriptions(connectionId, Set.of(RealtimeTopic.SYSTEM)));

        assertEquals(Set.of(RealtimeTopic.SYSTEM), hub.getConnection(connectionId).orElseThrow()
                .getSubscribedTopics());
        assertFalse(hub.updateSubscriptions("missing", Set.of(RealtimeTopic.SYSTEM)));
    }

    static WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(new HashMap<>());
        return session;
    }

    private JsonNode lastMessage(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<TextMessage> sent = captor.getAllValues();
        return objectMapper.readTree(sent.get(sent.size() - 1).getPayload());
    }
}
