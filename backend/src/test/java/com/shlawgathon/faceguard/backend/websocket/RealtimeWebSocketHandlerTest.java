package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.MutableClock;
import com.shlawgathon.faceguard.backend.service.AlertDecisionEngine;
import com.shlawgathon.faceguard.backend.service.AlertInstanceNotFoundException;
import com.shlawgathon.faceguard.backend.service.SystemStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RealtimeWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RealtimeHub hub;
    private AlertDecisionEngine engine;
    private SystemStatusService statusService;
    private RealtimeWebSocketHandler handler;
    private WebSocketSession session;
    private String connectionId;

    @BeforeEach
    void setUp() throws Exception {
        hub = new RealtimeHub(objectMapper, new MutableClock(Instant.parse("2024-03-01T10:00:00Z")),
                Duration.ofSeconds(5), 512 * 1024);
        engine = mock(AlertDecisionEngine.class);
        statusService = mock(SystemStatusService.class);
        handler = new RealtimeWebSocketHandler(hub, objectMapper, engine, statusService);

        session = RealtimeHubTest.session("s1");
        handler.afterConnectionEstablished(session);
        connectionId = (String) session.getAttributes().get(RealtimeHub.CONNECTION_ID_ATTR);
    }

    @Test
    void shouldAnswerPingWithPong() throws Exception {
        // When
        handler.handleMessage(session, new TextMessage("{\"type\": \"ping\"}"));

        // Then
        assertEquals("pong", lastMessage().path("type").asText());
        assertEquals(1, hub.stats().messagesReceived());
    }

    @Test
    void shouldReplaceSubscriptionsAndConfirm() throws Exception {
        // When
        handler.handleMessage(session, new TextMessage("{\"type\": \"subscribe_alerts\", \"topics\": [\"alerts\", \"bogus\"]}"));

        // Then
        assertEquals(Set.of(RealtimeTopic.ALERTS), hub.getConnection(connectionId).orElseThrow().getSubscribedTopics());
        JsonNode confirmation = lastMessage();
        assertEquals("subscription_confirmed", confirmation.path("type").asText());
        assertEquals("alerts", confirmation.path("topics").get(0).asText());
    }

    @Test
    void shouldAcknowledgeAlertOnBehalfOfConnection() throws Exception {
        handler.handleMessage(session, new TextMessage("{\"type\": \"acknowledge_alert\", \"alert_id\": \"a-1\"}"));

        verify(engine).acknowledge("a-1", "dashboard:" + connectionId);
    }

    @Test
    void shouldKeepConnectionWhenAcknowledgeIsRejected() throws Exception {
        // Given
        when(engine.acknowledge(anyString(), anyString())).thenThrow(new AlertInstanceNotFoundException("a-9"));

        // When
        handler.handleMessage(session, new TextMessage("{\"type\": \"acknowledge_alert\", \"alert_id\": \"a-9\"}"));

        // Then
        assertTrue(hub.getConnection(connectionId).isPresent());
    }

    @Test
    void shouldKeepConnectionWhenAcknowledgeCannotBeStored() {
        // Given
        when(engine.acknowledge(anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        // When
        assertDoesNotThrow(() -> handler.handleMessage(session,
                new TextMessage("{\"type\": \"acknowledge_alert\", \"alert_id\": \"a-2\"}")));

        // Then
        assertTrue(hub.getConnection(connectionId).isPresent());
        verify(engine).acknowledge("a-2", "dashboard:" + connectionId);
    }

    @Test
    void shouldIgnoreMalformedAndUnknownMessages() throws Exception {
        // When
        handler.handleMessage(session, new TextMessage("{not json"));
        handler.handleMessage(session, new TextMessage("{\"type\": \"launch_rockets\"}"));

        // Then
        assertTrue(hub.getConnection(connectionId).isPresent());
        assertEquals(2, hub.stats().messagesReceived());
        verify(session, times(1)).sendMessage(any());
    }

    @Test
    void shouldSendStatusOnRequest() throws Exception {
        // Given
        when(statusService.currentStatus()).thenReturn(SystemStatusMessage.builder().build());

        // When
        handler.handleMessage(session, new TextMessage("{\"type\": \"request_status\"}"));

        // Then
        assertEquals("system_status_update", lastMessage().path("type").asText());
    }

    @Test
    void shouldDisconnectWhenTransportCloses() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, hub.activeConnections());
    }

    private JsonNode lastMessage() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<TextMessage> sent = captor.getAllValues();
        return objectMapper.readTree(sent.get(sent.size() - 1).getPayload());
    }
}
