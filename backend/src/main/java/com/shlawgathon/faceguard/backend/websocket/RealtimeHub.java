package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of live dashboard connections on this node and the fan-out path to them.
 * <p>
 * The connection table is only mutated by {@link #connect} and
 * {@link #disconnect}. Sessions are wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator} so writes to one connection are
 * serialized and bounded in time and buffer size; a connection that cannot
 * keep up is dropped rather than stalling a broadcast.
 */
@Component
public class RealtimeHub {

    private static final Logger log = LoggerFactory.getLogger(RealtimeHub.class);

    public static final String CONNECTION_ID_ATTR = "FACEGUARD_CONNECTION_ID";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong broadcasts = new AtomicLong();
    private final AtomicLong failedSends = new AtomicLong();

    public RealtimeHub(ObjectMapper objectMapper,
            Clock clock,
            @Value("${faceguard.realtime.send-time-limit:PT5S}") Duration sendTimeLimit,
            @Value("${faceguard.realtime.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sendTimeLimitMillis = (int) sendTimeLimit.toMillis();
        this.bufferSizeLimit = bufferSizeLimit;
    }

    /**
     * Register a session and greet it.
     *
     * @return the new connection id
     */
    public String connect(WebSocketSession session, Map<String, Object> clientMetadata, Set<RealtimeTopic> topics) {
        String connectionId = UUID.randomUUID().toString();
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis,
                bufferSizeLimit);
        Connection connection = new Connection(connectionId, decorated, clock.instant(),
                clientMetadata != null ? clientMetadata : Map.of(), topics);

        session.getAttributes().put(CONNECTION_ID_ATTR, connectionId);
        connections.put(connectionId, connection);
        totalConnections.incrementAndGet();
        log.info("[REALTIME] Connected {} (session {}, topics {}, active {})",
                connectionId, session.getId(), connection.getSubscribedTopics(), connections.size());

        send(connectionId, ConnectionEstablishedMessage.builder()
                .connectionId(connectionId)
                .subscribedTopics(connection.getSubscribedTopics())
                .serverInfo(ConnectionEstablishedMessage.ServerInfo.builder()
                        .service("faceguard-backend")
                        .version("2.0.0")
                        .websocketFeatures(ConnectionEstablishedMessage.FEATURES)
                        .build())
                .build());
        return connectionId;
    }

    /**
     * Remove a connection and close its session. Safe to call more than once.
     */
    public void disconnect(String connectionId) {
        if (connectionId == null) {
            return;
        }
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        WebSocketSession session = connection.getSession();
        if (session.isOpen()) {
            try {
                session.close(CloseStatus.GOING_AWAY);
            } catch (IOException | RuntimeException e) {
                log.debug("[REALTIME] Error closing session for {}: {}", connectionId, e.getMessage());
            }
        }
        log.info("[REALTIME] Disconnected {} (sent {}, received {}, active {})", connectionId,
                connection.getMessagesSent(), connection.getMessagesReceived(), connections.size());
    }

    /**
     * Send one message to one connection. A write failure drops the connection.
     *
     * @return true when the message was written
     */
    public boolean send(String connectionId, Object message) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        Optional<String> json = serialize(message);
        if (json.isEmpty()) {
            return false;
        }
        if (!write(connection, json.get())) {
            disconnect(connectionId);
            return false;
        }
        return true;
    }

    /**
     * Send a message to every connection subscribed to {@code topic}, or to all
     * connections when {@code topic} is null. Connections that fail are
     * disconnected after the pass.
     */
    public BroadcastResult broadcast(Object message, RealtimeTopic topic) {
        Optional<String> json = serialize(message);
        if (json.isEmpty()) {
            return BroadcastResult.empty();
        }

        List<Connection> snapshot = List.copyOf(connections.values());
        List<String> dead = new ArrayList<>();
        int attempted = 0;
        int delivered = 0;
        for (Connection connection : snapshot) {
            if (topic != null && !connection.isSubscribed(topic)) {
                continue;
            }
            attempted++;
            if (write(connection, json.get())) {
                delivered++;
            } else {
                dead.add(connection.getConnectionId());
            }
        }
        dead.forEach(this::disconnect);
        broadcasts.incrementAndGet();

        if (!dead.isEmpty()) {
            log.warn("[REALTIME] Broadcast on {} dropped {} of {} connections", topic, dead.size(), attempted);
        }
        return new BroadcastResult(attempted, delivered, dead.size());
    }

    public void recordReceived(String connectionId) {
        messagesReceived.incrementAndGet();
        Connection connection = connections.get(connectionId);
        if (connection != null) {
            connection.recordReceived(clock.instant());
        }
    }

    public boolean updateSubscriptions(String connectionId, Set<RealtimeTopic> topics) {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.setSubscribedTopics(topics);
        log.info("[REALTIME] {} subscribed to {}", connectionId, connection.getSubscribedTopics());
        return true;
    }

    public Optional<Connection> getConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int activeConnections() {
        return connections.size();
    }

    public RealtimeStats stats() {
        return new RealtimeStats(
                totalConnections.get(),
                connections.size(),
                messagesSent.get(),
                messagesReceived.get(),
                broadcasts.get(),
                failedSends.get());
    }

    private boolean write(Connection connection, String json) {
        WebSocketSession session = connection.getSession();
        try {
            if (!session.isOpen()) {
                throw new IOException("session closed");
            }
            session.sendMessage(new TextMessage(json));
            connection.recordSent(clock.instant());
            messagesSent.incrementAndGet();
            return true;
        } catch (IOException | RuntimeException e) {
            // SessionLimitExceededException and closed-session errors are runtime exceptions
            failedSends.incrementAndGet();
            log.warn("[REALTIME] Send to {} failed: {}", connection.getConnectionId(), e.getMessage());
            return false;
        }
    }

    private Optional<String> serialize(Object message) {
        try {
            JsonNode tree = message instanceof JsonNode node ? node.deepCopy() : objectMapper.valueToTree(message);
            if (!(tree instanceof ObjectNode objectNode)) {
                log.error("[REALTIME] Refusing to send non-object message of type {}",
                        message != null ? message.getClass().getSimpleName() : null);
                return Optional.empty();
            }
            objectNode.put("timestamp", clock.instant().toString());
            return Optional.of(objectMapper.writeValueAsString(objectNode));
        } catch (Exception e) {
            log.error("[REALTIME] Failed to serialize {}", message != null ? message.getClass().getSimpleName() : null, e);
            return Optional.empty();
        }
    }
}
