package com.shlawgathon.faceguard.backend.websocket;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live dashboard connection, owned by {@link RealtimeHub}.
 */
public class Connection {

    private final String connectionId;
    private final WebSocketSession session;
    private final Instant connectedAt;
    private final Map<String, Object> clientMetadata;
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();

    private volatile Set<RealtimeTopic> subscribedTopics;
    private volatile Instant lastActivity;

    public Connection(String connectionId, WebSocketSession session, Instant connectedAt,
            Map<String, Object> clientMetadata, Set<RealtimeTopic> subscribedTopics) {
        this.connectionId = connectionId;
        this.session = session;
        this.connectedAt = connectedAt;
        this.clientMetadata = Map.copyOf(clientMetadata);
        this.subscribedTopics = copyOf(subscribedTopics);
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public WebSocketSession getSession() {
        return session;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Map<String, Object> getClientMetadata() {
        return clientMetadata;
    }

    public Set<RealtimeTopic> getSubscribedTopics() {
        return subscribedTopics;
    }

    public void setSubscribedTopics(Set<RealtimeTopic> topics) {
        this.subscribedTopics = copyOf(topics);
    }

    public boolean isSubscribed(RealtimeTopic topic) {
        return subscribedTopics.contains(topic);
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    void recordSent(Instant at) {
        messagesSent.incrementAndGet();
        lastActivity = at;
    }

    void recordReceived(Instant at) {
        messagesReceived.incrementAndGet();
        lastActivity = at;
    }

    private static Set<RealtimeTopic> copyOf(Set<RealtimeTopic> topics) {
        if (topics == null || topics.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.allOf(RealtimeTopic.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(topics));
    }
}
