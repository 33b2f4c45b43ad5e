package com.shlawgathon.faceguard.backend.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures client metadata and the requested topics during the WebSocket
 * handshake so the handler can register the connection with them.
 */
@Component
public class ClientMetadataHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ClientMetadataHandshakeInterceptor.class);

    public static final String CLIENT_METADATA_ATTR = "FACEGUARD_CLIENT_METADATA";
    public static final String TOPICS_ATTR = "FACEGUARD_TOPICS";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Map<String, Object> attributes) {

        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams();

        Map<String, Object> metadata = new HashMap<>();
        if (request.getRemoteAddress() != null) {
            metadata.put("remote_address", request.getRemoteAddress().getAddress().getHostAddress());
        }
        String userAgent = request.getHeaders().getFirst("User-Agent");
        if (userAgent != null) {
            metadata.put("user_agent", userAgent);
        }
        String clientId = params.getFirst("client_id");
        if (clientId != null) {
            metadata.put("client_id", clientId);
        }
        attributes.put(CLIENT_METADATA_ATTR, metadata);

        // topics=alerts,sightings or repeated topics=... parameters
        List<String> topics = new ArrayList<>();
        List<String> rawTopics = params.get("topics");
        if (rawTopics != null) {
            for (String raw : rawTopics) {
                for (String topic : raw.split(",")) {
                    if (!topic.isBlank()) {
                        topics.add(topic.trim());
                    }
                }
            }
        }
        attributes.put(TOPICS_ATTR, RealtimeTopic.parseAll(topics));

        log.debug("[REALTIME] Handshake from {} with topics {}", metadata.get("remote_address"), topics);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
            WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.error("[REALTIME] WebSocket handshake failed", exception);
        }
    }
}
