package com.shlawgathon.faceguard.backend.config;

import com.shlawgathon.faceguard.backend.websocket.ClientMetadataHandshakeInterceptor;
import com.shlawgathon.faceguard.backend.websocket.RealtimeWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler realtimeWebSocketHandler;
    private final ClientMetadataHandshakeInterceptor clientMetadataHandshakeInterceptor;

    @Value("${frontend.url:http://localhost:3000}")
    private String frontendUrl;

    public WebSocketConfig(RealtimeWebSocketHandler realtimeWebSocketHandler,
            ClientMetadataHandshakeInterceptor clientMetadataHandshakeInterceptor) {
        this.realtimeWebSocketHandler = realtimeWebSocketHandler;
        this.clientMetadataHandshakeInterceptor = clientMetadataHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Dashboard feed; clients pick topics with ?topics=alerts,sightings,system
        registry.addHandler(realtimeWebSocketHandler, "/ws/realtime")
                .addInterceptors(clientMetadataHandshakeInterceptor)
                .setAllowedOrigins(frontendUrl);
    }
}
