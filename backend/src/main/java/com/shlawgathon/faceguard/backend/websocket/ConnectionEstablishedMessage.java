package com.shlawgathon.faceguard.backend.websocket;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Welcome message sent once on connect.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionEstablishedMessage implements RealtimeMessage {

    public static final List<String> FEATURES = List.of(
            "real_time_alerts", "person_sightings", "system_status", "camera_updates");

    @Builder.Default
    private String type = "connection_established";

    private String connectionId;
    private Set<RealtimeTopic> subscribedTopics;
    private ServerInfo serverInfo;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ServerInfo {
        private String service;
        private String version;
        private List<String> websocketFeatures;
    }
}
