package com.shlawgathon.faceguard.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configured delivery target from the record store. The configuration map
 * carries the channel-specific address ({@code email_address},
 * {@code phone_number}, {@code url}, {@code secret}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationChannel {

    private String id;
    private String channelName;
    private String channelType;

    @Builder.Default
    private Map<String, Object> configuration = new HashMap<>();

    @JsonProperty("is_active")
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int rateLimitPerMinute = 60;

    @JsonIgnore
    public Optional<ChannelType> getType() {
        return ChannelType.parse(channelType);
    }

    @JsonIgnore
    public String configValue(String key) {
        Object value = configuration != null ? configuration.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
