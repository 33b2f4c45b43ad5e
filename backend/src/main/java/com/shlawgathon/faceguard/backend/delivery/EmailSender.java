package com.shlawgathon.faceguard.backend.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.model.ChannelType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands email alerts to the configured mail relay.
 */
@Component
public class EmailSender extends AbstractHttpSender {

    private final String relayUrl;
    private final String fromAddress;

    public EmailSender(ObjectMapper objectMapper,
            @Value("${faceguard.delivery.email.relay-url:}") String relayUrl,
            @Value("${faceguard.delivery.email.from:alerts@faceguard.local}") String fromAddress,
            @Value("${faceguard.delivery.timeout:PT10S}") Duration timeout) {
        super(objectMapper, timeout);
        this.relayUrl = relayUrl;
        this.fromAddress = fromAddress;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.EMAIL;
    }

    @Override
    public DeliveryResult send(OutboundNotification notification) {
        if (relayUrl == null || relayUrl.isBlank()) {
            return DeliveryResult.failed("email relay not configured");
        }
        if (notification.recipient() == null || notification.recipient().isBlank()) {
            return DeliveryResult.failed("no email address configured");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", fromAddress);
        body.put("to", notification.recipient());
        body.put("subject", notification.subject());
        body.put("text", notification.body());
        body.put("priority", notification.alert().getPriority().getValue());
        body.put("alert_id", notification.alert().getId());
        return postJson(relayUrl, toJson(body), Map.of());
    }
}
