package com.shlawgathon.faceguard.backend.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.model.ChannelType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands SMS alerts to the configured SMS gateway.
 */
@Component
public class SmsSender extends AbstractHttpSender {

    static final int MAX_SMS_LENGTH = 1600;

    private final String relayUrl;

    public SmsSender(ObjectMapper objectMapper,
            @Value("${faceguard.delivery.sms.relay-url:}") String relayUrl,
            @Value("${faceguard.delivery.timeout:PT10S}") Duration timeout) {
        super(objectMapper, timeout);
        this.relayUrl = relayUrl;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.SMS;
    }

    @Override
    public DeliveryResult send(OutboundNotification notification) {
        if (relayUrl == null || relayUrl.isBlank()) {
            return DeliveryResult.failed("sms gateway not configured");
        }
        if (notification.recipient() == null || notification.recipient().isBlank()) {
            return DeliveryResult.failed("no phone number configured");
        }
        String text = notification.body();
        if (text != null && text.length() > MAX_SMS_LENGTH) {
            text = text.substring(0, MAX_SMS_LENGTH);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", notification.recipient());
        body.put("message", text);
        body.put("alert_id", notification.alert().getId());
        return postJson(relayUrl, toJson(body), Map.of());
    }
}
