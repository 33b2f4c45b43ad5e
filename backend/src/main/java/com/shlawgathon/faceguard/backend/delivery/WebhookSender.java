package com.shlawgathon.faceguard.backend.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.faceguard.backend.model.ChannelType;
import com.shlawgathon.faceguard.backend.websocket.AlertNotificationMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * POSTs the alert to a webhook URL. When a secret is available the body is
 * signed with HMAC-SHA256 in the {@code X-FaceGuard-Signature} header.
 */
@Component
public class WebhookSender extends AbstractHttpSender {

    static final String SIGNATURE_HEADER = "X-FaceGuard-Signature";

    private final String defaultSecret;

    public WebhookSender(ObjectMapper objectMapper,
            @Value("${faceguard.delivery.webhook.secret:}") String defaultSecret,
            @Value("${faceguard.delivery.timeout:PT10S}") Duration timeout) {
        super(objectMapper, timeout);
        this.defaultSecret = defaultSecret;
    }

    @Override
    public ChannelType channelType() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public DeliveryResult send(OutboundNotification notification) {
        if (notification.recipient() == null || notification.recipient().isBlank()) {
            return DeliveryResult.failed("no webhook URL configured");
        }
        String json = toJson(AlertNotificationMessage.from(notification.alert()));

        Map<String, String> headers = new HashMap<>();
        Object channelSecret = notification.configuration() != null ? notification.configuration().get("secret") : null;
        String secret = channelSecret != null ? channelSecret.toString() : defaultSecret;
        if (secret != null && !secret.isBlank()) {
            headers.put(SIGNATURE_HEADER, "sha256=" + sign(secret, json));
        }
        return postJson(notification.recipient(), json, headers);
    }

    static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
