package com.shlawgathon.faceguard.backend.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Shared plumbing for senders that hand the message to an HTTP endpoint.
 */
public abstract class AbstractHttpSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpSender.class);

    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration timeout;

    protected AbstractHttpSender(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    /**
     * POST a JSON body and turn the response into a delivery result.
     */
    protected DeliveryResult postJson(String url, String json, Map<String, String> headers) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json));
            headers.forEach(builder::header);

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return DeliveryResult.delivered(extractDeliveryId(response.body()));
            }
            log.warn("[DELIVERY] {} relay at {} returned {}", channelType(), url, status);
            return DeliveryResult.failed("HTTP " + status);
        } catch (IOException e) {
            return DeliveryResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted");
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failed("invalid URL " + url);
        }
    }

    protected String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize notification body", e);
        }
    }

    private String extractDeliveryId(String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                for (String field : new String[] {"id", "message_id", "sid"}) {
                    if (node.hasNonNull(field)) {
                        return node.get(field).asText();
                    }
                }
            } catch (IOException e) {
                log.debug("[DELIVERY] Non-JSON relay response: {}", e.getMessage());
            }
        }
        return UUID.randomUUID().toString();
    }
}
