package com.shlawgathon.faceguard.backend.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shlawgathon.faceguard.backend.model.AlertRule;
import com.shlawgathon.faceguard.backend.model.HighPriorityStatus;
import com.shlawgathon.faceguard.backend.model.NotificationChannel;
import com.shlawgathon.faceguard.backend.model.NotificationContact;
import com.shlawgathon.faceguard.backend.model.NotificationLogEntry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP client for the record store (rules, channels, high-priority persons,
 * contacts and notification logs).
 * <p>
 * Timeouts and I/O errors are retried with a linearly growing delay. Error
 * statuses are not retried: 404 raises {@link RecordNotFoundException}, any
 * other 4xx/5xx raises {@link RecordStoreException} carrying the upstream
 * payload.
 */
@Component
public class RecordStoreClient {

    private static final Logger log = LoggerFactory.getLogger(RecordStoreClient.class);

    private static final TypeReference<List<AlertRule>> RULE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<NotificationChannel>> CHANNEL_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<NotificationContact>> CONTACT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;

    public RecordStoreClient(ObjectMapper objectMapper,
            @Value("${faceguard.record-store.url:http://localhost:8001}") String baseUrl,
            @Value("${faceguard.record-store.timeout:PT30S}") Duration timeout,
            @Value("${faceguard.record-store.max-retries:3}") int maxRetries,
            @Value("${faceguard.record-store.retry-delay:PT1S}") Duration retryDelay) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, r -> {
            Thread thread = new Thread(r, "record-store-http-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        // Force HTTP/1.1 - the record store runs on Uvicorn
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .executor(executor)
                .build();
    }

    @PreDestroy
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Send one request and return the parsed JSON body.
     *
     * @param body serialized as JSON when not null
     */
    public JsonNode request(String method, String path, Object body) {
        URI uri = URI.create(baseUrl + path);
        String json = toJson(body);

        IOException lastFailure = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                backoff(attempt);
            }
            try {
                HttpResponse<String> response = httpClient.send(buildRequest(method, uri, json),
                        HttpResponse.BodyHandlers.ofString());
                log.debug("[RECORD STORE] {} {} -> {} (attempt {})", method, path, response.statusCode(), attempt + 1);
                return handleResponse(path, response);
            } catch (HttpTimeoutException e) {
                lastFailure = e;
                log.warn("[RECORD STORE] Timeout on {} {} (attempt {} of {})", method, path, attempt + 1, maxRetries + 1);
            } catch (IOException e) {
                lastFailure = e;
                log.warn("[RECORD STORE] {} {} failed (attempt {} of {}): {}",
                        method, path, attempt + 1, maxRetries + 1, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamUnavailableException("Interrupted while calling record store " + path, e);
            }
        }

        log.error("[RECORD STORE] Giving up on {} {} after {} attempts", method, path, maxRetries + 1);
        throw new UpstreamUnavailableException(
                "Record store unavailable: " + method + " " + path + " failed after " + (maxRetries + 1) + " attempts",
                lastFailure);
    }

    public JsonNode health() {
        return request("GET", "/health", null);
    }

    // Alert rules

    public List<AlertRule> listAlertRules() {
        JsonNode node = request("GET", "/notifications/alert-rules", null);
        // Paginated responses wrap the list
        JsonNode rules = node.isArray() ? node : node.path("alert_rules");
        if (!rules.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(rules, RULE_LIST);
    }

    public AlertRule getAlertRule(String ruleId) {
        return objectMapper.convertValue(request("GET", "/notifications/alert-rules/" + encode(ruleId), null),
                AlertRule.class);
    }

    public AlertRule createAlertRule(AlertRule rule) {
        return objectMapper.convertValue(request("POST", "/notifications/alert-rules", rule), AlertRule.class);
    }

    public AlertRule updateAlertRule(String ruleId, AlertRule rule) {
        return objectMapper.convertValue(request("PUT", "/notifications/alert-rules/" + encode(ruleId), rule),
                AlertRule.class);
    }

    public void deleteAlertRule(String ruleId) {
        request("DELETE", "/notifications/alert-rules/" + encode(ruleId), null);
    }

    // Notification channels

    public List<NotificationChannel> listChannels() {
        JsonNode node = request("GET", "/notifications/channels", null);
        JsonNode channels = node.isArray() ? node : node.path("channels");
        if (!channels.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(channels, CHANNEL_LIST);
    }

    public NotificationChannel getChannel(String channelId) {
        return objectMapper.convertValue(request("GET", "/notifications/channels/" + encode(channelId), null),
                NotificationChannel.class);
    }

    public NotificationChannel createChannel(NotificationChannel channel) {
        return objectMapper.convertValue(request("POST", "/notifications/channels", channel),
                NotificationChannel.class);
    }

    public NotificationChannel updateChannel(String channelId, NotificationChannel channel) {
        return objectMapper.convertValue(request("PUT", "/notifications/channels/" + encode(channelId), channel),
                NotificationChannel.class);
    }

    public void deleteChannel(String channelId) {
        request("DELETE", "/notifications/channels/" + encode(channelId), null);
    }

    // High-priority persons

    public HighPriorityStatus checkHighPriority(String personId) {
        return objectMapper.convertValue(
                request("GET", "/high-priority-persons/check/" + encode(personId), null),
                HighPriorityStatus.class);
    }

    public List<NotificationContact> getNotificationContacts(String personId) {
        JsonNode node = request("GET", "/high-priority-persons/" + encode(personId) + "/notification-contacts", null);
        if (!node.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(node, CONTACT_LIST);
    }

    public JsonNode appendNotificationLog(NotificationLogEntry entry) {
        return request("POST", "/notifications/logs", entry);
    }

    private HttpRequest buildRequest(String method, URI uri, String json) {
        HttpRequest.BodyPublisher publisher = json != null
                ? HttpRequest.BodyPublishers.ofString(json)
                : HttpRequest.BodyPublishers.noBody();
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", "FaceGuard-Backend")
                .method(method, publisher)
                .build();
    }

    private JsonNode handleResponse(String path, HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();

        if (status >= 200 && status < 300) {
            if (status == 204 || body == null || body.isBlank()) {
                return objectMapper.createObjectNode().put("success", true);
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new RecordStoreException(status, "Record store returned invalid JSON for " + path,
                        TextNode.valueOf(body));
            }
        }

        JsonNode payload = parseErrorPayload(body);
        if (status == 404) {
            throw new RecordNotFoundException(path, payload);
        }
        String message = payload.path("message").asText(
                payload.path("detail").path("message").asText("HTTP " + status));
        log.warn("[RECORD STORE] {} returned {}: {}", path, status, message);
        throw new RecordStoreException(status, "Record store error: " + message, payload);
    }

    private JsonNode parseErrorPayload(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.createObjectNode().put("message", body);
        }
    }

    private String toJson(Object body) {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize record store request body", e);
        }
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(retryDelay.multipliedBy(attempt).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting to retry record store call", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
