package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.dto.RecognitionEventRequest;
import com.shlawgathon.faceguard.backend.dto.RecognitionEventResponse;
import com.shlawgathon.faceguard.backend.dto.RecognizeRequest;
import com.shlawgathon.faceguard.backend.dto.RecognizeResponse;
import com.shlawgathon.faceguard.backend.dto.SearchRequest;
import com.shlawgathon.faceguard.backend.dto.SearchResponse;
import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.PersonMatch;
import com.shlawgathon.faceguard.backend.model.RecognitionEvent;
import com.shlawgathon.faceguard.backend.pubsub.RealtimeEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Recognition pipeline for one sighting: resolve the identity, announce the
 * sighting, then run the alert rules.
 */
@Service
public class RecognitionService {

    private static final Logger log = LoggerFactory.getLogger(RecognitionService.class);

    private final IdentityResolver identityResolver;
    private final AlertDecisionEngine alertDecisionEngine;
    private final RealtimeEventPublisher publisher;
    private final Clock clock;
    private final double defaultThreshold;

    public RecognitionService(IdentityResolver identityResolver,
            AlertDecisionEngine alertDecisionEngine,
            RealtimeEventPublisher publisher,
            Clock clock,
            @Value("${faceguard.recognition.threshold:0.6}") double defaultThreshold) {
        this.identityResolver = identityResolver;
        this.alertDecisionEngine = alertDecisionEngine;
        this.publisher = publisher;
        this.clock = clock;
        this.defaultThreshold = defaultThreshold;
    }

    public SearchResponse search(SearchRequest request) {
        double threshold = thresholdOrDefault(request.getThreshold());
        return SearchResponse.builder()
                .threshold(threshold)
                .candidates(identityResolver.search(request.getEmbedding(), request.getK(), threshold))
                .build();
    }

    public RecognizeResponse recognize(RecognizeRequest request) {
        double threshold = thresholdOrDefault(request.getThreshold());
        Optional<PersonMatch> match = identityResolver.resolve(request.getEmbedding(), threshold);
        return RecognizeResponse.builder()
                .matched(match.isPresent())
                .threshold(threshold)
                .match(match.orElse(null))
                .build();
    }

    public RecognitionEventResponse processEvent(RecognitionEventRequest request) {
        double threshold = thresholdOrDefault(request.getThreshold());
        PersonMatch match = identityResolver.resolve(request.getEmbedding(), threshold).orElse(null);

        double confidence;
        if (match != null) {
            confidence = match.getMaxSimilarity();
        } else {
            confidence = request.getDetectionConfidence() != null ? request.getDetectionConfidence() : 0.0;
        }

        RecognitionEvent event = RecognitionEvent.builder()
                .sightingId(request.getSightingId() != null ? request.getSightingId() : UUID.randomUUID().toString())
                .cameraId(request.getCameraId())
                .locationId(request.getLocationId())
                .observedAt(request.getObservedAt() != null ? request.getObservedAt() : clock.instant())
                .match(match)
                .confidence(confidence)
                .metadata(request.getMetadata() != null ? request.getMetadata() : new HashMap<>())
                .build();

        log.info("[RECOGNITION] Sighting {} on {}: {}", event.getSightingId(), event.getCameraId(),
                match != null ? match.getPersonId() : "unknown");
        publisher.publishSighting(event);

        List<AlertInstance> alerts = alertDecisionEngine.evaluate(event);
        return RecognitionEventResponse.builder()
                .sightingId(event.getSightingId())
                .matched(match != null)
                .match(match)
                .alertIds(alerts.stream().map(AlertInstance::getId).toList())
                .build();
    }

    private double thresholdOrDefault(Double threshold) {
        return threshold != null ? threshold : defaultThreshold;
    }
}
