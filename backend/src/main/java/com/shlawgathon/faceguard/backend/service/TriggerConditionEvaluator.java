package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.model.PersonMatch;
import com.shlawgathon.faceguard.backend.model.RecognitionEvent;
import com.shlawgathon.faceguard.backend.model.TimeRange;
import com.shlawgathon.faceguard.backend.model.TriggerConditions;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Tests a rule's trigger conditions against one sighting. All conditions that
 * are set must hold. A rule with no conditions at all never fires.
 */
@Component
public class TriggerConditionEvaluator {

    private final Clock clock;

    public TriggerConditionEvaluator(Clock clock) {
        this.clock = clock;
    }

    public boolean matches(TriggerConditions conditions, RecognitionEvent event, boolean highPriority) {
        if (conditions == null || isEmpty(conditions)) {
            return false;
        }
        String personId = event.getSubjectPersonId();

        // Subject
        if (notEmpty(conditions.getPersonIds()) && (personId == null || !conditions.getPersonIds().contains(personId))) {
            return false;
        }
        if (personId != null && notEmpty(conditions.getExcludedPersons())
                && conditions.getExcludedPersons().contains(personId)) {
            return false;
        }
        if (Boolean.TRUE.equals(conditions.getUnknownPerson()) && !event.isUnknown()) {
            return false;
        }
        if (Boolean.TRUE.equals(conditions.getAnyPerson()) && event.isUnknown()) {
            return false;
        }
        if (Boolean.TRUE.equals(conditions.getHighPriorityOnly()) && !highPriority) {
            return false;
        }

        // Where
        if (notEmpty(conditions.getCameraIds()) && !conditions.getCameraIds().contains(event.getCameraId())) {
            return false;
        }
        if (notEmpty(conditions.getLocationIds()) && !conditions.getLocationIds().contains(event.getLocationId())) {
            return false;
        }

        // Match strength
        if (conditions.getConfidenceMin() != null && event.getConfidence() < conditions.getConfidenceMin()) {
            return false;
        }
        if (conditions.getConfidenceMax() != null && event.getConfidence() > conditions.getConfidenceMax()) {
            return false;
        }
        PersonMatch match = event.getMatch();
        if (conditions.getMinMatchingEmbeddings() != null
                && (match == null || match.getMatchingEmbeddingCount() < conditions.getMinMatchingEmbeddings())) {
            return false;
        }
        if (conditions.getMinAvgSimilarity() != null
                && (match == null || match.getAvgSimilarity() < conditions.getMinAvgSimilarity())) {
            return false;
        }

        // When
        if (notEmpty(conditions.getTimeRanges())) {
            Instant observedAt = event.getObservedAt() != null ? event.getObservedAt() : clock.instant();
            int hour = observedAt.atZone(ZoneOffset.UTC).getHour();
            boolean inRange = false;
            for (TimeRange range : conditions.getTimeRanges()) {
                if (range != null && range.contains(hour)) {
                    inRange = true;
                    break;
                }
            }
            if (!inRange) {
                return false;
            }
        }
        return true;
    }

    boolean isEmpty(TriggerConditions c) {
        return !notEmpty(c.getPersonIds())
                && !notEmpty(c.getExcludedPersons())
                && !notEmpty(c.getCameraIds())
                && !notEmpty(c.getLocationIds())
                && !notEmpty(c.getTimeRanges())
                && c.getAnyPerson() == null
                && c.getUnknownPerson() == null
                && c.getHighPriorityOnly() == null
                && c.getConfidenceMin() == null
                && c.getConfidenceMax() == null
                && c.getMinMatchingEmbeddings() == null
                && c.getMinAvgSimilarity() == null;
    }

    private static boolean notEmpty(List<?> values) {
        return values != null && !values.isEmpty();
    }
}
