package com.shlawgathon.faceguard.backend.service;

import com.shlawgathon.faceguard.backend.index.MatchCandidate;
import com.shlawgathon.faceguard.backend.index.VectorIndex;
import com.shlawgathon.faceguard.backend.model.PersonMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw embedding hits into a single identity decision.
 * <p>
 * Hits are grouped by owning person. The person with the greatest maximum
 * similarity wins; ties go to the person with more matching embeddings, then
 * to the lexicographically smallest person id. The average similarity is
 * reported but does not influence the decision.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Comparator<PersonMatch> BEST_MATCH = Comparator
            .comparingDouble(PersonMatch::getMaxSimilarity).reversed()
            .thenComparing(Comparator.comparingInt(PersonMatch::getMatchingEmbeddingCount).reversed())
            .thenComparing(PersonMatch::getPersonId);

    private final VectorIndex index;
    private final int searchK;

    public IdentityResolver(VectorIndex index, @Value("${faceguard.recognition.search-k:100}") int searchK) {
        this.index = index;
        this.searchK = searchK;
    }

    public Optional<PersonMatch> resolve(float[] query, double threshold) {
        List<MatchCandidate> candidates = index.search(query, searchK, threshold);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Map<String, List<MatchCandidate>> byPerson = new LinkedHashMap<>();
        for (MatchCandidate candidate : candidates) {
            byPerson.computeIfAbsent(candidate.ownerPersonId(), k -> new ArrayList<>()).add(candidate);
        }

        List<PersonMatch> matches = new ArrayList<>(byPerson.size());
        byPerson.forEach((personId, hits) -> matches.add(aggregate(personId, hits)));
        matches.sort(BEST_MATCH);

        PersonMatch best = matches.get(0);
        if (best.getMaxSimilarity() < threshold) {
            return Optional.empty();
        }
        log.debug("[RECOGNITION] Resolved person {} (max {}, {} of {} embeddings)",
                best.getPersonId(), best.getMaxSimilarity(),
                best.getMatchingEmbeddingCount(), best.getTotalEmbeddingCount());
        return Optional.of(best);
    }

    public List<MatchCandidate> search(float[] query, int k, double threshold) {
        return index.search(query, k, threshold);
    }

    private PersonMatch aggregate(String personId, List<MatchCandidate> hits) {
        double max = 0.0;
        double sum = 0.0;
        List<String> embeddingIds = new ArrayList<>(hits.size());
        for (MatchCandidate hit : hits) {
            max = Math.max(max, hit.similarity());
            sum += hit.similarity();
            embeddingIds.add(hit.embeddingId());
        }
        int total = Math.max(index.totalEmbeddingCount(personId), hits.size());
        return PersonMatch.builder()
                .personId(personId)
                .maxSimilarity(max)
                .avgSimilarity(sum / hits.size())
                .matchingEmbeddingCount(hits.size())
                .totalEmbeddingCount(total)
                .embeddingIds(embeddingIds)
                .build();
    }
}
