package com.promptvector.search.recommendation;

import com.promptvector.common.model.Interaction;
import com.promptvector.common.model.SearchQuery;
import com.promptvector.common.model.SearchResult;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.exception.ValidationException;
import com.promptvector.search.query.SearchEngine;
import com.promptvector.search.similarity.VectorSimilarity;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Рекомендации на основе истории взаимодействий пользователя.
 * <p>
 * The preference vector is the weighted mean of the vectors of the documents the user
 * interacted with: base weight of the interaction type, times {@code exp(-days / 30)},
 * times the custom weight. Documents touched within the last seven days are excluded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationEngine {

    public static final int DEFAULT_LIMIT = 10;
    static final double RECOMMENDATION_THRESHOLD = 0.3;
    static final double DECAY_DAYS = 30.0;
    static final Duration EXCLUSION_WINDOW = Duration.ofDays(7);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final SearchEngine searchEngine;
    private final VectorSimilarity similarity;
    private final Clock clock;

    public List<SearchResult> getRecommendations(String userId, List<Interaction> history) {
        return getRecommendations(userId, history, DEFAULT_LIMIT);
    }

    /**
     * @return up to {@code limit} documents, empty when no interacted document is known
     */
    public List<SearchResult> getRecommendations(String userId, List<Interaction> history, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        Optional<float[]> preference = preferenceVector(history, now);
        if (preference.isEmpty()) {
            log.debug("No known documents in history of user {}", userId);
            return List.of();
        }

        Set<String> recent = new LinkedHashSet<>();
        Instant cutoff = now.minus(EXCLUSION_WINDOW);
        for (Interaction interaction : history) {
            if (interaction.timestamp().isAfter(cutoff)) {
                recent.add(interaction.documentId());
            }
        }

        List<SearchResult> results = searchEngine.search(
            SearchQuery.forVector(preference.get(), RECOMMENDATION_THRESHOLD, limit + recent.size()));
        List<SearchResult> recommendations = SearchEngine.rerankExcluding(results, recent, limit);
        log.debug("Built {} recommendations for user {}, {} recent documents excluded",
            recommendations.size(), userId, recent.size());
        return recommendations;
    }

    /**
     * Normalized weighted mean of known document vectors; empty if the total weight is zero
     */
    Optional<float[]> preferenceVector(List<Interaction> history, Instant now) {
        double[] accumulated = new double[properties.getDimension()];
        double totalWeight = 0.0;
        for (Interaction interaction : history) {
            Optional<VectorDocument> document = documentStore.getDocumentById(interaction.documentId());
            if (document.isEmpty()) {
                continue;
            }
            double weight = interaction.type().baseWeight()
                * timeWeight(interaction.timestamp(), now)
                * interaction.effectiveWeight();
            similarity.addScaled(accumulated, document.get().vector(), weight);
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return Optional.empty();
        }
        float[] mean = new float[accumulated.length];
        for (int i = 0; i < accumulated.length; i++) {
            mean[i] = (float) (accumulated[i] / totalWeight);
        }
        return Optional.of(similarity.normalize(mean));
    }

    static double timeWeight(Instant timestamp, Instant now) {
        double daysSince = (now.toEpochMilli() - timestamp.toEpochMilli()) / MILLIS_PER_DAY;
        return Math.exp(-daysSince / DECAY_DAYS);
    }
}
