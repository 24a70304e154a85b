package com.promptvector.search.drift;

import com.promptvector.common.model.DriftReport;
import com.promptvector.common.model.TrendingTopic;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.similarity.VectorSimilarity;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares documents created in the last 30 days with documents older than 90 days.
 * Drift is {@code 1 - cosine} between the centroids of the two populations.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftAnalyzer {

    static final Duration RECENT_WINDOW = Duration.ofDays(30);
    static final Duration OLDER_THAN = Duration.ofDays(90);

    static final double OVERALL_DRIFT_ALERT = 0.3;
    static final double DOMAIN_DRIFT_ALERT = 0.4;
    static final double TRENDING_GROWTH = 0.5;
    private static final int REPORTED_TOPICS = 3;

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final VectorSimilarity similarity;
    private final Clock clock;

    public DriftReport analyzeSemanticDrift() {
        Instant now = clock.instant();
        Instant recentSince = now.minus(RECENT_WINDOW);
        Instant olderBefore = now.minus(OLDER_THAN);

        List<VectorDocument> all = documentStore.allDocuments();
        List<VectorDocument> recent = all.stream()
            .filter(doc -> doc.metadata().created().isAfter(recentSince))
            .toList();
        List<VectorDocument> older = all.stream()
            .filter(doc -> doc.metadata().created().isBefore(olderBefore))
            .toList();

        double overallDrift = drift(recent, older);

        Map<String, Double> domainDrifts = new LinkedHashMap<>();
        Set<String> domains = recent.stream()
            .map(doc -> doc.metadata().domain())
            .filter(domain -> domain != null)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        for (String domain : domains) {
            List<VectorDocument> recentInDomain = inDomain(recent, domain);
            List<VectorDocument> olderInDomain = inDomain(older, domain);
            if (!recentInDomain.isEmpty() && !olderInDomain.isEmpty()) {
                domainDrifts.put(domain, drift(recentInDomain, olderInDomain));
            }
        }

        List<TrendingTopic> trendingTopics = trendingTopics(recent, older);
        List<String> recommendations = recommendations(overallDrift, domainDrifts, trendingTopics);

        log.info("Semantic drift: overall={}, {} domains, {} trending topics ({} recent / {} older documents)",
            overallDrift, domainDrifts.size(), trendingTopics.size(), recent.size(), older.size());
        return DriftReport.builder()
            .overallDrift(overallDrift)
            .domainDrifts(domainDrifts)
            .trendingTopics(trendingTopics)
            .recommendations(recommendations)
            .build();
    }

    /**
     * Дрейф двух популяций; 0, если одна из них пуста
     */
    private double drift(List<VectorDocument> recent, List<VectorDocument> older) {
        if (recent.isEmpty() || older.isEmpty()) {
            return 0.0;
        }
        float[] recentCentroid = similarity.centroid(vectors(recent), properties.getDimension());
        float[] olderCentroid = similarity.centroid(vectors(older), properties.getDimension());
        return 1.0 - similarity.cosineSimilarity(recentCentroid, olderCentroid);
    }

    /**
     * Tags whose growth from the older to the recent population exceeds 50%.
     * A tag absent from older documents grows by its recent count.
     */
    static List<TrendingTopic> trendingTopics(List<VectorDocument> recent, List<VectorDocument> older) {
        Map<String, Integer> recentCounts = tagCounts(recent);
        Map<String, Integer> olderCounts = tagCounts(older);

        List<TrendingTopic> topics = new ArrayList<>();
        recentCounts.forEach((tag, recentCount) -> {
            int olderCount = olderCounts.getOrDefault(tag, 0);
            double growthRate = olderCount > 0
                ? (double) (recentCount - olderCount) / olderCount
                : recentCount;
            if (growthRate > TRENDING_GROWTH) {
                topics.add(new TrendingTopic(tag, growthRate, recentCount));
            }
        });
        topics.sort(Comparator.comparingDouble(TrendingTopic::growthRate).reversed());
        return topics;
    }

    static List<String> recommendations(double overallDrift, Map<String, Double> domainDrifts,
                                        List<TrendingTopic> trendingTopics) {
        List<String> recommendations = new ArrayList<>();
        if (overallDrift > OVERALL_DRIFT_ALERT) {
            recommendations.add("Significant semantic drift detected - consider retraining models");
        }
        domainDrifts.forEach((domain, drift) -> {
            if (drift > DOMAIN_DRIFT_ALERT) {
                recommendations.add("High drift in " + domain + " domain - review recent additions");
            }
        });
        if (!trendingTopics.isEmpty()) {
            String topics = trendingTopics.stream()
                .limit(REPORTED_TOPICS)
                .map(TrendingTopic::topic)
                .collect(Collectors.joining(", "));
            recommendations.add("Trending topics detected: " + topics);
        }
        return recommendations;
    }

    private static Map<String, Integer> tagCounts(List<VectorDocument> documents) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (VectorDocument document : documents) {
            for (String tag : document.metadata().tags()) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        return counts;
    }

    private static List<VectorDocument> inDomain(List<VectorDocument> documents, String domain) {
        return documents.stream()
            .filter(doc -> domain.equals(doc.metadata().domain()))
            .toList();
    }

    private static List<float[]> vectors(List<VectorDocument> documents) {
        return documents.stream().map(VectorDocument::vector).toList();
    }
}
