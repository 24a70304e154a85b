package com.promptvector.search.query;

import com.google.common.base.Stopwatch;
import com.promptvector.common.model.SearchFilters;
import com.promptvector.common.model.SearchQuery;
import com.promptvector.common.model.SearchResult;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.analytics.AnalyticsPublisher;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.embedding.EmbeddingProvider;
import com.promptvector.search.exception.DimensionMismatchException;
import com.promptvector.search.exception.DocumentNotFoundException;
import com.promptvector.search.exception.InternalVectorSearchException;
import com.promptvector.search.exception.ValidationException;
import com.promptvector.search.metrics.PerformanceTracker;
import com.promptvector.search.similarity.VectorSimilarity;
import com.promptvector.search.store.DocumentMatch;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Similarity search over the document store with metadata filters and result caching.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchEngine {

    public static final double DEFAULT_SIMILAR_THRESHOLD = 0.7;
    public static final int DEFAULT_SIMILAR_LIMIT = 10;

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final VectorSimilarity similarity;
    private final EmbeddingProvider embeddingProvider;
    private final ResultCaches caches;
    private final SearchCacheKeyFactory cacheKeyFactory;
    private final AnalyticsPublisher analytics;
    private final PerformanceTracker performance;

    /**
     * Поиск документов, похожих на вектор или текст запроса
     * @return results ordered by descending similarity, ranks 1..n
     * @throws ValidationException if the query carries neither vector nor text
     */
    public List<SearchResult> search(SearchQuery query) {
        if (query == null || (!query.hasVector() && !query.hasText())) {
            throw new ValidationException("Query must include either vector or text");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        int limit = query.limit() != null ? query.limit() : properties.getSearch().getDefaultLimit();
        double threshold = query.threshold() != null ? query.threshold() : properties.getSearch().getDefaultThreshold();

        long generation = caches.generation();
        String cacheKey = cacheKeyFactory.keyFor(query, limit, threshold);
        List<SearchResult> cached = caches.cachedSearch(generation, cacheKey).orElse(null);
        if (cached != null) {
            performance.record(PerformanceTracker.SEARCH, stopwatch.elapsed());
            log.debug("Search cache hit, {} results", cached.size());
            return cached;
        }

        float[] queryVector = query.hasVector() ? query.vector() : embed(query.text());
        if (queryVector.length != properties.getDimension()) {
            throw new DimensionMismatchException(properties.getDimension(), queryVector.length);
        }
        float[] normalized = similarity.normalize(queryVector);

        boolean filtered = !SearchFilterMatcher.isEmpty(query.filters());
        int candidateCount = filtered ? limit * properties.getSearch().getFilterOverfetch() : limit;
        List<DocumentMatch> candidates = documentStore.nearest(normalized, candidateCount, threshold);

        List<SearchResult> results = new ArrayList<>(Math.min(limit, candidates.size()));
        for (DocumentMatch candidate : candidates) {
            if (results.size() == limit) {
                break;
            }
            if (SearchFilterMatcher.matches(candidate.document(), query.filters())) {
                results.add(new SearchResult(candidate.document(), candidate.similarity(), results.size() + 1));
            }
        }

        List<SearchResult> ranked = List.copyOf(results);
        caches.cacheSearch(generation, cacheKey, ranked);
        performance.record(PerformanceTracker.SEARCH, stopwatch.elapsed());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("queryType", query.hasVector() ? "vector" : "text");
        data.put("resultsCount", results.size());
        data.put("limit", limit);
        data.put("threshold", threshold);
        data.put("filtered", filtered);
        analytics.publish("vector_search", null, "search_query", data);
        log.debug("Search returned {} of {} candidates in {}", results.size(), candidates.size(), stopwatch);
        return ranked;
    }

    /**
     * Documents of the same type similar to a stored document, excluding the document itself
     */
    public List<SearchResult> findSimilarDocuments(String documentId) {
        return findSimilarDocuments(documentId, DEFAULT_SIMILAR_THRESHOLD, DEFAULT_SIMILAR_LIMIT);
    }

    /**
     * @throws DocumentNotFoundException if the reference document does not exist
     */
    public List<SearchResult> findSimilarDocuments(String documentId, double threshold, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        VectorDocument reference = documentStore.getDocumentById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

        SearchQuery query = SearchQuery.builder()
            .vector(reference.vector())
            .threshold(threshold)
            .limit(limit + 1)
            .filters(SearchFilters.builder().types(Set.of(reference.metadata().type())).build())
            .build();
        List<SearchResult> results = search(query);
        return rerankExcluding(results, List.of(documentId), limit);
    }

    /**
     * Drops results whose document id is excluded, truncates and renumbers ranks from 1
     */
    public static List<SearchResult> rerankExcluding(List<SearchResult> results, Collection<String> excludedIds, int limit) {
        Set<String> excluded = new HashSet<>(excludedIds);
        List<SearchResult> kept = new ArrayList<>(limit);
        for (SearchResult result : results) {
            if (kept.size() == limit) {
                break;
            }
            if (!excluded.contains(result.document().id())) {
                kept.add(result.withRank(kept.size() + 1));
            }
        }
        return kept;
    }

    private float[] embed(String text) {
        float[] embedded;
        try {
            embedded = embeddingProvider.embed(text);
        } catch (RuntimeException e) {
            throw new InternalVectorSearchException("Embedding provider failed", e);
        }
        if (embedded == null) {
            throw new InternalVectorSearchException("Embedding provider returned no vector", null);
        }
        return embedded;
    }
}
