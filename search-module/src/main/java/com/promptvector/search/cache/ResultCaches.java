package com.promptvector.search.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.SearchResult;
import com.promptvector.search.config.VectorSearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL caches for search and cluster results.
 * <p>
 * Every key carries the write generation observed when the computation started.
 * {@link #invalidateAll()} bumps the generation, so a result computed before a write
 * can still be stored afterwards but is never looked up again.
 */
@Component
@Slf4j
public class ResultCaches {

    private final AtomicLong generation = new AtomicLong();
    private final Cache<SearchKey, List<SearchResult>> searchCache;
    private final Cache<ClusterKey, List<ClusterResult>> clusterCache;

    public ResultCaches(VectorSearchProperties properties) {
        this.searchCache = Caffeine.newBuilder()
            .maximumSize(properties.getSearch().getCacheSize())
            .expireAfterWrite(properties.getSearch().getCacheTtl())
            .recordStats()
            .build();
        this.clusterCache = Caffeine.newBuilder()
            .maximumSize(properties.getCluster().getCacheSize())
            .expireAfterWrite(properties.getCluster().getCacheTtl())
            .recordStats()
            .build();
    }

    /**
     * Текущее поколение записей; читается до начала вычисления
     */
    public long generation() {
        return generation.get();
    }

    public Optional<List<SearchResult>> cachedSearch(long observedGeneration, String fingerprint) {
        return Optional.ofNullable(searchCache.getIfPresent(new SearchKey(observedGeneration, fingerprint)));
    }

    public void cacheSearch(long observedGeneration, String fingerprint, List<SearchResult> results) {
        searchCache.put(new SearchKey(observedGeneration, fingerprint), List.copyOf(results));
    }

    public Optional<List<ClusterResult>> cachedClusters(long observedGeneration, int k, ClusteringAlgorithm algorithm) {
        return Optional.ofNullable(clusterCache.getIfPresent(new ClusterKey(observedGeneration, k, algorithm)));
    }

    public void cacheClusters(long observedGeneration, int k, ClusteringAlgorithm algorithm, List<ClusterResult> clusters) {
        clusterCache.put(new ClusterKey(observedGeneration, k, algorithm), List.copyOf(clusters));
    }

    /**
     * Coarse invalidation after any write.
     */
    public void invalidateAll() {
        generation.incrementAndGet();
        searchCache.invalidateAll();
        clusterCache.invalidateAll();
    }

    public void clearSearch() {
        generation.incrementAndGet();
        searchCache.invalidateAll();
        log.debug("Cleared search cache");
    }

    public void clearClusters() {
        generation.incrementAndGet();
        clusterCache.invalidateAll();
        log.debug("Cleared cluster cache");
    }

    public double searchHitRate() {
        return searchCache.stats().hitRate();
    }

    record SearchKey(long generation, String fingerprint) {
    }

    record ClusterKey(long generation, int k, ClusteringAlgorithm algorithm) {
    }
}
