package com.promptvector.search.cache;

import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.SearchResult;
import com.promptvector.search.EngineFixture;
import com.promptvector.search.config.VectorSearchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultCachesTest {

    private ResultCaches caches;
    private List<SearchResult> results;

    @BeforeEach
    void setUp() {
        caches = new ResultCaches(new VectorSearchProperties());
        results = List.of(new SearchResult(EngineFixture.document("a", 1, 0, 0), 1.0, 1));
    }

    @Test
    void shouldServeResultsCachedInCurrentGeneration() {
        long generation = caches.generation();
        caches.cacheSearch(generation, "key", results);

        assertThat(caches.cachedSearch(caches.generation(), "key")).contains(results);
        assertThat(caches.cachedSearch(caches.generation(), "other")).isEmpty();
    }

    @Test
    void shouldNeverServeResultsComputedBeforeInvalidation() {
        long observed = caches.generation();
        caches.invalidateAll();
        caches.cacheSearch(observed, "key", results);

        assertThat(caches.generation()).isGreaterThan(observed);
        assertThat(caches.cachedSearch(caches.generation(), "key")).isEmpty();
    }

    @Test
    void shouldKeyClustersByCountAndAlgorithm() {
        List<ClusterResult> clusters = List.of(ClusterResult.builder().id("cluster_0").name("Cluster 1").build());
        long generation = caches.generation();
        caches.cacheClusters(generation, 2, ClusteringAlgorithm.KMEANS, clusters);

        assertThat(caches.cachedClusters(generation, 2, ClusteringAlgorithm.KMEANS)).contains(clusters);
        assertThat(caches.cachedClusters(generation, 3, ClusteringAlgorithm.KMEANS)).isEmpty();

        caches.clearClusters();
        assertThat(caches.cachedClusters(caches.generation(), 2, ClusteringAlgorithm.KMEANS)).isEmpty();
    }

    @Test
    void shouldReportSearchHitRate() {
        long generation = caches.generation();
        caches.cachedSearch(generation, "key");
        caches.cacheSearch(generation, "key", results);
        caches.cachedSearch(generation, "key");

        assertThat(caches.searchHitRate()).isCloseTo(0.5, within(1e-9));
    }
}
