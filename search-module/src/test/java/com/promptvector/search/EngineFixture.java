package com.promptvector.search;

import com.promptvector.common.model.DocumentMetadata;
import com.promptvector.common.model.DocumentType;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.analytics.AnalyticsPublisher;
import com.promptvector.search.analytics.AnalyticsSink;
import com.promptvector.search.analytics.LoggingAnalyticsSink;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.cluster.ClusterAnalyzer;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.drift.DriftAnalyzer;
import com.promptvector.search.embedding.EmbeddingProvider;
import com.promptvector.search.embedding.HashingEmbeddingProvider;
import com.promptvector.search.index.FlatVectorIndex;
import com.promptvector.search.index.HierarchicalVectorIndex;
import com.promptvector.search.maintenance.IndexOptimizer;
import com.promptvector.search.maintenance.StatisticsCollector;
import com.promptvector.search.metrics.PerformanceTracker;
import com.promptvector.search.quantization.VectorQuantizer;
import com.promptvector.search.query.SearchCacheKeyFactory;
import com.promptvector.search.query.SearchEngine;
import com.promptvector.search.recommendation.RecommendationEngine;
import com.promptvector.search.service.VectorDatabaseService;
import com.promptvector.search.service.VectorDatabaseServiceImpl;
import com.promptvector.search.similarity.VectorSimilarity;
import com.promptvector.search.store.DocumentStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Hand-wired engine for unit tests: three dimensions, fixed clock, seeded random source.
 */
public class EngineFixture implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");
    public static final long SEED = 42L;

    public final VectorSearchProperties properties;
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final Random random = new Random(SEED);
    public final VectorSimilarity similarity = new VectorSimilarity();
    public final FlatVectorIndex flatIndex = new FlatVectorIndex();
    public final HierarchicalVectorIndex vectorIndex;
    public final VectorQuantizer quantizer;
    public final ResultCaches caches;
    public final PerformanceTracker performance;
    public final AnalyticsPublisher analytics;
    public final ExecutorService ingestExecutor = Executors.newFixedThreadPool(2);
    public final DocumentStore store;
    public final SearchEngine searchEngine;
    public final ClusterAnalyzer clusterAnalyzer;
    public final RecommendationEngine recommendationEngine;
    public final DriftAnalyzer driftAnalyzer;
    public final StatisticsCollector statisticsCollector;
    public final IndexOptimizer optimizer;
    public final VectorDatabaseService service;

    public EngineFixture() {
        this(new LoggingAnalyticsSink(), null);
    }

    public EngineFixture(Consumer<VectorSearchProperties> customizer) {
        this(new LoggingAnalyticsSink(), null, customizer);
    }

    public EngineFixture(AnalyticsSink sink, EmbeddingProvider embeddingProvider) {
        this(sink, embeddingProvider, properties -> { });
    }

    /**
     * @param customizer applied to the test defaults before any component is built
     */
    public EngineFixture(AnalyticsSink sink, EmbeddingProvider embeddingProvider,
                         Consumer<VectorSearchProperties> customizer) {
        properties = new VectorSearchProperties();
        properties.setDimension(3);
        properties.getIndex().setRandomSeed(SEED);
        properties.getBatch().setPause(Duration.ofMillis(1));
        customizer.accept(properties);

        vectorIndex = new HierarchicalVectorIndex(flatIndex, similarity, properties, random);
        quantizer = new VectorQuantizer(flatIndex);
        caches = new ResultCaches(properties);
        performance = new PerformanceTracker(properties);
        analytics = new AnalyticsPublisher(sink, properties, clock);
        store = new DocumentStore(properties, similarity, flatIndex, vectorIndex, quantizer,
            caches, analytics, performance, ingestExecutor);
        EmbeddingProvider embedding = embeddingProvider != null
            ? embeddingProvider
            : new HashingEmbeddingProvider(properties.getDimension(), similarity);
        searchEngine = new SearchEngine(properties, store, similarity, embedding, caches,
            new SearchCacheKeyFactory(), analytics, performance);
        clusterAnalyzer = new ClusterAnalyzer(properties, store, similarity, caches, random);
        recommendationEngine = new RecommendationEngine(properties, store, searchEngine, similarity, clock);
        driftAnalyzer = new DriftAnalyzer(properties, store, similarity, clock);
        statisticsCollector = new StatisticsCollector(properties, store, flatIndex, vectorIndex, quantizer,
            performance, caches, clusterAnalyzer);
        optimizer = new IndexOptimizer(properties, store, quantizer, caches, statisticsCollector);
        service = new VectorDatabaseServiceImpl(store, searchEngine, clusterAnalyzer, recommendationEngine,
            driftAnalyzer, statisticsCollector, optimizer);
    }

    public static VectorDocument document(String id, float... vector) {
        return document(id, metadata(DocumentType.PROMPT, "general", NOW), vector);
    }

    public static VectorDocument document(String id, DocumentMetadata metadata, float... vector) {
        return VectorDocument.builder()
            .id(id)
            .content("content of " + id)
            .vector(vector)
            .metadata(metadata)
            .build();
    }

    public static DocumentMetadata metadata(DocumentType type, String domain, Instant created, String... tags) {
        return DocumentMetadata.builder()
            .type(type)
            .domain(domain)
            .created(created)
            .tags(Set.of(tags))
            .build();
    }

    @Override
    public void close() {
        ingestExecutor.shutdownNow();
        analytics.shutdown();
    }
}
