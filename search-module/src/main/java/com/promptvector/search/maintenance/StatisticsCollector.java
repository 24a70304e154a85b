package com.promptvector.search.maintenance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.promptvector.common.model.ClusterInfo;
import com.promptvector.common.model.ClusterResult;
import com.promptvector.common.model.ClusteringAlgorithm;
import com.promptvector.common.model.IndexStatistics;
import com.promptvector.common.model.MemoryUsage;
import com.promptvector.common.model.PerformanceMetrics;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.cluster.ClusterAnalyzer;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.exception.InternalVectorSearchException;
import com.promptvector.search.exception.VectorSearchException;
import com.promptvector.search.index.FlatVectorIndex;
import com.promptvector.search.index.VectorIndex;
import com.promptvector.search.metrics.PerformanceTracker;
import com.promptvector.search.quantization.VectorQuantizer;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds {@link IndexStatistics}: corpus size, rough memory estimates, latency
 * metrics and cluster quality.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatisticsCollector {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final int BYTES_PER_COMPONENT = Float.BYTES;
    private static final int BYTES_PER_LINK = 8;
    private static final int BYTES_PER_CHAR = 2;

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final FlatVectorIndex flatIndex;
    private final VectorIndex vectorIndex;
    private final VectorQuantizer quantizer;
    private final PerformanceTracker performance;
    private final ResultCaches caches;
    private final ClusterAnalyzer clusterAnalyzer;
    private final ObjectMapper objectMapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .build();

    public IndexStatistics collect() {
        List<VectorDocument> documents = documentStore.allDocuments();
        int dimension = properties.getDimension();
        int totalVectors = flatIndex.size();

        long vectorBytes = (long) totalVectors * dimension * BYTES_PER_COMPONENT;
        long quantizedBytes = quantizer.memoryBytes();
        long metadataBytes = metadataBytes(documents);
        long indexBytes = vectorIndex.connectionCount() * BYTES_PER_LINK;
        MemoryUsage memoryUsage = new MemoryUsage(
            vectorBytes / BYTES_PER_MB,
            quantizedBytes / BYTES_PER_MB,
            metadataBytes / BYTES_PER_MB,
            indexBytes / BYTES_PER_MB,
            (vectorBytes + quantizedBytes + metadataBytes + indexBytes) / BYTES_PER_MB);

        double avgSearch = performance.averageMillis(PerformanceTracker.SEARCH);
        PerformanceMetrics metrics = new PerformanceMetrics(
            avgSearch,
            performance.averageMillis(PerformanceTracker.ADD_DOCUMENT),
            caches.searchHitRate(),
            avgSearch > 0 ? 1000.0 / avgSearch : 0.0);

        return IndexStatistics.builder()
            .totalDocuments(documents.size())
            .totalVectors(totalVectors)
            .dimensions(dimension)
            .memoryUsage(memoryUsage)
            .performance(metrics)
            .clusterInfo(clusterInfo(documents.size()))
            .build();
    }

    /**
     * Информация о кластерах; null, если документов меньше, чем кластеров
     */
    private ClusterInfo clusterInfo(int documentCount) {
        if (documentCount < ClusterAnalyzer.DEFAULT_CLUSTERS) {
            return null;
        }
        try {
            List<ClusterResult> clusters = clusterAnalyzer.clusterDocuments(
                ClusterAnalyzer.DEFAULT_CLUSTERS, ClusteringAlgorithm.KMEANS);
            double avgSize = clusters.stream().mapToInt(ClusterResult::size).average().orElse(0.0);
            return new ClusterInfo(clusters.size(), avgSize, clusterAnalyzer.silhouetteScore(clusters));
        } catch (VectorSearchException e) {
            // корпус мог уменьшиться между подсчётом и кластеризацией
            log.warn("Could not calculate cluster info: {}", e.getMessage());
            return null;
        }
    }

    private long metadataBytes(List<VectorDocument> documents) {
        long total = 0;
        for (VectorDocument document : documents) {
            try {
                total += (long) objectMapper.writeValueAsString(document.metadata()).length() * BYTES_PER_CHAR;
            } catch (JsonProcessingException e) {
                throw new InternalVectorSearchException("Failed to serialize metadata of " + document.id(), e);
            }
        }
        return total;
    }
}
