package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Snapshot of corpus size, estimated memory footprint, latency metrics
 * and, when enough documents exist, cluster quality.
 */
@Builder
public record IndexStatistics(
    @JsonProperty("totalDocuments")
    int totalDocuments,

    @JsonProperty("totalVectors")
    int totalVectors,

    @JsonProperty("dimensions")
    int dimensions,

    @JsonProperty("memoryUsage")
    MemoryUsage memoryUsage,

    @JsonProperty("performance")
    PerformanceMetrics performance,

    /** null, если кластеризация невозможна */
    @JsonProperty("clusterInfo")
    ClusterInfo clusterInfo
) {
}
