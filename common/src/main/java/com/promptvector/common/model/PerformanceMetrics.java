package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceMetrics(
    @JsonProperty("avgSearchTimeMs")
    double avgSearchTimeMs,

    @JsonProperty("avgInsertTimeMs")
    double avgInsertTimeMs,

    @JsonProperty("cacheHitRate")
    double cacheHitRate,

    @JsonProperty("queriesPerSecond")
    double queriesPerSecond
) {
}
