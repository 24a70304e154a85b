package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Semantic drift between recent and older documents, globally and per domain.
 */
@Builder
public record DriftReport(
    @JsonProperty("overallDrift")
    double overallDrift,

    @JsonProperty("domainDrifts")
    Map<String, Double> domainDrifts,

    @JsonProperty("trendingTopics")
    List<TrendingTopic> trendingTopics,

    @JsonProperty("recommendations")
    List<String> recommendations
) {
    public DriftReport {
        domainDrifts = domainDrifts == null ? Map.of() : Map.copyOf(domainDrifts);
        trendingTopics = trendingTopics == null ? List.of() : List.copyOf(trendingTopics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
