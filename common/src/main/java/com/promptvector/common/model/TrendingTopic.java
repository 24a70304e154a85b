package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendingTopic(
    @JsonProperty("topic")
    String topic,

    @JsonProperty("growthRate")
    double growthRate,

    @JsonProperty("documentCount")
    int documentCount
) {
}
