package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EffectivenessStats(
    @JsonProperty("mean")
    double mean,

    @JsonProperty("median")
    double median,

    @JsonProperty("standardDeviation")
    double standardDeviation
) {
    public static final EffectivenessStats EMPTY = new EffectivenessStats(0.0, 0.0, 0.0);
}
