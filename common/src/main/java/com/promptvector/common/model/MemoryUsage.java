package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryUsage(
    @JsonProperty("vectorsMb")
    double vectorsMb,

    @JsonProperty("quantizedMb")
    double quantizedMb,

    @JsonProperty("metadataMb")
    double metadataMb,

    @JsonProperty("indexMb")
    double indexMb,

    @JsonProperty("totalMb")
    double totalMb
) {
}
