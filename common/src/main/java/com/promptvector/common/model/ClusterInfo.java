package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClusterInfo(
    @JsonProperty("numClusters")
    int numClusters,

    @JsonProperty("avgClusterSize")
    double avgClusterSize,

    @JsonProperty("silhouetteScore")
    double silhouetteScore
) {
}
