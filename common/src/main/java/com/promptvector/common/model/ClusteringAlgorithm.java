package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Алгоритмы кластеризации векторного пространства */
public enum ClusteringAlgorithm {
    KMEANS,
    HIERARCHICAL,
    DBSCAN;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
