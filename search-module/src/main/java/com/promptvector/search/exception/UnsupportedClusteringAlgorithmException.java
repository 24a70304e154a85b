package com.promptvector.search.exception;

import com.promptvector.common.model.ClusteringAlgorithm;
import lombok.Getter;

/** Алгоритм объявлен, но не реализован */
@Getter
public class UnsupportedClusteringAlgorithmException extends VectorSearchException {

    private final ClusteringAlgorithm algorithm;

    public UnsupportedClusteringAlgorithmException(ClusteringAlgorithm algorithm) {
        super("Clustering algorithm is not implemented: " + algorithm.jsonValue());
        this.algorithm = algorithm;
    }
}
