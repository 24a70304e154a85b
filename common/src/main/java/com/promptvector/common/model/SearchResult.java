package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record SearchResult(
    @NotNull
    @JsonProperty("document")
    VectorDocument document,

    @JsonProperty("similarity")
    double similarity,

    @Min(1)
    @JsonProperty("rank")
    int rank
) {
    @JsonCreator
    public SearchResult {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        if (rank < 1) {
            throw new IllegalArgumentException("Rank must start at 1");
        }
    }

    /**
     * Creates a copy with a new rank
     */
    public SearchResult withRank(int newRank) {
        return new SearchResult(document, similarity, newRank);
    }
}
