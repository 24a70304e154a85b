package com.promptvector.search.index;

/**
 * Document id with its cosine similarity to the query.
 */
public record ScoredCandidate(String id, double similarity) {
}
