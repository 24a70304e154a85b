package com.promptvector.search.store;

import com.promptvector.common.model.VectorDocument;

/**
 * Stored document paired with its similarity to a query vector.
 */
public record DocumentMatch(VectorDocument document, double similarity) {
}
