package com.promptvector.search.query;

import com.promptvector.common.model.DocumentMetadata;
import com.promptvector.common.model.SearchFilters;
import com.promptvector.common.model.VectorDocument;

import java.util.Collections;

/**
 * Metadata predicate behind {@link SearchFilters}. Absent filter fields match everything.
 */
public final class SearchFilterMatcher {

    private SearchFilterMatcher() {
    }

    public static boolean isEmpty(SearchFilters filters) {
        return filters == null
            || (filters.domains() == null
                && filters.types() == null
                && filters.tags() == null
                && filters.effectivenessMin() == null
                && filters.createdAfter() == null
                && filters.createdBefore() == null);
    }

    public static boolean matches(VectorDocument document, SearchFilters filters) {
        if (filters == null) {
            return true;
        }
        DocumentMetadata metadata = document.metadata();
        if (filters.domains() != null && !filters.domains().contains(metadata.domain())) {
            return false;
        }
        if (filters.types() != null && !filters.types().contains(metadata.type())) {
            return false;
        }
        if (filters.tags() != null && Collections.disjoint(filters.tags(), metadata.tags())) {
            return false;
        }
        if (filters.effectivenessMin() != null) {
            // отсутствующая эффективность считается нулевой
            double effectiveness = metadata.effectiveness() == null ? 0.0 : metadata.effectiveness();
            if (effectiveness < filters.effectivenessMin()) {
                return false;
            }
        }
        if (filters.createdAfter() != null && metadata.created().isBefore(filters.createdAfter())) {
            return false;
        }
        return filters.createdBefore() == null || !metadata.created().isAfter(filters.createdBefore());
    }
}
