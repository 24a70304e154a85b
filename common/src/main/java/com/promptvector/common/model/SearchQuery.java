package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Builder;

/**
 * Similarity query. Either {@code vector} or {@code text} must be supplied;
 * unset {@code limit} and {@code threshold} fall back to the engine defaults.
 */
@Builder(toBuilder = true)
public record SearchQuery(
    @JsonProperty("vector")
    float[] vector,

    @JsonProperty("text")
    String text,

    @JsonProperty("filters")
    SearchFilters filters,

    @Min(1)
    @JsonProperty("limit")
    Integer limit,

    @JsonProperty("threshold")
    Double threshold
) {
    @JsonCreator
    public SearchQuery {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (threshold != null && (threshold < -1 || threshold > 1)) {
            throw new IllegalArgumentException("Threshold must be between -1 and 1");
        }
    }

    /**
     * Creates a vector query with explicit threshold and limit
     */
    public static SearchQuery forVector(float[] vector, double threshold, int limit) {
        return new SearchQuery(vector, null, null, limit, threshold);
    }

    /**
     * Creates a text query with engine defaults
     */
    public static SearchQuery forText(String text) {
        return new SearchQuery(null, text, null, null, null);
    }

    @JsonIgnore
    public boolean hasVector() {
        return vector != null && vector.length > 0;
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
