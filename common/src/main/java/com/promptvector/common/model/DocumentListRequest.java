package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Builder;

/**
 * Listing filters with offset/limit pagination.
 */
@Builder
public record DocumentListRequest(
    @JsonProperty("domain")
    String domain,

    @JsonProperty("type")
    DocumentType type,

    @Min(0)
    @JsonProperty("offset")
    Integer offset,

    @Min(1)
    @JsonProperty("limit")
    Integer limit
) {
    public static final int DEFAULT_LIMIT = 100;

    @JsonCreator
    public DocumentListRequest {
        if (offset == null) {
            offset = 0;
        }
        if (limit == null) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
    }

    /**
     * Первая страница без фильтров
     */
    public static DocumentListRequest all() {
        return new DocumentListRequest(null, null, 0, DEFAULT_LIMIT);
    }
}
