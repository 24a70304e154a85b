package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Metadata filters applied to search candidates. All present filters are ANDed;
 * {@code tags} matches when the document carries any of the listed tags.
 */
@Builder
public record SearchFilters(
    @JsonProperty("domains")
    Set<String> domains,

    @JsonProperty("types")
    Set<DocumentType> types,

    @JsonProperty("tags")
    Set<String> tags,

    @JsonProperty("effectivenessMin")
    Double effectivenessMin,

    @JsonProperty("createdAfter")
    Instant createdAfter,

    @JsonProperty("createdBefore")
    Instant createdBefore
) {
    @JsonCreator
    public SearchFilters {
        domains = domains == null ? null : Set.copyOf(domains);
        types = types == null ? null : Set.copyOf(types);
        tags = tags == null ? null : Set.copyOf(tags);
    }
}
