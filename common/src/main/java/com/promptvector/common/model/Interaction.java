package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

@Builder
public record Interaction(
    @JsonProperty("documentId")
    String documentId,

    @JsonProperty("type")
    InteractionType type,

    @JsonProperty("timestamp")
    Instant timestamp,

    /** Пользовательский вес; по умолчанию 1 */
    @JsonProperty("weight")
    Double weight
) {
    @JsonCreator
    public Interaction {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Interaction type cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
    }

    public double effectiveWeight() {
        return weight == null ? 1.0 : weight;
    }
}
