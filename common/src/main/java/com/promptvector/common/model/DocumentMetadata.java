package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@Builder(toBuilder = true)
public record DocumentMetadata(
    @JsonProperty("domain")
    String domain,

    @NotNull
    @JsonProperty("type")
    DocumentType type,

    @NotNull
    @JsonProperty("created")
    Instant created,

    @JsonProperty("updated")
    Instant updated,

    @JsonProperty("tags")
    Set<String> tags,

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("effectiveness")
    Double effectiveness,

    @JsonProperty("usageCount")
    Long usageCount,

    /** Открытые поля расширения */
    @JsonProperty("attributes")
    Map<String, Object> attributes
) {
    @JsonCreator
    public DocumentMetadata {
        if (type == null) {
            throw new IllegalArgumentException("Document type cannot be null");
        }
        if (created == null) {
            throw new IllegalArgumentException("Created timestamp cannot be null");
        }
        if (effectiveness != null && (effectiveness < 0 || effectiveness > 1)) {
            throw new IllegalArgumentException("Effectiveness must be between 0 and 1");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (updated == null) {
            updated = created;
        }
    }
}
