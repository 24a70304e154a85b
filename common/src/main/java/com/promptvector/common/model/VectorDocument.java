package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Embedded prompt, template, example or feedback entry.
 * The vector is stored L2-normalized; an all-zero vector is kept as is.
 * The vector is copied on the way in and out, and compared by content.
 */
@Builder(toBuilder = true)
public record VectorDocument(
    @NotBlank
    @JsonProperty("id")
    String id,

    @JsonProperty("content")
    String content,

    @NotNull
    @Size(min = 1)
    @JsonProperty("vector")
    float[] vector,

    @NotNull
    @JsonProperty("metadata")
    DocumentMetadata metadata
) {
    @JsonCreator
    public VectorDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id cannot be null or blank");
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector cannot be null or empty");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata cannot be null");
        }
        vector = vector.clone();
    }

    @Override
    @JsonProperty("vector")
    public float[] vector() {
        return vector.clone();
    }

    /**
     * Creates a copy carrying the given vector
     */
    public VectorDocument withVector(float[] newVector) {
        return new VectorDocument(id, content, newVector, metadata);
    }

    /**
     * Gets the dimension of the vector
     */
    @JsonIgnore
    public int dimension() {
        return vector.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorDocument)) {
            return false;
        }
        VectorDocument other = (VectorDocument) o;
        return id.equals(other.id)
            && Objects.equals(content, other.content)
            && Arrays.equals(vector, other.vector)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, Arrays.hashCode(vector), metadata);
    }

    @Override
    public String toString() {
        return "VectorDocument[id=" + id + ", content=" + content + ", vector=" + Arrays.toString(vector)
            + ", metadata=" + metadata + "]";
    }
}
