package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record ClusterStats(
    @JsonProperty("size")
    int size,

    /** Средняя попарная косинусная близость внутри кластера */
    @JsonProperty("averageSimilarity")
    double averageSimilarity,

    @JsonProperty("dominantTags")
    List<String> dominantTags,

    @JsonProperty("effectiveness")
    EffectivenessStats effectiveness
) {
    public ClusterStats {
        dominantTags = dominantTags == null ? List.of() : List.copyOf(dominantTags);
        if (effectiveness == null) {
            effectiveness = EffectivenessStats.EMPTY;
        }
    }
}
