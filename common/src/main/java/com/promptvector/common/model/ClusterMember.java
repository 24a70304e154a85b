package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClusterMember(
    @JsonProperty("documentId")
    String documentId,

    @JsonProperty("distanceToCentroid")
    double distanceToCentroid
) {
}
