package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record AnalyticsEvent(
    @JsonProperty("eventType")
    String eventType,

    @JsonProperty("entityId")
    String entityId,

    @JsonProperty("entityType")
    String entityType,

    @JsonProperty("data")
    Map<String, Object> data,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public AnalyticsEvent {
        data = data == null ? Map.of() : data;
    }
}
