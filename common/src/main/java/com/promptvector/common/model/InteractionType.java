package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of user interaction with a document, with its base weight
 * in the preference vector.
 */
public enum InteractionType {
    VIEW(0.1),
    LIKE(0.3),
    USE(0.5),
    SHARE(0.8);

    private final double baseWeight;

    InteractionType(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double baseWeight() {
        return baseWeight;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
