package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a single maintenance sub-step.
 */
public record OptimizationStep(
    @JsonProperty("name")
    String name,

    @JsonProperty("succeeded")
    boolean succeeded,

    @JsonProperty("message")
    String message
) {
    public static OptimizationStep success(String name, String message) {
        return new OptimizationStep(name, true, message);
    }

    public static OptimizationStep failure(String name, String message) {
        return new OptimizationStep(name, false, message);
    }
}
