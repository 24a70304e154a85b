package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record OptimizationReport(
    @JsonProperty("before")
    IndexStatistics before,

    @JsonProperty("after")
    IndexStatistics after,

    @JsonProperty("steps")
    List<OptimizationStep> steps,

    /** Процентное изменение средней задержки поиска (положительное = быстрее) */
    @JsonProperty("performanceImprovement")
    double performanceImprovement
) {
    public OptimizationReport {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Names of the steps that completed successfully
     */
    @JsonIgnore
    public List<String> optimizationsApplied() {
        return steps.stream()
            .filter(OptimizationStep::succeeded)
            .map(OptimizationStep::message)
            .toList();
    }

    @JsonIgnore
    public boolean fullySucceeded() {
        return steps.stream().allMatch(OptimizationStep::succeeded);
    }
}
