package com.promptvector.search.maintenance;

import com.google.common.base.Stopwatch;
import com.promptvector.common.model.IndexStatistics;
import com.promptvector.common.model.OptimizationReport;
import com.promptvector.common.model.OptimizationStep;
import com.promptvector.search.cache.ResultCaches;
import com.promptvector.search.config.VectorSearchProperties;
import com.promptvector.search.quantization.VectorQuantizer;
import com.promptvector.search.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Maintenance run. Each step is attempted independently and reports its own outcome,
 * so one failing step leaves the others applied.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexOptimizer {

    static final String REBUILD_INDEX = "rebuild_index";
    static final String RECALIBRATE_QUANTIZER = "recalibrate_quantizer";
    static final String CLEAR_CACHES = "clear_caches";
    static final String GARBAGE_COLLECTION = "garbage_collection";
    static final String REBALANCE = "rebalance";

    private final VectorSearchProperties properties;
    private final DocumentStore documentStore;
    private final VectorQuantizer quantizer;
    private final ResultCaches caches;
    private final StatisticsCollector statisticsCollector;

    public OptimizationReport optimize() {
        log.info("Starting vector database optimization...");
        Stopwatch stopwatch = Stopwatch.createStarted();
        IndexStatistics before = statisticsCollector.collect();

        List<OptimizationStep> steps = new ArrayList<>();
        steps.add(runStep(REBUILD_INDEX, () -> {
            int reclaimed = documentStore.compactAndRebuild();
            return "Rebuilt hierarchical index, reclaimed " + reclaimed + " slots";
        }));
        steps.add(runStep(RECALIBRATE_QUANTIZER, () -> quantizer.recalibrate()
            .map(parameters -> "Updated vector quantization")
            .orElse("No vectors to calibrate")));
        steps.add(runStep(CLEAR_CACHES, () -> {
            caches.clearSearch();
            caches.clearClusters();
            return "Cleared stale caches";
        }));
        steps.add(runStep(GARBAGE_COLLECTION, () -> {
            int removed = documentStore.collectGarbage();
            return "Performed garbage collection, removed " + removed + " stale entries";
        }));
        if (documentStore.size() > properties.getMaintenance().getRebalanceThreshold()) {
            steps.add(runStep(REBALANCE, () -> {
                log.info("Rebalancing search index...");
                return "Rebalanced search index";
            }));
        }

        IndexStatistics after = statisticsCollector.collect();
        double improvement = improvement(
            before.performance().avgSearchTimeMs(), after.performance().avgSearchTimeMs());

        OptimizationReport report = OptimizationReport.builder()
            .before(before)
            .after(after)
            .steps(steps)
            .performanceImprovement(improvement)
            .build();
        log.info("Database optimization completed in {}, {} of {} steps succeeded, performance improvement: {}%",
            stopwatch, report.optimizationsApplied().size(), steps.size(), String.format("%.2f", improvement));
        return report;
    }

    /**
     * Процент снижения средней задержки поиска; 0 без замеров до оптимизации
     */
    static double improvement(double beforeMs, double afterMs) {
        if (beforeMs <= 0.0) {
            return 0.0;
        }
        return (beforeMs - afterMs) / beforeMs * 100.0;
    }

    private OptimizationStep runStep(String name, Supplier<String> step) {
        try {
            String message = step.get();
            log.debug("Optimization step {} done: {}", name, message);
            return OptimizationStep.success(name, message);
        } catch (RuntimeException e) {
            log.error("Optimization step {} failed", name, e);
            return OptimizationStep.failure(name, e.getMessage());
        }
    }
}
