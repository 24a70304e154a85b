package com.promptvector.search.metrics;

import com.google.common.collect.EvictingQueue;
import com.promptvector.search.config.VectorSearchProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding window of the latest latencies per operation.
 */
@Component
public class PerformanceTracker {

    public static final String SEARCH = "search";
    public static final String ADD_DOCUMENT = "add_document";

    private final int window;
    private final Map<String, EvictingQueue<Double>> samples = new HashMap<>();

    public PerformanceTracker(VectorSearchProperties properties) {
        this.window = properties.getMetrics().getWindow();
    }

    public synchronized void record(String operation, Duration elapsed) {
        samples.computeIfAbsent(operation, name -> EvictingQueue.create(window))
            .add(elapsed.toNanos() / 1_000_000.0);
    }

    /** Среднее время операции в миллисекундах, 0 если замеров нет */
    public synchronized double averageMillis(String operation) {
        EvictingQueue<Double> queue = samples.get(operation);
        if (queue == null || queue.isEmpty()) {
            return 0.0;
        }
        return queue.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public synchronized int sampleCount(String operation) {
        EvictingQueue<Double> queue = samples.get(operation);
        return queue == null ? 0 : queue.size();
    }

    public synchronized void reset() {
        samples.clear();
    }
}
