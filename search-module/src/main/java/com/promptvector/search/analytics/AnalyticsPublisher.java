package com.promptvector.search.analytics;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.promptvector.common.model.AnalyticsEvent;
import com.promptvector.search.config.VectorSearchProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget delivery of analytics events to the {@link AnalyticsSink}.
 * <p>
 * A single worker drains a bounded queue; when the queue is full the event is
 * dropped and counted. Sink failures are logged and never reach the caller.
 */
@Component
@Slf4j
public class AnalyticsPublisher {

    private final AnalyticsSink sink;
    private final Clock clock;
    private final AtomicLong dropped = new AtomicLong();
    private final ThreadPoolExecutor executor;

    public AnalyticsPublisher(AnalyticsSink sink, VectorSearchProperties properties, Clock clock) {
        this.sink = sink;
        this.clock = clock;
        this.executor = new ThreadPoolExecutor(
            1, 1,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(properties.getAnalytics().getQueueCapacity()),
            new ThreadFactoryBuilder().setNameFormat("analytics-%d").setDaemon(true).build(),
            (task, pool) -> onOverflow()
        );
    }

    /**
     * Поставить событие в очередь на отправку
     */
    public void publish(String eventType, String entityId, String entityType, Map<String, Object> data) {
        AnalyticsEvent event = new AnalyticsEvent(eventType, entityId, entityType, data, clock.instant());
        if (executor.isShutdown()) {
            onOverflow();
            return;
        }
        executor.execute(() -> deliver(event));
    }

    /** Количество отброшенных событий */
    public long droppedCount() {
        return dropped.get();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Analytics queue not drained on shutdown, {} events pending", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void deliver(AnalyticsEvent event) {
        try {
            sink.record(event);
        } catch (Exception e) {
            log.warn("Analytics sink failed for event {} on {}", event.eventType(), event.entityId(), e);
        }
    }

    private void onOverflow() {
        long total = dropped.incrementAndGet();
        log.warn("Analytics queue is full, event dropped ({} dropped so far)", total);
    }
}
