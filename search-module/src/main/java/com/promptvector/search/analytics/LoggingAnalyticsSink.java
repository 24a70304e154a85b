package com.promptvector.search.analytics;

import com.promptvector.common.model.AnalyticsEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Default sink used when no analytics backend is wired in.
 */
@Slf4j
public class LoggingAnalyticsSink implements AnalyticsSink {

    @Override
    public void record(AnalyticsEvent event) {
        log.debug("Analytics event {} for {} {}: {}",
            event.eventType(), event.entityType(), event.entityId(), event.data());
    }
}
