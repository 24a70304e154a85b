package com.promptvector.search.analytics;

import com.promptvector.common.model.AnalyticsEvent;

/**
 * Consumer of engine analytics events. Implementations may throw; the publisher
 * logs such failures and never lets them reach the triggering operation.
 */
public interface AnalyticsSink {

    void record(AnalyticsEvent event);
}
