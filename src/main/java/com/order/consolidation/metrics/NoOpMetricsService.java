package com.order.consolidation.metrics;

import com.order.consolidation.api.SessionAction;
import com.order.consolidation.consolidation.ConsolidationDecision;
import com.order.consolidation.continuation.DetectionMethod;
import com.order.consolidation.core.model.ConfidenceLevel;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatch(ConfidenceLevel level) {
    }

    @Override
    public void recordContinuationCheck(DetectionMethod method, boolean continuation) {
    }

    @Override
    public void recordConsolidationDecision(ConsolidationDecision decision) {
    }

    @Override
    public void incrementSessionStarted() {
    }

    @Override
    public void incrementSessionClosed(boolean orderCreated) {
    }

    @Override
    public void recordExpiredSessions(int count) {
    }

    @Override
    public void recordProcessingDuration(SessionAction action, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
