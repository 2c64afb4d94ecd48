package com.order.consolidation.metrics;

import com.order.consolidation.api.SessionAction;
import com.order.consolidation.consolidation.ConsolidationDecision;
import com.order.consolidation.continuation.DetectionMethod;
import com.order.consolidation.core.model.ConfidenceLevel;

import java.time.Duration;

/**
 * Interface for recording order consolidation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so every component works
 * without a registry.
 */
public interface MetricsService {

    void recordMatch(ConfidenceLevel level);

    void recordContinuationCheck(DetectionMethod method, boolean continuation);

    void recordConsolidationDecision(ConsolidationDecision decision);

    void incrementSessionStarted();

    void incrementSessionClosed(boolean orderCreated);

    void recordExpiredSessions(int count);

    void recordProcessingDuration(SessionAction action, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
