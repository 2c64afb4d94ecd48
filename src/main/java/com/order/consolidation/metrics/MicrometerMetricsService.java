package com.order.consolidation.metrics;

import com.order.consolidation.api.SessionAction;
import com.order.consolidation.consolidation.ConsolidationDecision;
import com.order.consolidation.continuation.DetectionMethod;
import com.order.consolidation.core.model.ConfidenceLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code order.match} - Counter (tag: level)</li>
 *   <li>{@code order.continuation.check} - Counter (tags: method, continuation)</li>
 *   <li>{@code order.consolidation.decision} - Counter (tag: decision)</li>
 *   <li>{@code order.session.started} - Counter</li>
 *   <li>{@code order.session.closed} - Counter (tag: orderCreated)</li>
 *   <li>{@code order.session.expired} - Counter</li>
 *   <li>{@code order.message.processing.duration} - Timer (tag: action)</li>
 *   <li>{@code order.catalog.cache.hit} - Counter</li>
 *   <li>{@code order.catalog.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter sessionStartedCounter;
    private final Counter expiredSessionCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.sessionStartedCounter = Counter.builder("order.session.started")
                .description("Number of order sessions started")
                .register(registry);
        this.expiredSessionCounter = Counter.builder("order.session.expired")
                .description("Number of sessions closed by the expiry sweep")
                .register(registry);
        this.cacheHitCounter = Counter.builder("order.catalog.cache.hit")
                .description("Number of normalized catalog cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("order.catalog.cache.miss")
                .description("Number of normalized catalog cache misses")
                .register(registry);
    }

    @Override
    public void recordMatch(ConfidenceLevel level) {
        String key = "match:" + level.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("order.match")
                        .description("Product matches by confidence level")
                        .tag("level", level.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordContinuationCheck(DetectionMethod method, boolean continuation) {
        String key = "continuation:" + method.name() + ":" + continuation;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("order.continuation.check")
                        .description("Continuation checks by detection method and verdict")
                        .tag("method", method.name())
                        .tag("continuation", String.valueOf(continuation))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordConsolidationDecision(ConsolidationDecision decision) {
        String key = "decision:" + decision.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("order.consolidation.decision")
                        .description("Consolidation decisions taken")
                        .tag("decision", decision.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementSessionStarted() {
        sessionStartedCounter.increment();
    }

    @Override
    public void incrementSessionClosed(boolean orderCreated) {
        String key = "closed:" + orderCreated;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("order.session.closed")
                        .description("Number of order sessions closed")
                        .tag("orderCreated", String.valueOf(orderCreated))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordExpiredSessions(int count) {
        if (count > 0) {
            expiredSessionCounter.increment(count);
        }
    }

    @Override
    public void recordProcessingDuration(SessionAction action, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(action.name(), k ->
                Timer.builder("order.message.processing.duration")
                        .description("Duration of inbound message processing")
                        .tag("action", action.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
