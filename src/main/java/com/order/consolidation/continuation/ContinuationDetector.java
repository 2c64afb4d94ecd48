package com.order.consolidation.continuation;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.core.model.RecentOrder;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a message adds to a recent PENDING order instead of starting a new one.
 *
 * <p>Checks run cheapest and most certain first: explicit phrases ("también", "y dame"),
 * then implicit shapes ("y" or "ah" followed by a word), then a temporal rule for product
 * requests arriving shortly after a pending order. Accepted and rejected orders are never
 * continued.</p>
 */
public class ContinuationDetector {
    private static final Logger log = LoggerFactory.getLogger(ContinuationDetector.class);

    static final double NO_PENDING_CONFIDENCE = 1.0;
    static final double EXPLICIT_CONFIDENCE = 0.95;
    static final double IMPLICIT_CONFIDENCE = 0.70;
    static final double TEMPORAL_CONFIDENCE = 0.75;
    static final double NO_SIGNAL_CONFIDENCE = 0.90;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<String> EXPLICIT_PHRASES = List.of(
            "también", "tambien", "además", "ademas",
            "y también", "y tambien", "y además", "y ademas",
            "ah y", "ah también", "ah tambien", "ah y también",
            "y dame", "y deme", "y ponme", "y pon",
            "también quiero", "tambien quiero", "además quiero", "ademas quiero",
            "y quiero", "ah quiero", "ah y quiero",
            "dame también", "dame tambien", "ponme también", "ponme tambien",
            "de esos también", "de esos tambien"
    );

    private static final List<Pattern> IMPLICIT_PATTERNS = compileAll(List.of(
            "\\by\\s+\\w+",
            "\\bah\\s+\\w+",
            "\\bponme\\s+\\w+",
            "\\bdame\\s+\\w+"
    ));

    private static final List<Pattern> PRODUCT_REQUEST_PATTERNS = compileAll(List.of(
            "\\d+\\s+\\w+",
            "\\w+\\s+\\d+",
            "\\bquiero\\s+\\w+",
            "\\bdame\\s+\\w+",
            "\\bponme\\s+\\w+",
            "\\bnecesito\\s+\\w+",
            "\\bm[aá]ndame\\s+\\w+"
    ));

    private static final List<String> REJECTION_PHRASES = List.of(
            "no", "nada más", "ya está", "eso es todo", "gracias",
            "nuevo pedido", "otra orden", "cancelar", "cancel"
    );

    private final List<Pattern> explicitPatterns;
    private final List<Pattern> rejectionPatterns;
    private final Duration window;
    private final Clock clock;
    private final MetricsService metricsService;

    public ContinuationDetector() {
        this(EngineOptions.defaults(), Clock.systemUTC(), new NoOpMetricsService());
    }

    public ContinuationDetector(EngineOptions options, Clock clock, MetricsService metricsService) {
        this.explicitPatterns = compileAll(phrasePatterns(EXPLICIT_PHRASES));
        this.rejectionPatterns = compileAll(phrasePatterns(REJECTION_PHRASES));
        this.window = options.getContinuationWindow();
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Checks the message against the customer's recent PENDING orders, as of now.
     */
    public ContinuationResult checkContinuation(String message, String conversationId, String customerId,
                                                RecentOrdersLookup lookup) {
        return checkContinuation(message, conversationId, customerId, lookup, clock.instant());
    }

    /**
     * Checks the message against the customer's PENDING orders created within the window before {@code now}.
     * Lookup failures yield a non-continuation with zero confidence and method ERROR.
     */
    public ContinuationResult checkContinuation(String message, String conversationId, String customerId,
                                                RecentOrdersLookup lookup, Instant now) {
        ContinuationResult result;
        try {
            List<RecentOrder> pending = pendingOrders(lookup.findRecentOrders(customerId, window), now);
            if (pending.isEmpty()) {
                result = ContinuationResult.notContinuation(NO_PENDING_CONFIDENCE,
                        "No recent PENDING orders found", DetectionMethod.RULES);
            } else {
                result = detect(message != null ? message.toLowerCase(Locale.ROOT).trim() : "", pending, now);
            }
        } catch (RuntimeException e) {
            log.error("continuation.lookupFailed conversationId={} customerId={}", conversationId, customerId, e);
            result = ContinuationResult.notContinuation(0.0,
                    "Detection error: " + e.getMessage(), DetectionMethod.ERROR);
        }
        log.debug("continuation.checked conversationId={} continuation={} confidence={} method={}",
                conversationId, result.isContinuation(), result.confidence(), result.detectionMethod());
        metricsService.recordContinuationCheck(result.detectionMethod(), result.isContinuation());
        return result;
    }

    /**
     * Returns true unless some PENDING order is younger than the threshold.
     * ACCEPTED and REJECTED orders never block a new order.
     */
    public boolean shouldCreateNewOrder(List<RecentOrder> recentOrders, Duration threshold) {
        return shouldCreateNewOrder(recentOrders, threshold, clock.instant());
    }

    public boolean shouldCreateNewOrder(List<RecentOrder> recentOrders, Duration threshold, Instant now) {
        if (recentOrders == null || recentOrders.isEmpty()) {
            return true;
        }
        Duration limit = threshold != null ? threshold : window;
        for (RecentOrder order : recentOrders) {
            if (order.isPending() && order.ageAt(now).compareTo(limit) <= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Summarizes the two most recent orders, one line each.
     */
    public String describeRecentOrders(List<RecentOrder> recentOrders) {
        if (recentOrders == null || recentOrders.isEmpty()) {
            return "No recent orders";
        }
        List<RecentOrder> sorted = new ArrayList<>(recentOrders);
        sorted.sort(Comparator.comparing(RecentOrder::createdAt).reversed());
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < Math.min(2, sorted.size()); i++) {
            RecentOrder order = sorted.get(i);
            List<String> names = order.productNames();
            String shown = String.join(", ", names.subList(0, Math.min(3, names.size())));
            lines.add("Recent Order " + (i + 1) + ": #" + (order.orderNumber() != null ? order.orderNumber() : "N/A")
                    + " (" + order.status() + " status) with " + order.lineCount() + " items: " + shown
                    + (names.size() > 3 ? "..." : ""));
        }
        return String.join("\n", lines);
    }

    private ContinuationResult detect(String text, List<RecentOrder> pending, Instant now) {
        RecentOrder target = pending.get(0);

        List<String> explicit = new ArrayList<>();
        for (int i = 0; i < explicitPatterns.size(); i++) {
            if (explicitPatterns.get(i).matcher(text).find()) {
                explicit.add(EXPLICIT_PHRASES.get(i));
            }
        }
        if (!explicit.isEmpty()) {
            return new ContinuationResult(true, EXPLICIT_CONFIDENCE, target.id(), target.orderNumber(),
                    "Explicit continuation phrases found: " + String.join(", ", explicit), DetectionMethod.RULES);
        }

        long implicit = IMPLICIT_PATTERNS.stream().filter(p -> p.matcher(text).find()).count();
        if (implicit > 0) {
            return new ContinuationResult(true, IMPLICIT_CONFIDENCE, target.id(), target.orderNumber(),
                    "Implicit continuation patterns detected: " + implicit + " matches", DetectionMethod.RULES);
        }

        Duration age = target.ageAt(now);
        boolean productRequest = PRODUCT_REQUEST_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
        boolean rejected = rejectionPatterns.stream().anyMatch(p -> p.matcher(text).find());
        if (age.compareTo(window) <= 0 && productRequest && !rejected) {
            return new ContinuationResult(true, TEMPORAL_CONFIDENCE, target.id(), target.orderNumber(),
                    String.format(Locale.ROOT, "Temporal continuation: product order within %.1f minutes of recent order",
                            age.toMillis() / 60000.0),
                    DetectionMethod.TEMPORAL_RULES);
        }

        return ContinuationResult.notContinuation(NO_SIGNAL_CONFIDENCE,
                "No continuation phrases, patterns, or temporal context detected", DetectionMethod.RULES);
    }

    /**
     * PENDING orders within the window, most recent first.
     */
    private List<RecentOrder> pendingOrders(List<RecentOrder> orders, Instant now) {
        if (orders == null) {
            return List.of();
        }
        return orders.stream()
                .filter(RecentOrder::isPending)
                .filter(order -> order.ageAt(now).compareTo(window) <= 0)
                .sorted(Comparator.comparing(RecentOrder::createdAt).reversed())
                .collect(Collectors.toList());
    }

    private static List<String> phrasePatterns(List<String> phrases) {
        return phrases.stream()
                .map(phrase -> "\\b" + Pattern.quote(phrase) + "\\b")
                .toList();
    }

    private static List<Pattern> compileAll(List<String> expressions) {
        return expressions.stream()
                .map(expression -> Pattern.compile(expression, FLAGS))
                .toList();
    }
}
