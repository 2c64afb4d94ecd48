package com.order.consolidation.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based analysis of customer messages: order intent, closing phrases, corrections
 * and quantity/product mentions.
 *
 * <p>Stateless apart from its immutable {@link PatternTables}; safe to share between threads.</p>
 */
public class PatternDetector {
    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    static final double STRONG_INTENT_WEIGHT = 0.85;
    static final double MEDIUM_INTENT_WEIGHT = 0.6;
    static final double QUANTITY_PRODUCT_BONUS = 0.8;
    static final double INTENT_THRESHOLD = 0.5;
    static final double CLOSING_WEIGHT = 0.8;
    static final double CLOSING_THRESHOLD = 0.6;
    static final double CORRECTION_WEIGHT = 0.9;
    static final double CORRECTION_THRESHOLD = 0.7;
    static final double QUANTITY_WEIGHT = 0.8;
    static final double PRODUCT_WEIGHT = 0.7;
    static final double ITEM_CONFIDENCE = 0.8;
    static final double ITEMS_BONUS = 0.3;
    static final double CLOSE_ACTION_THRESHOLD = 0.5;
    static final double START_SESSION_THRESHOLD = 0.5;

    private static final Set<String> STOP_PRODUCTS = Set.of("de", "x", "y", "and", "con", "with");
    private static final Pattern LEADING_CONNECTOR = Pattern.compile("^(?:de|del|of|x)\\s+");
    private static final Pattern TRAILING_CONNECTOR = Pattern.compile("\\s+(?:y|e|and|con|with|más|plus)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PatternTables tables;

    public PatternDetector() {
        this(PatternTables.defaults());
    }

    public PatternDetector(PatternTables tables) {
        this.tables = tables;
    }

    /**
     * Scores how strongly the text asks for goods. Strong phrases weigh 0.85 each, medium
     * hints 0.6 each, and a quantity together with a known product adds 0.8.
     */
    public PatternDetection detectOrderIntent(String text) {
        String input = safe(text);
        List<PatternMatch> matches = new ArrayList<>();
        double total = 0.0;

        for (Pattern pattern : tables.strongIntent()) {
            total += collect(pattern, input, PatternType.ORDER_INTENT, STRONG_INTENT_WEIGHT,
                    Map.of("strength", "strong"), matches);
        }
        for (Pattern pattern : tables.mediumIntent()) {
            total += collect(pattern, input, PatternType.ORDER_INTENT, MEDIUM_INTENT_WEIGHT,
                    Map.of("strength", "medium"), matches);
        }

        List<PatternMatch> quantities = detectQuantities(input);
        List<PatternMatch> products = detectProducts(input);
        if (!quantities.isEmpty() && !products.isEmpty()) {
            total += QUANTITY_PRODUCT_BONUS;
            matches.addAll(quantities);
            matches.addAll(products);
        }

        double confidence = matches.isEmpty() ? 0.0 : Math.min(total, 1.0);
        boolean hasIntent = confidence >= INTENT_THRESHOLD;
        log.debug("pattern.intent detected={} confidence={}", hasIntent, confidence);
        return new PatternDetection(hasIntent, confidence, matches);
    }

    /**
     * Detects phrases that end an order. Each hit weighs 0.8.
     */
    public PatternDetection detectClosingPatterns(String text) {
        String input = safe(text);
        List<PatternMatch> matches = new ArrayList<>();
        for (Pattern pattern : tables.closing()) {
            collect(pattern, input, PatternType.CLOSING, CLOSING_WEIGHT, Map.of(), matches);
        }
        double confidence = Math.min(matches.size() * CLOSING_WEIGHT, 1.0);
        boolean detected = confidence >= CLOSING_THRESHOLD;
        log.debug("pattern.closing detected={} confidence={}", detected, confidence);
        return new PatternDetection(detected, confidence, matches);
    }

    /**
     * Detects phrases that change or cancel earlier items. Each hit weighs 0.9.
     */
    public PatternDetection detectCorrections(String text) {
        String input = safe(text);
        List<PatternMatch> matches = new ArrayList<>();
        for (Pattern pattern : tables.correction()) {
            collect(pattern, input, PatternType.CORRECTION, CORRECTION_WEIGHT, Map.of(), matches);
        }
        double confidence = Math.min(matches.size() * CORRECTION_WEIGHT, 1.0);
        boolean detected = confidence >= CORRECTION_THRESHOLD;
        log.debug("pattern.correction detected={} confidence={}", detected, confidence);
        return new PatternDetection(detected, confidence, matches);
    }

    /**
     * Extracts "quantity [unit] product" items in order of appearance.
     * Product phrases are lowercased and lose leading and trailing connectors
     * ("2 kg de queso y" yields "queso").
     */
    public List<ExtractedItem> extractProductsAndQuantities(String text) {
        String input = safe(text);
        List<ExtractedItem> items = new ArrayList<>();
        Matcher matcher = tables.itemExtraction().matcher(input);
        while (matcher.find()) {
            String product = cleanProductPhrase(matcher.group(3));
            if (product.length() < 3 || STOP_PRODUCTS.contains(product)) {
                continue;
            }
            BigDecimal quantity = new BigDecimal(matcher.group(1));
            String unit = matcher.group(2) != null
                    ? matcher.group(2).toLowerCase(Locale.ROOT)
                    : ExtractedItem.DEFAULT_UNIT;
            items.add(new ExtractedItem(quantity, unit, product, ITEM_CONFIDENCE,
                    matcher.group().trim(), matcher.start(), matcher.end()));
        }
        log.debug("pattern.items extracted={}", items.size());
        return items;
    }

    /**
     * Runs every detector and derives the suggested session action.
     * A closing phrase wins over a correction, which wins over intent or items.
     */
    public MessageAnalysis analyzeMessageContext(String text) {
        String input = safe(text);
        PatternDetection intent = detectOrderIntent(input);
        PatternDetection closing = detectClosingPatterns(input);
        PatternDetection correction = detectCorrections(input);
        List<ExtractedItem> items = extractProductsAndQuantities(input);

        double overall = intent.confidence();
        if (!items.isEmpty()) {
            overall += ITEMS_BONUS;
        }
        overall = Math.min(overall, 1.0);

        SuggestedAction action;
        if (closing.detected() && closing.confidence() > CLOSE_ACTION_THRESHOLD) {
            action = SuggestedAction.CLOSE_SESSION;
        } else if (correction.detected()) {
            action = SuggestedAction.MODIFY_SESSION;
        } else if (intent.detected() || !items.isEmpty()) {
            action = SuggestedAction.START_OR_EXTEND_SESSION;
        } else {
            action = SuggestedAction.NONE;
        }

        List<PatternMatch> all = new ArrayList<>(intent.matches());
        all.addAll(closing.matches());
        all.addAll(correction.matches());

        return new MessageAnalysis(input, intent.detected(), intent.confidence(),
                closing.detected(), closing.confidence(),
                correction.detected(), correction.confidence(),
                items, overall, action, all);
    }

    /**
     * True when the message carries order intent, enough overall confidence and at least one item.
     */
    public boolean shouldStartSession(String text) {
        return shouldStartSession(analyzeMessageContext(text));
    }

    public boolean shouldStartSession(MessageAnalysis analysis) {
        return analysis.hasOrderIntent()
                && analysis.overallConfidence() >= START_SESSION_THRESHOLD
                && analysis.hasItems();
    }

    /**
     * True when the message carries a closing phrase with enough confidence.
     */
    public boolean shouldCloseSession(String text) {
        return shouldCloseSession(analyzeMessageContext(text));
    }

    public boolean shouldCloseSession(MessageAnalysis analysis) {
        return analysis.hasClosingPattern() && analysis.closingConfidence() >= CLOSING_THRESHOLD;
    }

    private List<PatternMatch> detectQuantities(String text) {
        List<PatternMatch> matches = new ArrayList<>();
        for (Pattern pattern : tables.quantity()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Map<String, String> data = new HashMap<>();
                data.put("quantity", matcher.group(1));
                data.put("unit", matcher.groupCount() > 1 && matcher.group(2) != null
                        ? matcher.group(2).trim()
                        : ExtractedItem.DEFAULT_UNIT);
                matches.add(new PatternMatch(PatternType.QUANTITY, QUANTITY_WEIGHT, matcher.group(),
                        matcher.start(), matcher.end(), data));
            }
        }
        return matches;
    }

    private List<PatternMatch> detectProducts(String text) {
        List<PatternMatch> matches = new ArrayList<>();
        for (Pattern pattern : tables.product()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                matches.add(new PatternMatch(PatternType.PRODUCT, PRODUCT_WEIGHT, matcher.group(),
                        matcher.start(), matcher.end(), Map.of("product", matcher.group())));
            }
        }
        return matches;
    }

    /**
     * Adds one match per hit of the pattern and returns the summed weight.
     */
    private double collect(Pattern pattern, String text, PatternType type, double weight,
                           Map<String, String> data, List<PatternMatch> sink) {
        double total = 0.0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            sink.add(new PatternMatch(type, weight, matcher.group(), matcher.start(), matcher.end(), data));
            total += weight;
        }
        return total;
    }

    static String cleanProductPhrase(String phrase) {
        String product = WHITESPACE.matcher(phrase.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        String previous;
        do {
            previous = product;
            product = LEADING_CONNECTOR.matcher(product).replaceFirst("");
            product = TRAILING_CONNECTOR.matcher(product).replaceFirst("");
        } while (!product.equals(previous));
        return product;
    }

    private static String safe(String text) {
        return text != null ? text : "";
    }
}
