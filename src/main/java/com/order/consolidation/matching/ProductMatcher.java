package com.order.consolidation.matching;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.cache.NormalizedCatalogCache;
import com.order.consolidation.cache.NormalizedEntry;
import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.core.model.ConfidenceLevel;
import com.order.consolidation.core.model.MatchCandidate;
import com.order.consolidation.core.model.MatchResult;
import com.order.consolidation.core.model.MatchType;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import com.order.consolidation.rules.TextNormalizer;
import com.order.consolidation.similarity.SequenceRatioSimilarity;
import com.order.consolidation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches a free-text product mention against a catalog snapshot.
 *
 * <p>Each available entry is tried against the tiers of {@link MatchType} in order;
 * the first tier that hits decides that entry's candidate. Candidates are then ranked
 * by descending confidence, ties keeping catalog order.</p>
 *
 * <p>The matcher holds no per-call state and is safe to share between threads.</p>
 */
public class ProductMatcher {
    private static final Logger log = LoggerFactory.getLogger(ProductMatcher.class);

    private static final double FUZZY_HIGH_RATIO = 0.85;
    private static final double FUZZY_MEDIUM_RATIO = 0.65;
    private static final double FUZZY_LOW_RATIO = 0.45;
    private static final double KEYWORD_BONUS_PER_HIT = 0.1;
    private static final double KEYWORD_BONUS_CAP = 0.15;

    private final EngineOptions options;
    private final TextNormalizer normalizer;
    private final NormalizedCatalogCache catalogCache;
    private final SimilarityAlgorithm ratio;
    private final ClarifyingQuestionGenerator questionGenerator;
    private final MetricsService metricsService;

    public ProductMatcher() {
        this(EngineOptions.defaults(), new TextNormalizer(), new NoOpMetricsService());
    }

    public ProductMatcher(EngineOptions options, TextNormalizer normalizer, MetricsService metricsService) {
        this(options, normalizer, new NormalizedCatalogCache(normalizer), metricsService);
    }

    public ProductMatcher(EngineOptions options, TextNormalizer normalizer,
                          NormalizedCatalogCache catalogCache, MetricsService metricsService) {
        this.options = options;
        this.normalizer = normalizer;
        this.catalogCache = catalogCache;
        this.ratio = new SequenceRatioSimilarity();
        this.questionGenerator = new ClarifyingQuestionGenerator(normalizer);
        this.metricsService = metricsService;
    }

    /**
     * Matches the query against the catalog. Never throws on null or empty input;
     * such calls return a NONE result with a clarifying question.
     */
    public MatchResult matchProducts(String query, List<CatalogEntry> catalog) {
        long startNanos = System.nanoTime();
        List<MatchCandidate> candidates = findCandidates(query, catalog);
        ConfidenceLevel level = classifyConfidenceLevel(candidates);
        boolean requiresClarification = level != ConfidenceLevel.HIGH;
        String question = requiresClarification
                ? questionGenerator.generate(query, candidates, level, catalog)
                : null;
        MatchCandidate best = candidates.isEmpty() ? null : candidates.get(0);

        log.debug("match.completed query='{}' candidates={} level={}", query, candidates.size(), level);
        metricsService.recordMatch(level);
        return new MatchResult(query, candidates, best, level, requiresClarification, question,
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Returns every candidate for the query, ranked by descending confidence.
     */
    public List<MatchCandidate> findCandidates(String query, List<CatalogEntry> catalog) {
        if (query == null || query.isBlank() || catalog == null || catalog.isEmpty()) {
            return List.of();
        }
        List<String> terms = normalizer.extractTerms(query);
        String normalizedQuery = normalizer.normalize(query);

        List<MatchCandidate> candidates = new ArrayList<>();
        for (CatalogEntry entry : catalog) {
            if (entry == null || !entry.isAvailable()) {
                continue;
            }
            matchEntry(terms, normalizedQuery, entry).ifPresent(candidates::add);
        }
        candidates.sort(Comparator.comparingDouble(MatchCandidate::confidence).reversed());
        return candidates;
    }

    /**
     * Classifies ranked candidates by the top confidence.
     */
    public ConfidenceLevel classifyConfidenceLevel(List<MatchCandidate> rankedCandidates) {
        if (rankedCandidates == null || rankedCandidates.isEmpty()) {
            return ConfidenceLevel.NONE;
        }
        double top = rankedCandidates.get(0).confidence();
        if (top >= options.getHighConfidenceThreshold()) {
            return ConfidenceLevel.HIGH;
        }
        if (top >= options.getMediumConfidenceThreshold()) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    private Optional<MatchCandidate> matchEntry(List<String> terms, String normalizedQuery, CatalogEntry entry) {
        NormalizedEntry normalized = catalogCache.get(entry);

        for (String term : terms) {
            if (term.equals(normalized.name())) {
                return Optional.of(candidate(entry, MatchType.EXACT, MatchType.EXACT.baseConfidence(), term));
            }
        }
        Optional<String> alias = firstEqual(terms, normalized.aliases());
        if (alias.isPresent()) {
            return Optional.of(candidate(entry, MatchType.ALIAS, MatchType.ALIAS.baseConfidence(), alias.get()));
        }
        Optional<String> misspelling = firstEqual(terms, normalized.misspellings());
        if (misspelling.isPresent()) {
            return Optional.of(candidate(entry, MatchType.MISSPELLING,
                    MatchType.MISSPELLING.baseConfidence(), misspelling.get()));
        }
        Optional<MatchCandidate> keyword = matchKeywords(terms, normalized, entry);
        if (keyword.isPresent()) {
            return keyword;
        }
        Optional<MatchCandidate> training = matchTrainingPhrases(normalizedQuery, normalized, entry);
        if (training.isPresent()) {
            return training;
        }
        return matchFuzzy(terms, normalized, entry);
    }

    private Optional<String> firstEqual(List<String> terms, List<String> targets) {
        for (String term : terms) {
            if (targets.contains(term)) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }

    private Optional<MatchCandidate> matchKeywords(List<String> terms, NormalizedEntry normalized, CatalogEntry entry) {
        List<String> hits = new ArrayList<>();
        for (String term : terms) {
            for (String keyword : normalized.keywords()) {
                if (term.equals(keyword)) {
                    hits.add(term);
                }
            }
        }
        if (hits.isEmpty()) {
            return Optional.empty();
        }
        double bonus = Math.min(KEYWORD_BONUS_PER_HIT * (hits.size() - 1), KEYWORD_BONUS_CAP);
        double confidence = Math.min(MatchType.KEYWORD.baseConfidence() + bonus, 1.0);
        return Optional.of(candidate(entry, MatchType.KEYWORD, confidence, String.join(", ", hits)));
    }

    private Optional<MatchCandidate> matchTrainingPhrases(String normalizedQuery, NormalizedEntry normalized,
                                                          CatalogEntry entry) {
        double bestSimilarity = 0.0;
        String bestPhrase = null;
        for (int i = 0; i < normalized.trainingPhrases().size(); i++) {
            double similarity = ratio.compute(normalizedQuery, normalized.trainingPhrases().get(i));
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                bestPhrase = entry.trainingPhrases().get(i);
            }
        }
        if (bestPhrase == null || bestSimilarity < options.getTrainingSimilarityThreshold()) {
            return Optional.empty();
        }
        return Optional.of(candidate(entry, MatchType.TRAINING,
                MatchType.TRAINING.baseConfidence() * bestSimilarity, bestPhrase));
    }

    private Optional<MatchCandidate> matchFuzzy(List<String> terms, NormalizedEntry normalized, CatalogEntry entry) {
        double bestSimilarity = 0.0;
        String bestTerm = null;
        for (String term : terms) {
            for (String target : normalized.fuzzyTargets()) {
                double similarity = ratio.compute(term, target);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestTerm = term;
                }
            }
        }
        MatchType type;
        if (bestSimilarity >= FUZZY_HIGH_RATIO) {
            type = MatchType.FUZZY_HIGH;
        } else if (bestSimilarity >= FUZZY_MEDIUM_RATIO) {
            type = MatchType.FUZZY_MED;
        } else if (bestSimilarity >= FUZZY_LOW_RATIO) {
            type = MatchType.FUZZY_LOW;
        } else {
            return Optional.empty();
        }
        return Optional.of(candidate(entry, type, type.baseConfidence() * bestSimilarity, bestTerm));
    }

    private MatchCandidate candidate(CatalogEntry entry, MatchType type, double confidence, String matchedText) {
        return new MatchCandidate(entry, type, Math.min(confidence, 1.0), matchedText);
    }
}
