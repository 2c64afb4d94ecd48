package com.order.consolidation.matching;

import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.core.model.ConfidenceLevel;
import com.order.consolidation.core.model.MatchCandidate;
import com.order.consolidation.rules.TextNormalizer;
import com.order.consolidation.similarity.TokenOverlapSimilarity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the Spanish follow-up question asked when a product mention is not matched
 * with high confidence.
 */
public class ClarifyingQuestionGenerator {

    private static final int MAX_OPTIONS = 3;

    private final TextNormalizer normalizer;
    private final TokenOverlapSimilarity tokenOverlap;

    public ClarifyingQuestionGenerator(TextNormalizer normalizer) {
        this.normalizer = normalizer;
        this.tokenOverlap = new TokenOverlapSimilarity();
    }

    /**
     * Returns the question to ask, or null when the level is HIGH.
     *
     * @param query      the customer's original product mention
     * @param candidates ranked candidates
     * @param level      confidence level of the ranked candidates
     * @param catalog    the catalog snapshot, used to suggest related names when nothing matched
     */
    public String generate(String query, List<MatchCandidate> candidates, ConfidenceLevel level,
                           List<CatalogEntry> catalog) {
        String shownQuery = query != null ? query : "";
        return switch (level) {
            case HIGH -> null;
            case MEDIUM -> mediumQuestion(candidates);
            case LOW -> lowQuestion(shownQuery, candidates);
            case NONE -> noMatchQuestion(shownQuery, catalog);
        };
    }

    private String mediumQuestion(List<MatchCandidate> candidates) {
        List<MatchCandidate> top = candidates.subList(0, Math.min(MAX_OPTIONS, candidates.size()));
        if (top.size() == 1) {
            MatchCandidate only = top.get(0);
            List<String> variants = only.entry().sizeVariants();
            if (variants.size() > 1) {
                return "¿Te refieres a " + only.productName() + "? Tenemos disponible en: "
                        + String.join(", ", variants);
            }
            return "¿Te refieres a " + only.productName() + "?";
        }
        List<String> names = new ArrayList<>();
        for (MatchCandidate candidate : top) {
            names.add(candidate.productName());
        }
        return "¿Te refieres a " + joinWithOr(names) + "?";
    }

    private String lowQuestion(String query, List<MatchCandidate> candidates) {
        Set<String> categories = new LinkedHashSet<>();
        for (MatchCandidate candidate : candidates.subList(0, Math.min(MAX_OPTIONS, candidates.size()))) {
            String category = candidate.entry().category();
            if (!category.isBlank()) {
                categories.add(category.toLowerCase(Locale.ROOT));
            }
        }
        if (categories.size() == 1) {
            return "¿Buscas algo específico en " + categories.iterator().next()
                    + "? Tenemos varios productos disponibles.";
        }
        if (categories.size() > 1) {
            return "¿Buscas algo en " + joinWithOr(new ArrayList<>(categories)) + "?";
        }
        return "¿Podrías ser más específico sobre '" + query + "'? No estoy seguro de qué producto necesitas.";
    }

    private String noMatchQuestion(String query, List<CatalogEntry> catalog) {
        String question = "No encontré '" + query + "' en nuestro catálogo. "
                + "¿Podrías describir mejor el producto que necesitas?";
        List<String> related = relatedNames(query, catalog);
        if (related.isEmpty()) {
            return question;
        }
        return question + " Quizás te interese: " + joinWithOr(related) + ".";
    }

    /**
     * Names of available entries sharing at least one word with the query, in catalog order.
     */
    private List<String> relatedNames(String query, List<CatalogEntry> catalog) {
        List<String> names = new ArrayList<>();
        if (catalog == null) {
            return names;
        }
        String normalizedQuery = normalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return names;
        }
        for (CatalogEntry entry : catalog) {
            if (names.size() == MAX_OPTIONS) {
                break;
            }
            if (entry != null && entry.isAvailable()
                    && tokenOverlap.sharesToken(normalizedQuery, normalizer.normalize(entry.name()))) {
                names.add(entry.name());
            }
        }
        return names;
    }

    static String joinWithOr(List<String> values) {
        if (values.size() == 1) {
            return values.get(0);
        }
        return String.join(", ", values.subList(0, values.size() - 1)) + " o " + values.get(values.size() - 1);
    }
}
