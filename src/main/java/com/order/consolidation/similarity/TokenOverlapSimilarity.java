package com.order.consolidation.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of word tokens.
 * Used to suggest catalog names that share words with an unmatched query.
 */
public class TokenOverlapSimilarity implements SimilarityAlgorithm {

    private final Pattern tokenPattern;
    private final int minTokenLength;

    public TokenOverlapSimilarity() {
        this("\\s+", 3);
    }

    public TokenOverlapSimilarity(String tokenPattern, int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1");
        }
        this.tokenPattern = Pattern.compile(tokenPattern);
        this.minTokenLength = minTokenLength;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);

        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    /**
     * Returns true if the two strings share at least one token.
     */
    public boolean sharesToken(String s1, String s2) {
        return compute(s1, s2) > 0.0;
    }

    @Override
    public String getName() {
        return "TokenOverlap";
    }

    private Set<String> tokenize(String s) {
        String[] tokens = tokenPattern.split(s.toLowerCase(Locale.ROOT));
        Set<String> tokenSet = new HashSet<>();
        for (String token : tokens) {
            String trimmed = token.trim();
            if (trimmed.length() >= minTokenLength) {
                tokenSet.add(trimmed);
            }
        }
        return tokenSet;
    }
}
