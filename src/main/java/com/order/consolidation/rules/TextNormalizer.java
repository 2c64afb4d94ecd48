package com.order.consolidation.rules;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes free text for product matching.
 * Lowercases, strips diacritics, collapses whitespace and drops short noise words,
 * so that "Leche de Almendra" and "leche  almendra" normalize to the same form.
 */
public class TextNormalizer {

    /**
     * Spanish articles and prepositions that carry no product meaning.
     */
    public static final Set<String> DEFAULT_STOPWORDS =
            Set.of("de", "del", "la", "el", "un", "una", "por", "para", "con");

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TERM_LENGTH = 3;
    private static final int MAX_TERM_WORDS = 3;

    private final Set<String> stopwords;

    public TextNormalizer() {
        this(DEFAULT_STOPWORDS);
    }

    public TextNormalizer(Set<String> stopwords) {
        this.stopwords = Set.copyOf(stopwords);
    }

    /**
     * Normalizes the given text. Null or blank input yields an empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = stripDiacritics(text.toLowerCase(Locale.ROOT).trim());
        StringBuilder sb = new StringBuilder();
        for (String word : WHITESPACE.split(result)) {
            if (word.isEmpty() || stopwords.contains(word)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word);
        }
        return sb.toString();
    }

    /**
     * Splits normalized text into words.
     */
    public List<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(normalized));
    }

    /**
     * Builds the candidate search terms of a query: every 1, 2 and 3-word window of the
     * normalized text, without terms shorter than three characters and without duplicates.
     * Single words come first, then pairs, then triples.
     */
    public List<String> extractTerms(String query) {
        List<String> words = tokens(query);
        Set<String> terms = new LinkedHashSet<>();
        for (int size = 1; size <= MAX_TERM_WORDS; size++) {
            for (int i = 0; i + size <= words.size(); i++) {
                String term = String.join(" ", words.subList(i, i + size));
                if (term.length() >= MIN_TERM_LENGTH) {
                    terms.add(term);
                }
            }
        }
        return new ArrayList<>(terms);
    }

    /**
     * Removes combining marks after canonical decomposition ("é" becomes "e", "ñ" becomes "n").
     */
    public static String stripDiacritics(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }
}
