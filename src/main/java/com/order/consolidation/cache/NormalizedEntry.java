package com.order.consolidation.cache;

import java.util.List;

/**
 * Pre-normalized text forms of one catalog entry.
 *
 * @param name            normalized product name
 * @param aliases         normalized aliases
 * @param misspellings    normalized common misspellings
 * @param keywords        normalized keywords
 * @param trainingPhrases normalized training phrases
 * @param fuzzyTargets    normalized name, aliases and brand, in that order
 */
public record NormalizedEntry(
        String name,
        List<String> aliases,
        List<String> misspellings,
        List<String> keywords,
        List<String> trainingPhrases,
        List<String> fuzzyTargets
) {
    public NormalizedEntry {
        aliases = List.copyOf(aliases);
        misspellings = List.copyOf(misspellings);
        keywords = List.copyOf(keywords);
        trainingPhrases = List.copyOf(trainingPhrases);
        fuzzyTargets = List.copyOf(fuzzyTargets);
    }
}
