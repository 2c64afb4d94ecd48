package com.order.consolidation.similarity;

/**
 * Scores how closely a customer's product mention resembles a catalog text
 * (name, alias, brand or training phrase).
 *
 * <p>Callers pass text already normalized by {@code TextNormalizer}; implementations compare
 * the strings as given. Scores run from 0.0 for nothing in common to 1.0 for identical text,
 * and the matching tiers compare them against fixed thresholds.</p>
 */
public interface SimilarityAlgorithm {

    /**
     * @param mention the customer's normalized wording
     * @param target  the normalized catalog text
     * @return a score in [0.0, 1.0]
     */
    double compute(String mention, String target);

    /**
     * Short identifier used in logs and test names.
     */
    String getName();
}
