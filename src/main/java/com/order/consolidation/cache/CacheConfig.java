package com.order.consolidation.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the normalized catalog cache.
 *
 * <p>One entry holds the normalized forms of one catalog product, so {@code maxEntries} should
 * cover the products of every distributor served by the engine. Entries idle for longer than
 * {@code expireAfterAccess} are dropped; products that change get a new key anyway.</p>
 *
 * @param maxEntries        maximum number of cached products
 * @param expireAfterAccess idle time after which a product's forms are recomputed
 * @param enabled           whether forms are cached at all
 */
public record CacheConfig(long maxEntries, Duration expireAfterAccess, boolean enabled) {

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        Objects.requireNonNull(expireAfterAccess, "expireAfterAccess is required");
        if (expireAfterAccess.isZero() || expireAfterAccess.isNegative()) {
            throw new IllegalArgumentException("expireAfterAccess must be positive");
        }
    }

    /**
     * 10,000 products kept until idle for 10 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(10), true);
    }

    /**
     * Normalizes every product on every match.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
