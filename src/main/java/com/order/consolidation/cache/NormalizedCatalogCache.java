package com.order.consolidation.cache;

import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.metrics.NoOpMetricsService;
import com.order.consolidation.rules.TextNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Caffeine-backed memo of normalized catalog entry forms.
 * Entries are keyed by the catalog record itself, so any change to a product yields a new key
 * and the stale form simply ages out.
 */
public class NormalizedCatalogCache {
    private static final Logger log = LoggerFactory.getLogger(NormalizedCatalogCache.class);

    private final TextNormalizer normalizer;
    private final Cache<CatalogEntry, NormalizedEntry> cache;
    private final MetricsService metricsService;

    public NormalizedCatalogCache(TextNormalizer normalizer) {
        this(normalizer, CacheConfig.defaults(), new NoOpMetricsService());
    }

    public NormalizedCatalogCache(TextNormalizer normalizer, CacheConfig config, MetricsService metricsService) {
        this.normalizer = normalizer;
        this.metricsService = metricsService;
        if (config.enabled()) {
            this.cache = Caffeine.newBuilder()
                    .maximumSize(config.maxEntries())
                    .expireAfterAccess(config.expireAfterAccess())
                    .recordStats()
                    .build();
            log.info("catalog.cache.initialized maxEntries={} expireAfterAccess={}",
                    config.maxEntries(), config.expireAfterAccess());
        } else {
            this.cache = null;
            log.info("catalog.cache.disabled");
        }
    }

    /**
     * Returns the normalized forms of the given entry, computing them on a miss.
     */
    public NormalizedEntry get(CatalogEntry entry) {
        if (cache == null) {
            return normalize(entry);
        }
        NormalizedEntry cached = cache.getIfPresent(entry);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        return cache.get(entry, this::normalize);
    }

    public void invalidateAll() {
        if (cache != null) {
            cache.invalidateAll();
            log.debug("catalog.cache.invalidated");
        }
    }

    /**
     * Approximate number of cached entries; zero when caching is disabled.
     */
    public long estimatedSize() {
        return cache != null ? cache.estimatedSize() : 0;
    }

    private NormalizedEntry normalize(CatalogEntry entry) {
        List<String> aliases = normalizeAll(entry.aliases());
        List<String> fuzzyTargets = new ArrayList<>();
        fuzzyTargets.add(normalizer.normalize(entry.name()));
        fuzzyTargets.addAll(aliases);
        if (entry.brand() != null && !entry.brand().isBlank()) {
            fuzzyTargets.add(normalizer.normalize(entry.brand()));
        }
        return new NormalizedEntry(
                normalizer.normalize(entry.name()),
                aliases,
                normalizeAll(entry.misspellings()),
                normalizeAll(entry.keywords()),
                normalizeAll(entry.trainingPhrases()),
                fuzzyTargets
        );
    }

    private List<String> normalizeAll(List<String> values) {
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(normalizer.normalize(value));
        }
        return result;
    }
}
