package com.order.consolidation.cache;

import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.rules.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("NormalizedCatalogCache Tests")
class NormalizedCatalogCacheTest {

    private static final CatalogEntry COCA = CatalogEntry.builder()
            .id("COCA")
            .name("Coca Cola 600ml")
            .brand("Coca-Cola")
            .aliases("Cocas", "Coca")
            .keywords("Refresco")
            .misspellings("koka")
            .trainingPhrases("Una coca de la fría")
            .build();

    @Test
    @DisplayName("Normalized forms cover name, aliases and brand")
    void normalizesEntry() {
        NormalizedCatalogCache cache = new NormalizedCatalogCache(new TextNormalizer());

        NormalizedEntry entry = cache.get(COCA);

        assertEquals("coca cola 600ml", entry.name());
        assertEquals(List.of("cocas", "coca"), entry.aliases());
        assertEquals(List.of("refresco"), entry.keywords());
        assertEquals(List.of("koka"), entry.misspellings());
        assertEquals(List.of("coca cola 600ml", "cocas", "coca", "coca-cola"), entry.fuzzyTargets());
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Caching behaviour")
    class CachingTests {

        @Mock
        private MetricsService metricsService;

        @Test
        @DisplayName("Second lookup is a hit")
        void secondLookupHits() {
            NormalizedCatalogCache cache = new NormalizedCatalogCache(new TextNormalizer(),
                    CacheConfig.defaults(), metricsService);

            NormalizedEntry first = cache.get(COCA);
            NormalizedEntry second = cache.get(COCA);

            assertSame(first, second);
            verify(metricsService).recordCacheMiss();
            verify(metricsService).recordCacheHit();
            assertEquals(1, cache.estimatedSize());
        }

        @Test
        @DisplayName("Invalidation forces recomputation")
        void invalidateAll() {
            NormalizedCatalogCache cache = new NormalizedCatalogCache(new TextNormalizer(),
                    CacheConfig.defaults(), metricsService);
            cache.get(COCA);

            cache.invalidateAll();
            cache.get(COCA);

            verify(metricsService, times(2)).recordCacheMiss();
            verify(metricsService, never()).recordCacheHit();
        }

        @Test
        @DisplayName("Disabled cache computes every time without metrics")
        void disabledCache() {
            NormalizedCatalogCache cache = new NormalizedCatalogCache(new TextNormalizer(),
                    CacheConfig.disabled(), metricsService);

            assertEquals(cache.get(COCA), cache.get(COCA));
            assertEquals(0, cache.estimatedSize());
            verifyNoInteractions(metricsService);
        }
    }

    @Test
    @DisplayName("CacheConfig rejects non-positive sizes and expiries")
    void cacheConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofMinutes(1), true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
        assertThrows(NullPointerException.class, () -> new CacheConfig(10, null, true));
    }

    @Test
    @DisplayName("Default config caches ten thousand products for ten idle minutes")
    void cacheConfigDefaults() {
        CacheConfig defaults = CacheConfig.defaults();

        assertEquals(10_000, defaults.maxEntries());
        assertEquals(Duration.ofMinutes(10), defaults.expireAfterAccess());
        assertTrue(defaults.enabled());
        assertFalse(CacheConfig.disabled().enabled());
    }
}
