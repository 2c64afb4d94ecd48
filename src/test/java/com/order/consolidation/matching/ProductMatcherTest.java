package com.order.consolidation.matching;

import com.order.consolidation.api.EngineOptions;
import com.order.consolidation.core.model.CatalogEntry;
import com.order.consolidation.core.model.ConfidenceLevel;
import com.order.consolidation.core.model.MatchCandidate;
import com.order.consolidation.core.model.MatchResult;
import com.order.consolidation.core.model.MatchType;
import com.order.consolidation.metrics.MetricsService;
import com.order.consolidation.rules.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ProductMatcher Tests")
class ProductMatcherTest {

    private static final CatalogEntry LECHE = CatalogEntry.builder()
            .id("p-leche").name("Leche").price("25.00").category("Lácteos")
            .aliases("leches")
            .build();
    private static final CatalogEntry COCA = CatalogEntry.builder()
            .id("p-coca").name("Coca Cola 600ml").price("18.50").category("Bebidas")
            .aliases("cocas", "coca")
            .keywords("refresco", "soda")
            .build();
    private static final CatalogEntry QUESO_OAXACA = CatalogEntry.builder()
            .id("p-oaxaca").name("Queso Oaxaca").price("120.00").category("Lácteos")
            .misspellings("keso")
            .build();
    private static final CatalogEntry QUESO_PANELA = CatalogEntry.builder()
            .id("p-panela").name("Queso Panela").price("95.00").category("Lácteos")
            .build();
    private static final CatalogEntry FRIJOL = CatalogEntry.builder()
            .id("p-frijol").name("Frijol Negro").price("32.00").category("Granos")
            .trainingPhrases("frijoles para la olla")
            .build();

    private static final List<CatalogEntry> CATALOG = List.of(LECHE, COCA, QUESO_OAXACA, QUESO_PANELA, FRIJOL);

    private ProductMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new ProductMatcher();
    }

    @Nested
    @DisplayName("Match tiers")
    class TierTests {

        @Test
        @DisplayName("Exact normalized name match scores 1.0 and needs no clarification")
        void exactMatch() {
            MatchResult result = matcher.matchProducts("LECHE", CATALOG);

            assertTrue(result.hasMatch());
            assertEquals("p-leche", result.bestMatch().productId());
            assertEquals(MatchType.EXACT, result.bestMatch().matchType());
            assertEquals(1.0, result.bestConfidence());
            assertEquals(ConfidenceLevel.HIGH, result.confidenceLevel());
            assertFalse(result.requiresClarification());
            assertNull(result.suggestedQuestion());
        }

        @Test
        @DisplayName("Alias match scores 0.95")
        void aliasMatch() {
            MatchResult result = matcher.matchProducts("cocas", CATALOG);

            assertEquals("p-coca", result.bestMatch().productId());
            assertEquals(MatchType.ALIAS, result.bestMatch().matchType());
            assertEquals(0.95, result.bestConfidence(), 0.0001);
            assertEquals("cocas", result.bestMatch().matchedText());
        }

        @Test
        @DisplayName("Misspelling match scores 0.90")
        void misspellingMatch() {
            MatchResult result = matcher.matchProducts("keso", CATALOG);

            assertEquals("p-oaxaca", result.bestMatch().productId());
            assertEquals(MatchType.MISSPELLING, result.bestMatch().matchType());
            assertEquals(0.90, result.bestConfidence(), 0.0001);
        }

        @Test
        @DisplayName("Keyword hits add a bonus on top of 0.85")
        void keywordMatch() {
            MatchResult single = matcher.matchProducts("refresco", CATALOG);
            MatchResult double_ = matcher.matchProducts("refresco soda", CATALOG);

            assertEquals(MatchType.KEYWORD, single.bestMatch().matchType());
            assertEquals(0.85, single.bestConfidence(), 0.0001);
            assertEquals(ConfidenceLevel.HIGH, single.confidenceLevel());
            assertEquals(0.95, double_.bestConfidence(), 0.0001);
        }

        @Test
        @DisplayName("Training phrase similar enough to the query scores 0.80 times the similarity")
        void trainingMatch() {
            MatchResult result = matcher.matchProducts("frijoles para olla", CATALOG);

            assertEquals("p-frijol", result.bestMatch().productId());
            assertEquals(MatchType.TRAINING, result.bestMatch().matchType());
            assertEquals(0.80, result.bestConfidence(), 0.0001);
            assertEquals(ConfidenceLevel.MEDIUM, result.confidenceLevel());
            assertTrue(result.requiresClarification());
            assertTrue(result.suggestedQuestion().startsWith("¿Te refieres a Frijol Negro"));
        }

        @Test
        @DisplayName("Close typo falls back to a fuzzy match")
        void fuzzyMatch() {
            MatchResult result = matcher.matchProducts("lechee", CATALOG);

            assertEquals("p-leche", result.bestMatch().productId());
            assertEquals(MatchType.FUZZY_HIGH, result.bestMatch().matchType());
            assertEquals(0.75 * 10.0 / 11.0, result.bestConfidence(), 0.0001);
            assertEquals(ConfidenceLevel.MEDIUM, result.confidenceLevel());
            assertEquals("¿Te refieres a Leche?", result.suggestedQuestion());
        }

        @Test
        @DisplayName("Weak fuzzy matches are LOW and ask about the category")
        void lowMatch() {
            MatchResult result = matcher.matchProducts("quezo", CATALOG);

            assertEquals(ConfidenceLevel.LOW, result.confidenceLevel());
            assertEquals(2, result.candidates().size());
            assertEquals("p-oaxaca", result.bestMatch().productId());
            assertEquals(MatchType.FUZZY_LOW, result.bestMatch().matchType());
            assertEquals("¿Buscas algo específico en lácteos? Tenemos varios productos disponibles.",
                    result.suggestedQuestion());
        }

        @Test
        @DisplayName("Exact match on one entry does not hide weaker matches on others")
        void candidatesRankedByConfidence() {
            MatchResult result = matcher.matchProducts("queso oaxaca", CATALOG);

            assertEquals("p-oaxaca", result.bestMatch().productId());
            List<MatchCandidate> candidates = result.candidates();
            for (int i = 1; i < candidates.size(); i++) {
                assertTrue(candidates.get(i - 1).confidence() >= candidates.get(i).confidence());
            }
        }
    }

    @Nested
    @DisplayName("Degenerate input")
    class DegenerateInputTests {

        @Test
        @DisplayName("Null, blank or unknown queries yield NONE with a question")
        void noMatch() {
            MatchResult blank = matcher.matchProducts("  ", CATALOG);
            MatchResult unknown = matcher.matchProducts("xyzzy", CATALOG);

            assertEquals(ConfidenceLevel.NONE, matcher.matchProducts(null, CATALOG).confidenceLevel());
            assertEquals(ConfidenceLevel.NONE, blank.confidenceLevel());
            assertFalse(unknown.hasMatch());
            assertTrue(unknown.requiresClarification());
            assertEquals("No encontré 'xyzzy' en nuestro catálogo. "
                    + "¿Podrías describir mejor el producto que necesitas?", unknown.suggestedQuestion());
        }

        @Test
        @DisplayName("Empty or null catalogs never throw")
        void emptyCatalog() {
            assertEquals(ConfidenceLevel.NONE, matcher.matchProducts("leche", List.of()).confidenceLevel());
            assertEquals(ConfidenceLevel.NONE, matcher.matchProducts("leche", null).confidenceLevel());
        }

        @Test
        @DisplayName("Inactive and out-of-stock entries are never candidates")
        void unavailableEntriesSkipped() {
            CatalogEntry inactive = CatalogEntry.builder().id("x1").name("Leche").active(false).build();
            CatalogEntry outOfStock = CatalogEntry.builder().id("x2").name("Leche").inStock(false).build();

            assertTrue(matcher.findCandidates("leche", List.of(inactive, outOfStock)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Confidence levels")
    class ConfidenceLevelTests {

        @Test
        @DisplayName("Levels follow the configured thresholds")
        void classifyWithThresholds() {
            assertEquals(ConfidenceLevel.HIGH, matcher.classifyConfidenceLevel(List.of(candidate(0.85))));
            assertEquals(ConfidenceLevel.MEDIUM, matcher.classifyConfidenceLevel(List.of(candidate(0.84))));
            assertEquals(ConfidenceLevel.MEDIUM, matcher.classifyConfidenceLevel(List.of(candidate(0.60))));
            assertEquals(ConfidenceLevel.LOW, matcher.classifyConfidenceLevel(List.of(candidate(0.59))));
            assertEquals(ConfidenceLevel.NONE, matcher.classifyConfidenceLevel(List.of()));
        }

        @Test
        @DisplayName("Custom thresholds change the classification")
        void customThresholds() {
            EngineOptions strict = EngineOptions.builder()
                    .highConfidenceThreshold(0.97)
                    .mediumConfidenceThreshold(0.9)
                    .build();
            ProductMatcher strictMatcher = new ProductMatcher(strict, new TextNormalizer(),
                    mock(MetricsService.class));

            assertEquals(ConfidenceLevel.MEDIUM, strictMatcher.matchProducts("cocas", CATALOG).confidenceLevel());
        }

        private MatchCandidate candidate(double confidence) {
            return new MatchCandidate(LECHE, MatchType.FUZZY_HIGH, confidence, "leche");
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Metrics")
    class MetricsTests {

        @Mock
        private MetricsService metricsService;

        @Test
        @DisplayName("Every match records its confidence level")
        void recordsMatchLevel() {
            ProductMatcher instrumented = new ProductMatcher(EngineOptions.defaults(), new TextNormalizer(),
                    metricsService);

            instrumented.matchProducts("leche", CATALOG);
            instrumented.matchProducts("xyzzy", CATALOG);

            verify(metricsService).recordMatch(ConfidenceLevel.HIGH);
            verify(metricsService).recordMatch(ConfidenceLevel.NONE);
        }
    }
}
