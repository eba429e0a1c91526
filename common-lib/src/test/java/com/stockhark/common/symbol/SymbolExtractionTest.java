package com.stockhark.common.symbol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SymbolExtractionTest {

    private static final TickerUniverse UNIVERSE =
        TickerUniverse.of(List.of("AAPL", "TSLA", "AMD", "GME", "NOW", "IT", "ALL", "msft"));

    @Nested
    @DisplayName("TickerSymbolExtractor")
    class BareWords {

        private final TickerSymbolExtractor extractor = new TickerSymbolExtractor(UNIVERSE);

        @Test
        @DisplayName("keeps listed tickers in first-seen order without duplicates")
        void extractsListedTickers() {
            assertEquals(List.of("TSLA", "AAPL", "AMD"),
                extractor.extract("TSLA is ripping, AAPL flat, amd and TSLA again"));
        }

        @Test
        @DisplayName("drops common-word false positives even when listed")
        void dropsFalsePositives() {
            assertEquals(List.of("IT"), extractor.extract("NOW is the time, ALL in on IT"));
        }

        @Test
        @DisplayName("ignores unlisted words and words longer than five letters")
        void ignoresUnlisted() {
            assertTrue(extractor.extract("NVIDIA XYZQ great quarter").isEmpty());
        }

        @Test
        @DisplayName("respects the symbol limit")
        void maxSymbols() {
            TickerSymbolExtractor limited = new TickerSymbolExtractor(UNIVERSE, 2);
            assertEquals(List.of("AAPL", "TSLA"), limited.extract("AAPL TSLA AMD GME"));
        }

        @Test
        @DisplayName("null and empty text → empty list")
        void emptyText() {
            assertTrue(extractor.extract(null).isEmpty());
            assertTrue(extractor.extract("").isEmpty());
        }
    }

    @Nested
    @DisplayName("CashtagSymbolExtractor")
    class Cashtags {

        private final CashtagSymbolExtractor extractor = new CashtagSymbolExtractor(UNIVERSE);

        @Test
        @DisplayName("cashtags bypass the common-word filter")
        void cashtagIntent() {
            assertEquals(List.of("NOW", "MSFT"), extractor.extract("loading $NOW and $msft, skipping $ZZZZ"));
        }

        @Test
        @DisplayName("bare words are ignored")
        void bareWordsIgnored() {
            assertTrue(extractor.extract("AAPL TSLA").isEmpty());
        }
    }

    @Nested
    @DisplayName("SymbolCombinationMode")
    class Modes {

        private final Set<String> primary   = Set.of("AAPL", "TSLA");
        private final Set<String> secondary = Set.of("TSLA", "GME");

        @Test
        void union() {
            assertEquals(Set.of("AAPL", "TSLA", "GME"), SymbolCombinationMode.UNION.combine(primary, secondary));
        }

        @Test
        void intersection() {
            assertEquals(Set.of("TSLA"), SymbolCombinationMode.INTERSECTION.combine(primary, secondary));
        }

        @Test
        @DisplayName("priority override prefers the secondary set and falls back when it is empty")
        void priorityOverride() {
            assertEquals(secondary, SymbolCombinationMode.PRIORITY_OVERRIDE.combine(primary, secondary));
            assertEquals(primary, SymbolCombinationMode.PRIORITY_OVERRIDE.combine(primary, Set.of()));
        }

        @Test
        @DisplayName("inputs are never mutated")
        void pure() {
            Set<String> p = new java.util.HashSet<>(primary);
            SymbolCombinationMode.INTERSECTION.combine(p, secondary);
            assertEquals(primary, p);
        }
    }

    @Nested
    @DisplayName("CombinedSymbolExtractor")
    class Combined {

        @Test
        @DisplayName("union of bare words and cashtags, sorted")
        void unionOfExtractors() {
            CombinedSymbolExtractor combined = new CombinedSymbolExtractor(
                new TickerSymbolExtractor(UNIVERSE), new CashtagSymbolExtractor(UNIVERSE),
                SymbolCombinationMode.UNION);

            assertEquals(List.of("GME", "NOW", "TSLA"), combined.extract("$NOW beats, GME and TSLA"));
        }

        @Test
        @DisplayName("intersection keeps only symbols both extractors agree on")
        void intersectionOfExtractors() {
            CombinedSymbolExtractor combined = new CombinedSymbolExtractor(
                new TickerSymbolExtractor(UNIVERSE), new CashtagSymbolExtractor(UNIVERSE),
                SymbolCombinationMode.INTERSECTION);

            assertEquals(List.of("AMD"), combined.extract("$AMD and AMD, plus $NOW and GME"));
        }
    }

    @Nested
    @DisplayName("TickerUniverse")
    class Universe {

        @Test
        @DisplayName("loads the bundled ticker lists")
        void loadDefault() {
            TickerUniverse universe = TickerUniverse.loadDefault(new ObjectMapper());
            assertTrue(universe.contains("AAPL"));
            assertTrue(universe.contains("gld"));
            assertTrue(universe.size() > 100);
        }

        @Test
        @DisplayName("missing resources degrade to an empty universe")
        void missingResource() {
            TickerUniverse universe = TickerUniverse.load(new ObjectMapper(), List.of("tickers/none.json"));
            assertEquals(0, universe.size());
            assertFalse(universe.contains("AAPL"));
        }
    }
}
