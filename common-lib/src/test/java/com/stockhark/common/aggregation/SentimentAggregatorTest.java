package com.stockhark.common.aggregation;

import com.stockhark.common.config.AggregationConfig;
import com.stockhark.common.model.AggregationDiagnostics;
import com.stockhark.common.model.AggregationResult;
import com.stockhark.common.model.Observation;
import com.stockhark.common.model.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SentimentAggregator}.
 * The clock is pinned so decay weights are exact.
 */
class SentimentAggregatorTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-03-14T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);
    private static final Clock CLOCK = Clock.fixed(NOW_INSTANT, ZoneOffset.UTC);

    private static final double EPS = 1e-9;

    private final SentimentAggregator aggregator =
        new SentimentAggregator(AggregationConfig.defaults(), CLOCK);

    private static Observation obs(String symbol, double raw, double ageHours, String source, String postId) {
        LocalDateTime ts = NOW.minusSeconds(Math.round(ageHours * 3600));
        return Observation.of(symbol, raw, ts, source, "post about " + symbol, postId);
    }

    // ── empty input ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("empty input")
    class EmptyInput {

        @Test
        @DisplayName("aggregate([]) → neutral placeholder with zero confidence")
        void emptyList_returnsNeutral() {
            AggregationResult r = aggregator.aggregate(List.of());

            assertEquals(0.0, r.finalSentiment());
            assertEquals(SentimentLabel.NEUTRAL, r.sentimentLabel());
            assertEquals(0.0, r.confidence());
            assertEquals(0, r.totalObservations());
            assertEquals(AggregationResult.UNKNOWN_SYMBOL, r.symbol());
            assertNull(r.diagnostics());
        }

        @Test
        @DisplayName("null list is treated as empty")
        void nullList_returnsNeutral() {
            assertEquals(0, aggregator.aggregate(null).totalObservations());
        }

        @Test
        @DisplayName("explicit symbol replaces the UNKNOWN placeholder")
        void explicitSymbol_isKept() {
            AggregationResult r = aggregator.aggregate("TSLA", List.of());
            assertEquals("TSLA", r.symbol());
            assertEquals(0, r.totalObservations());
        }
    }

    // ── reference scenario ──────────────────────────────────────────────────

    @Nested
    @DisplayName("AAPL two-observation scenario")
    class Scenario {

        private final List<Observation> observations = List.of(
            obs("AAPL",  0.5,  0, "reddit/r/stocks",         "p1"),
            obs("AAPL", -0.2, 48, "reddit/r/wallstreetbets", "p2"));

        @Test
        @DisplayName("fresh bullish post dominates a two-day-old bearish one")
        void finalSentimentAndLabel() {
            AggregationResult r = aggregator.aggregate(observations);

            assertEquals("AAPL", r.symbol());
            assertEquals(0.495, r.finalSentiment(), 0.001);
            assertEquals(SentimentLabel.STRONG_BULLISH, r.sentimentLabel());
            assertEquals(2, r.totalObservations());
        }

        @Test
        @DisplayName("confidence ≈ 0.65")
        void confidence() {
            assertEquals(0.65, aggregator.aggregate(observations).confidence(), 0.01);
        }

        @Test
        @DisplayName("diagnostics expose each weight factor")
        void diagnosticsBreakdown() {
            AggregationResult r = aggregator.aggregate(observations, true);
            AggregationDiagnostics d = r.diagnostics();

            assertNotNull(d);
            assertEquals(2, d.observations().size());
            assertEquals(0.1, d.decayRatePerHour());

            // canonical order is oldest first
            AggregationDiagnostics.ObservationBreakdown old = d.observations().get(0);
            assertEquals(48.0, old.hoursElapsed());
            assertEquals(0.0082, old.decayWeight(), 1e-4);
            assertEquals(0.8, old.sourceWeight());
            assertEquals(1.0, old.symbolWeight());
            assertEquals(1.2079, old.postDiversityWeight(), 1e-4);
            assertEquals(2, old.uniquePosts());
            assertEquals(0.0080, old.combinedWeight(), 1e-4);

            AggregationDiagnostics.ObservationBreakdown fresh = d.observations().get(1);
            assertEquals(1.0, fresh.decayWeight());
            assertEquals(1.2079, fresh.combinedWeight(), 1e-4);

            assertEquals(1.2159, d.weightTotal(), 1e-4);
            assertEquals(0.4954, d.finalSentimentAfterClamp(), 1e-4);
        }

        @Test
        @DisplayName("diagnostics absent unless requested")
        void diagnosticsOffByDefault() {
            assertFalse(aggregator.aggregate(observations).hasDiagnostics());
        }
    }

    // ── algebraic properties ────────────────────────────────────────────────

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("single observation → final sentiment equals its raw sentiment")
        void singleObservationIdentity() {
            for (double raw : new double[] {-1.0, -0.73, -0.1, 0.0, 0.25, 0.9999, 1.0}) {
                for (String source : List.of("reddit/r/pennystocks", "twitter", "reddit/r/stocks")) {
                    AggregationResult r = aggregator.aggregate(List.of(obs("IT", raw, 17.5, source, null)));
                    assertEquals(raw, r.finalSentiment(), EPS, "raw=" + raw + " source=" + source);
                    assertEquals(1, r.totalObservations());
                }
            }
        }

        @Test
        @DisplayName("randomly generated lists stay within output bounds")
        void outputBounds() {
            Random random = new Random(42);
            List<String> sources = List.of("reddit", "reddit/r/wallstreetbets", "reddit/r/Stocks",
                                           "news/bloomberg", "");
            for (int run = 0; run < 500; run++) {
                List<Observation> list = randomObservations(random, "NVDA", random.nextInt(25), sources);
                AggregationResult r = aggregator.aggregate(list);

                assertTrue(r.finalSentiment() >= -1.0 && r.finalSentiment() <= 1.0, "sentiment " + r);
                assertTrue(r.confidence() >= 0.0 && r.confidence() <= 1.0, "confidence " + r);
                assertEquals(list.size(), r.totalObservations());
            }
        }

        @Test
        @DisplayName("permuting the input does not change the result")
        void orderIndependence() {
            Random random = new Random(7);
            List<String> sources = List.of("reddit/r/investing", "reddit/r/pennystocks", "forum/x");
            for (int run = 0; run < 100; run++) {
                List<Observation> list = randomObservations(random, "AMD", 1 + random.nextInt(15), sources);
                AggregationResult expected = aggregator.aggregate(list, true);

                List<Observation> shuffled = new ArrayList<>(list);
                Collections.shuffle(shuffled, random);
                assertEquals(expected, aggregator.aggregate(shuffled, true));

                Collections.reverse(shuffled);
                assertEquals(expected, aggregator.aggregate(shuffled, true));
            }
        }

        @Test
        @DisplayName("the more recent of two otherwise identical observations has more influence")
        void decayMonotonicity() {
            AggregationResult recentBull = aggregator.aggregate(List.of(
                obs("MSFT",  1.0, 1, "reddit/r/stocks", null),
                obs("MSFT", -1.0, 10, "reddit/r/stocks", null)));
            AggregationResult recentBear = aggregator.aggregate(List.of(
                obs("MSFT",  1.0, 10, "reddit/r/stocks", null),
                obs("MSFT", -1.0, 1, "reddit/r/stocks", null)));

            assertTrue(recentBull.finalSentiment() > 0.0);
            assertTrue(recentBear.finalSentiment() < 0.0);
            assertEquals(recentBull.finalSentiment(), -recentBear.finalSentiment(), EPS);
        }

        @Test
        @DisplayName("same raw and weights at equal age cancel out")
        void equalAgeCancels() {
            AggregationResult r = aggregator.aggregate(List.of(
                obs("MSFT",  0.6, 5, "reddit/r/stocks", "a"),
                obs("MSFT", -0.6, 5, "reddit/r/stocks", "b")));
            assertEquals(0.0, r.finalSentiment(), EPS);
            assertEquals(SentimentLabel.NEUTRAL, r.sentimentLabel());
        }

        @Test
        @DisplayName("future-dated observations are not boosted beyond weight 1.0")
        void futureTimestamp_clampedToZeroAge() {
            AggregationResult r = aggregator.aggregate(List.of(obs("AAPL", 0.4, -5, "reddit", null)), true);
            assertEquals(0.0, r.diagnostics().observations().get(0).hoursElapsed());
            assertEquals(1.0, r.diagnostics().observations().get(0).decayWeight());
        }
    }

    // ── degenerate weights ──────────────────────────────────────────────────

    @Nested
    @DisplayName("degenerate weights")
    class DegenerateWeights {

        @Test
        @DisplayName("zero total weight → neutral sentiment, not a fault")
        void zeroWeightTotal() {
            AggregationConfig zeroSymbol = AggregationConfig.builder()
                .symbolWeights(Map.of("default", 1.0, "GME", 0.0))
                .build();
            SentimentAggregator agg = new SentimentAggregator(zeroSymbol, CLOCK);

            AggregationResult r = agg.aggregate(List.of(
                obs("GME", 0.9, 0, "reddit", null),
                obs("GME", 0.8, 1, "reddit", null)));

            assertEquals(0.0, r.finalSentiment());
            assertEquals(SentimentLabel.NEUTRAL, r.sentimentLabel());
            assertEquals(2, r.totalObservations());
            assertTrue(r.confidence() > 0.0, "consensus and sample still contribute");
        }

        @Test
        @DisplayName("extremely old observations underflow without faulting")
        void underflowedDecay() {
            AggregationResult r = aggregator.aggregate(List.of(
                obs("AAPL", 0.9, 1_000_000, "reddit", null)));
            assertEquals(0.0, r.finalSentiment());
            assertTrue(r.confidence() >= 0.0 && r.confidence() <= 1.0);
        }
    }

    // ── timestamp normalisation ─────────────────────────────────────────────

    @Nested
    @DisplayName("timestamp normalisation")
    class Timestamps {

        @Test
        @DisplayName("zone offset is discarded, not converted")
        void offsetDiscarded() {
            OffsetDateTime zoned = OffsetDateTime.of(NOW.minusHours(2), ZoneOffset.ofHours(9));
            Observation o = Observation.of("AAPL", 0.3, zoned, "reddit", "t", null);

            assertEquals(NOW.minusHours(2), o.timestamp());

            AggregationResult r = aggregator.aggregate(List.of(o), true);
            assertEquals(2.0, r.diagnostics().observations().get(0).hoursElapsed());
        }
    }

    // ── post diversity ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("unique post counting")
    class UniquePosts {

        @Test
        @DisplayName("distinct post ids are counted once each")
        void distinctPostIds() {
            List<Observation> list = List.of(
                obs("AAPL", 0.1, 0, "reddit", "p1"),
                obs("AAPL", 0.2, 0, "reddit", "p1"),
                obs("AAPL", 0.3, 0, "reddit", "p2"));
            assertEquals(2, SentimentAggregator.uniquePostCount(list));
        }

        @Test
        @DisplayName("without post ids each observation counts as its own post")
        void noPostIds() {
            List<Observation> list = List.of(
                obs("AAPL", 0.1, 0, "reddit", null),
                obs("AAPL", 0.2, 0, "reddit", " "),
                obs("AAPL", 0.3, 0, "reddit", null));
            assertEquals(3, SentimentAggregator.uniquePostCount(list));
        }

        @Test
        @DisplayName("an observation without an id adds its own post to the distinct ids")
        void mixedPostIds() {
            List<Observation> list = List.of(
                obs("AAPL", 0.1, 0, "reddit", "p1"),
                obs("AAPL", 0.2, 0, "reddit", "p1"),
                obs("AAPL", 0.3, 0, "reddit", null));
            assertEquals(2, SentimentAggregator.uniquePostCount(list));
            assertEquals(2, aggregator.aggregate(list, true).diagnostics().observations().get(0).uniquePosts());
        }
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static List<Observation> randomObservations(Random random, String symbol, int n, List<String> sources) {
        List<Observation> list = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double raw = random.nextDouble() * 2.0 - 1.0;
            double age = random.nextDouble() * 200.0;
            String source = sources.get(random.nextInt(sources.size()));
            String postId = random.nextBoolean() ? "post-" + random.nextInt(6) : null;
            list.add(obs(symbol, raw, age, source, postId));
        }
        return list;
    }
}
