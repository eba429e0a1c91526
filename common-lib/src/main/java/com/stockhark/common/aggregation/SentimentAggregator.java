package com.stockhark.common.aggregation;

import com.stockhark.common.config.AggregationConfig;
import com.stockhark.common.model.AggregationDiagnostics;
import com.stockhark.common.model.AggregationDiagnostics.ObservationBreakdown;
import com.stockhark.common.model.AggregationResult;
import com.stockhark.common.model.Observation;
import com.stockhark.common.model.SentimentLabel;
import com.stockhark.common.weight.PostDiversityWeight;
import com.stockhark.common.weight.SourceReliabilityWeight;
import com.stockhark.common.weight.SymbolAmbiguityWeight;
import com.stockhark.common.weight.TemporalDecayWeight;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combines the observations of one symbol into a single bounded sentiment, a label
 * and a confidence.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Count unique posts (distinct non-null {@code postId}s, plus one for each
 *       observation without an id) and compute the post-diversity weight once for the batch.</li>
 *   <li>Per observation: {@code combined = decay × source × symbol × diversity}.</li>
 *   <li>{@code weightedAverage = Σ(raw × combined) / Σ(combined)}, or 0.0 when the
 *       weight total is not positive (every weight underflowed).</li>
 *   <li>{@code finalSentiment = clamp(weightedAverage, −1, 1)}, labelled by
 *       {@link SentimentLabel#classify(double)}.</li>
 *   <li>Confidence via {@link ConfidenceEstimator}.</li>
 * </ol>
 *
 * <p>Observations are summed in a canonical order, so any permutation of the input
 * produces a bit-identical result. The reference time is read from the injected
 * {@link Clock} once per call.
 *
 * <p>Stateless after construction and thread-safe. Never throws for a well-formed
 * list; {@code rawSentiment} values are trusted, not re-validated.
 */
public final class SentimentAggregator {

    private static final int DIAGNOSTIC_TEXT_LIMIT = 100;

    private static final Comparator<Observation> CANONICAL_ORDER =
        Comparator.comparing(Observation::symbol)
            .thenComparing(Observation::timestamp)
            .thenComparing(Observation::source)
            .thenComparingDouble(Observation::rawSentiment)
            .thenComparing(Observation::postId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Observation::text);

    private final AggregationConfig config;
    private final Clock clock;

    private final TemporalDecayWeight decayWeight;
    private final SourceReliabilityWeight sourceWeight;
    private final SymbolAmbiguityWeight symbolWeight;
    private final PostDiversityWeight postDiversityWeight;

    public SentimentAggregator(AggregationConfig config, Clock clock) {
        this.config              = Objects.requireNonNull(config, "config");
        this.clock               = Objects.requireNonNull(clock, "clock");
        this.decayWeight         = new TemporalDecayWeight(config.decayRatePerHour());
        this.sourceWeight        = new SourceReliabilityWeight(config.sourceWeights());
        this.symbolWeight        = new SymbolAmbiguityWeight(config.symbolWeights());
        this.postDiversityWeight = new PostDiversityWeight(config.postDiversityMultiplier(),
                                                           config.postDiversityCap());
    }

    public SentimentAggregator(AggregationConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public AggregationResult aggregate(List<Observation> observations) {
        return aggregate(null, observations, false);
    }

    public AggregationResult aggregate(List<Observation> observations, boolean includeDiagnostics) {
        return aggregate(null, observations, includeDiagnostics);
    }

    /**
     * Same as {@link #aggregate(List)}, but an empty list yields a result carrying
     * {@code symbol} instead of {@link AggregationResult#UNKNOWN_SYMBOL}.
     */
    public AggregationResult aggregate(String symbol, List<Observation> observations) {
        return aggregate(symbol, observations, false);
    }

    /**
     * @param symbol             symbol for the empty-input result; {@code null} means
     *                           "take it from the first observation"
     * @param observations       observations sharing one symbol (not re-checked)
     * @param includeDiagnostics whether to attach an {@link AggregationDiagnostics}
     * @return the aggregated result, never {@code null}
     */
    public AggregationResult aggregate(String symbol, List<Observation> observations,
                                       boolean includeDiagnostics) {
        if (observations == null || observations.isEmpty()) {
            return AggregationResult.empty(symbol);
        }

        List<Observation> ordered = new ArrayList<>(observations);
        ordered.sort(CANONICAL_ORDER);

        String resolvedSymbol = symbol != null ? symbol : ordered.get(0).symbol();
        LocalDateTime reference = LocalDateTime.now(clock);

        int uniquePosts = uniquePostCount(ordered);
        double diversity = postDiversityWeight.weight(uniquePosts);

        double weightedSum = 0.0;
        double weightTotal = 0.0;
        List<Double> rawSentiments = new ArrayList<>(ordered.size());
        List<ObservationBreakdown> breakdown = includeDiagnostics ? new ArrayList<>() : null;

        for (Observation o : ordered) {
            double decay     = decayWeight.weight(o.timestamp(), reference);
            double source    = sourceWeight.weight(o.source());
            double ambiguity = symbolWeight.weight(resolvedSymbol);
            double combined  = decay * source * ambiguity * diversity;
            double contribution = o.rawSentiment() * combined;

            weightedSum += contribution;
            weightTotal += combined;
            rawSentiments.add(o.rawSentiment());

            if (breakdown != null) {
                breakdown.add(new ObservationBreakdown(
                    truncate(o.text()),
                    o.rawSentiment(),
                    round(TemporalDecayWeight.hoursElapsed(o.timestamp(), reference), 1),
                    round(decay, 4),
                    o.source(),
                    round(source, 4),
                    round(ambiguity, 4),
                    round(diversity, 4),
                    uniquePosts,
                    round(combined, 4),
                    round(contribution, 4)));
            }
        }

        double weightedAverage = weightTotal > 0.0 ? weightedSum / weightTotal : 0.0;
        double finalSentiment  = Math.max(-1.0, Math.min(1.0, weightedAverage));
        double confidence      = ConfidenceEstimator.estimate(rawSentiments, weightTotal);

        AggregationDiagnostics diagnostics = breakdown == null ? null
            : new AggregationDiagnostics(
                breakdown,
                round(weightedSum, 4),
                round(weightTotal, 4),
                round(weightedAverage, 4),
                round(finalSentiment, 4),
                config.decayRatePerHour());

        return new AggregationResult(
            resolvedSymbol,
            finalSentiment,
            SentimentLabel.classify(finalSentiment),
            confidence,
            ordered.size(),
            diagnostics);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /**
     * Distinct post ids plus one per observation without an id. An id-less observation
     * cannot be matched to any other, so {@code [p1, p1, none]} counts two posts.
     */
    static int uniquePostCount(List<Observation> observations) {
        Set<String> postIds = new HashSet<>();
        int anonymous = 0;
        for (Observation o : observations) {
            if (o.hasPostId()) {
                postIds.add(o.postId());
            } else {
                anonymous++;
            }
        }
        return postIds.size() + anonymous;
    }

    private static String truncate(String text) {
        return text.length() > DIAGNOSTIC_TEXT_LIMIT
            ? text.substring(0, DIAGNOSTIC_TEXT_LIMIT) + "..."
            : text;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
