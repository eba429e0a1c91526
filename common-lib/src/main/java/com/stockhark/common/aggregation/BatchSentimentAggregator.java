package com.stockhark.common.aggregation;

import com.stockhark.common.model.AggregationResult;
import com.stockhark.common.model.Observation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups a mixed list of observations by symbol and aggregates each group with a
 * {@link SentimentAggregator}.
 *
 * <p>The result has exactly one entry per symbol present in the input, and each entry
 * equals {@code aggregator.aggregate(sublistForThatSymbol)}. Entries are ordered by
 * symbol. Thread-safe: holds only the (immutable) delegate.
 */
public final class BatchSentimentAggregator {

    private final SentimentAggregator aggregator;

    public BatchSentimentAggregator(SentimentAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    }

    public Map<String, AggregationResult> aggregateMany(List<Observation> observations) {
        return aggregateMany(observations, false);
    }

    public Map<String, AggregationResult> aggregateMany(List<Observation> observations,
                                                        boolean includeDiagnostics) {
        if (observations == null || observations.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, List<Observation>> bySymbol = groupBySymbol(observations);

        Map<String, AggregationResult> results = new TreeMap<>();
        bySymbol.forEach((symbol, group) ->
            results.put(symbol, aggregator.aggregate(symbol, group, includeDiagnostics)));
        return Collections.unmodifiableMap(results);
    }

    static Map<String, List<Observation>> groupBySymbol(List<Observation> observations) {
        Map<String, List<Observation>> bySymbol = new TreeMap<>();
        for (Observation o : observations) {
            bySymbol.computeIfAbsent(o.symbol(), k -> new ArrayList<>()).add(o);
        }
        return bySymbol;
    }
}
