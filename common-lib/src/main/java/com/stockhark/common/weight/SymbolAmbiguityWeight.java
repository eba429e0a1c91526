package com.stockhark.common.weight;

import com.stockhark.common.config.AggregationConfig;

import java.util.Locale;
import java.util.Map;

/**
 * Penalty in [0.0, 1.0] for tickers that double as common words ({@code IT}, {@code ALL}).
 * Symbols the table does not name get its {@code default} entry.
 */
public final class SymbolAmbiguityWeight {

    private final Map<String, Double> weights;
    private final double defaultWeight;

    public SymbolAmbiguityWeight(Map<String, Double> weights) {
        this.weights       = Map.copyOf(weights);
        this.defaultWeight = weights.getOrDefault(AggregationConfig.DEFAULT_KEY, 1.0);
    }

    public double weight(String symbol) {
        if (symbol == null) return defaultWeight;
        return weights.getOrDefault(symbol.toUpperCase(Locale.ROOT), defaultWeight);
    }
}
