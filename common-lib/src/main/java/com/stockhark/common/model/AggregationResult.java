package com.stockhark.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable output of one single-symbol aggregation.
 *
 * <p>Invariants: {@code finalSentiment} in [-1.0, 1.0], {@code confidence} in [0.0, 1.0].
 * {@code diagnostics} is {@code null} unless explicitly requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationResult(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("finalSentiment") double finalSentiment,
    @JsonProperty("sentimentLabel") SentimentLabel sentimentLabel,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("totalObservations") int totalObservations,
    @JsonProperty("diagnostics") AggregationDiagnostics diagnostics
) {
    public static final String UNKNOWN_SYMBOL = "UNKNOWN";

    public static AggregationResult empty(String symbol) {
        return new AggregationResult(symbol != null ? symbol : UNKNOWN_SYMBOL,
                                     0.0, SentimentLabel.NEUTRAL, 0.0, 0, null);
    }

    public boolean hasDiagnostics() {
        return diagnostics != null;
    }
}
