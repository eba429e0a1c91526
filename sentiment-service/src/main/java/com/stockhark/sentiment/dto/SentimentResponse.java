package com.stockhark.sentiment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockhark.common.model.AggregationDiagnostics;
import com.stockhark.common.model.AggregationResult;
import com.stockhark.sentiment.model.SentimentSnapshot;

import java.time.LocalDateTime;

/**
 * API view of one symbol's sentiment. Sentiment and confidence are rounded to three
 * decimals; {@code diagnostics} is omitted unless requested and {@code details} is only
 * present on single-symbol lookups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SentimentResponse(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("finalSentiment") double finalSentiment,
    @JsonProperty("sentimentLabel") String sentimentLabel,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("totalObservations") int totalObservations,
    @JsonProperty("aggregatedAt") LocalDateTime aggregatedAt,
    @JsonProperty("diagnostics") AggregationDiagnostics diagnostics,
    @JsonProperty("details") StockDetailsDTO details
) {

    public static SentimentResponse from(AggregationResult result, LocalDateTime aggregatedAt) {
        return new SentimentResponse(
            result.symbol(),
            round3(result.finalSentiment()),
            result.sentimentLabel().displayName(),
            round3(result.confidence()),
            result.totalObservations(),
            aggregatedAt,
            result.diagnostics(),
            null);
    }

    public static SentimentResponse from(SentimentSnapshot snapshot) {
        return new SentimentResponse(
            snapshot.getSymbol(),
            round3(snapshot.getFinalSentiment()),
            snapshot.getSentimentLabel(),
            round3(snapshot.getConfidence()),
            snapshot.getTotalObservations(),
            snapshot.getAggregatedAt(),
            null,
            null);
    }

    public SentimentResponse withDetails(StockDetailsDTO stockDetails) {
        return new SentimentResponse(symbol, finalSentiment, sentimentLabel, confidence,
                                     totalObservations, aggregatedAt, diagnostics, stockDetails);
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
