package com.stockhark.sentiment.model;

import com.stockhark.common.model.AggregationResult;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Per-symbol aggregation result written at the end of every collection cycle.
 * The newest row per symbol backs the ranking endpoint.
 *
 * sentimentLabel holds the display name ("Strong Bullish", ...).
 */
@Data
@NoArgsConstructor
@Table("sentiment_snapshot")
public class SentimentSnapshot {

    @Id
    private Long id;

    private String symbol;

    private double finalSentiment;

    private String sentimentLabel;

    private double confidence;

    private int totalObservations;

    private LocalDateTime aggregatedAt;

    public static SentimentSnapshot from(AggregationResult result, LocalDateTime aggregatedAt) {
        SentimentSnapshot s = new SentimentSnapshot();
        s.setSymbol(result.symbol());
        s.setFinalSentiment(result.finalSentiment());
        s.setSentimentLabel(result.sentimentLabel().displayName());
        s.setConfidence(result.confidence());
        s.setTotalObservations(result.totalObservations());
        s.setAggregatedAt(aggregatedAt);
        return s;
    }
}
