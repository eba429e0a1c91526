package com.stockhark.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured breakdown of one aggregation run. Values are rounded for display;
 * they are never fed back into arithmetic.
 */
public record AggregationDiagnostics(
    @JsonProperty("observations") List<ObservationBreakdown> observations,
    @JsonProperty("weightedSum") double weightedSum,
    @JsonProperty("weightTotal") double weightTotal,
    @JsonProperty("weightedAverageBeforeClamp") double weightedAverageBeforeClamp,
    @JsonProperty("finalSentimentAfterClamp") double finalSentimentAfterClamp,
    @JsonProperty("decayRatePerHour") double decayRatePerHour
) {
    public AggregationDiagnostics {
        observations = List.copyOf(observations);
    }

    /** Per-observation weight breakdown. */
    public record ObservationBreakdown(
        @JsonProperty("text") String text,
        @JsonProperty("rawSentiment") double rawSentiment,
        @JsonProperty("hoursElapsed") double hoursElapsed,
        @JsonProperty("decayWeight") double decayWeight,
        @JsonProperty("source") String source,
        @JsonProperty("sourceWeight") double sourceWeight,
        @JsonProperty("symbolWeight") double symbolWeight,
        @JsonProperty("postDiversityWeight") double postDiversityWeight,
        @JsonProperty("uniquePosts") int uniquePosts,
        @JsonProperty("combinedWeight") double combinedWeight,
        @JsonProperty("weightedContribution") double weightedContribution
    ) {}
}
