package com.stockhark.sentiment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Activity breakdown for one symbol inside the aggregation window: the newest mentions,
 * the busiest sources and mention counts per hour over the last day.
 */
public record StockDetailsDTO(
    @JsonProperty("recentMentions") List<Mention> recentMentions,
    @JsonProperty("topSources") List<SourceActivity> topSources,
    @JsonProperty("hourlyActivity") List<HourlyActivity> hourlyActivity
) {
    public StockDetailsDTO {
        recentMentions = List.copyOf(recentMentions);
        topSources     = List.copyOf(topSources);
        hourlyActivity = List.copyOf(hourlyActivity);
    }

    /** {@code postUrl} is null when the source has no known link format. */
    public record Mention(
        @JsonProperty("observedAt") LocalDateTime observedAt,
        @JsonProperty("sentiment") double sentiment,
        @JsonProperty("sentimentLabel") String sentimentLabel,
        @JsonProperty("source") String source,
        @JsonProperty("postUrl") String postUrl
    ) {}

    public record SourceActivity(
        @JsonProperty("source") String source,
        @JsonProperty("mentions") long mentions,
        @JsonProperty("avgSentiment") double avgSentiment
    ) {}

    /** {@code hour} is truncated to the start of the hour. */
    public record HourlyActivity(
        @JsonProperty("hour") LocalDateTime hour,
        @JsonProperty("mentions") long mentions,
        @JsonProperty("avgSentiment") double avgSentiment
    ) {}
}
