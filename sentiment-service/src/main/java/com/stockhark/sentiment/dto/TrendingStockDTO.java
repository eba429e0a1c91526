package com.stockhark.sentiment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mention velocity for one symbol over the trending look-back.
 *
 * <p>{@code trendRatio} compares mentions in the newer half of the look-back with the
 * older half; {@code trending} is set above 1.5.
 */
public record TrendingStockDTO(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("totalMentions") long totalMentions,
    @JsonProperty("avgSentiment") double avgSentiment,
    @JsonProperty("mentionVelocity") double mentionVelocity,
    @JsonProperty("trendRatio") double trendRatio,
    @JsonProperty("trending") boolean trending
) {}
