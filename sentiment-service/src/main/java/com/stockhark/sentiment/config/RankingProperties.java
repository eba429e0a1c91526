package com.stockhark.sentiment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds {@code stockhark.ranking.*}: the activity a symbol needs inside the window to be
 * ranked, and the trending look-back.
 */
@ConfigurationProperties(prefix = "stockhark.ranking")
public record RankingProperties(
    @DefaultValue("5") int minMentions,
    @DefaultValue("2") int minUniquePosts,
    @DefaultValue("6") int trendingHours,
    @DefaultValue("3") int trendingMinMentions,
    @DefaultValue("20") int trendingLimit
) {
    public RankingProperties {
        if (minMentions < 1 || minUniquePosts < 1 || trendingMinMentions < 1) {
            throw new IllegalArgumentException("stockhark.ranking minimum counts must be >= 1");
        }
        if (trendingHours < 2) {
            throw new IllegalArgumentException("stockhark.ranking.trending-hours must be >= 2");
        }
        if (trendingLimit < 1) {
            throw new IllegalArgumentException("stockhark.ranking.trending-limit must be >= 1");
        }
    }
}
