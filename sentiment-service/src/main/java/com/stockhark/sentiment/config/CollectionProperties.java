package com.stockhark.sentiment.config;

import com.stockhark.common.symbol.SymbolCombinationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Binds {@code stockhark.collection.*}: which communities are polled, how often,
 * how far back the aggregation window reaches, and how long stored rows are kept.
 */
@ConfigurationProperties(prefix = "stockhark.collection")
public record CollectionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("30") long intervalMinutes,
    @DefaultValue("10") long initialDelaySeconds,
    @DefaultValue({"wallstreetbets", "stocks", "investing", "SecurityAnalysis", "ValueInvesting", "pennystocks"})
    List<String> communities,
    @DefaultValue("10") int postsPerCommunity,
    @DefaultValue("720") long windowHours,
    @DefaultValue("UNION") SymbolCombinationMode symbolMode,
    @DefaultValue("30") int retentionDays
) {
    public CollectionProperties {
        if (intervalMinutes < 1) {
            throw new IllegalArgumentException("stockhark.collection.interval-minutes must be >= 1");
        }
        if (windowHours < 1) {
            throw new IllegalArgumentException("stockhark.collection.window-hours must be >= 1");
        }
        if (retentionDays < 1) {
            throw new IllegalArgumentException("stockhark.collection.retention-days must be >= 1");
        }
        communities = communities != null ? List.copyOf(communities) : List.of();
    }
}
