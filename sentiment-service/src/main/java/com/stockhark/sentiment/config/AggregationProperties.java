package com.stockhark.sentiment.config;

import com.stockhark.common.config.AggregationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Binds {@code stockhark.aggregation.*}. Every field is optional: anything left
 * unset keeps the engine default from {@link AggregationConfig}.
 *
 * <p>Source keys containing {@code /} must be bracketed in YAML
 * ({@code "[reddit/r/wallstreetbets]": 0.8}) to survive relaxed binding.
 */
@ConfigurationProperties(prefix = "stockhark.aggregation")
public record AggregationProperties(
    Double decayRatePerHour,
    Map<String, Double> sourceWeights,
    Map<String, Double> symbolWeights,
    Double postDiversityMultiplier,
    Double postDiversityCap
) {

    /** @throws IllegalArgumentException when the bound values are invalid */
    public AggregationConfig toConfig() {
        AggregationConfig.Builder builder = AggregationConfig.builder();
        if (decayRatePerHour != null)        builder.decayRatePerHour(decayRatePerHour);
        if (sourceWeights != null && !sourceWeights.isEmpty()) builder.sourceWeights(sourceWeights);
        if (symbolWeights != null && !symbolWeights.isEmpty()) builder.symbolWeights(symbolWeights);
        if (postDiversityMultiplier != null) builder.postDiversityMultiplier(postDiversityMultiplier);
        if (postDiversityCap != null)        builder.postDiversityCap(postDiversityCap);
        return builder.build();
    }
}
