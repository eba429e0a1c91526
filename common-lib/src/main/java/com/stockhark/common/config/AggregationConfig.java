package com.stockhark.common.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only parameters of the sentiment aggregation engine.
 *
 * <p>Built once (via {@link #defaults()} or {@link #builder()}) and handed to the
 * aggregator constructor. Nothing mutates it afterwards, so one instance can back any
 * number of concurrent aggregation calls.
 *
 * <p>Both lookup tables must carry a {@value #DEFAULT_KEY} entry, which is the weight
 * for anything the table does not name. Invalid values are rejected here, at
 * construction time, so the aggregator itself never has to throw.
 */
public final class AggregationConfig {

    public static final String DEFAULT_KEY = "default";

    public static final double DEFAULT_DECAY_RATE_PER_HOUR       = 0.1;
    public static final double DEFAULT_POST_DIVERSITY_MULTIPLIER = 0.3;
    public static final double DEFAULT_POST_DIVERSITY_CAP        = 2.0;

    /** Source reliability: meme and speculation communities count for less. */
    public static final Map<String, Double> DEFAULT_SOURCE_WEIGHTS = orderedMap(
        "reddit",                    1.0,
        "reddit/r/investing",        1.0,
        "reddit/r/stocks",           1.0,
        "reddit/r/SecurityAnalysis", 1.0,
        "reddit/r/ValueInvesting",   1.0,
        "reddit/r/wallstreetbets",   0.8,
        "reddit/r/pennystocks",      0.7,
        DEFAULT_KEY,                 1.0
    );

    /** Tickers that are also everyday words are more often false positives. */
    public static final Map<String, Double> DEFAULT_SYMBOL_WEIGHTS = orderedMap(
        "A",    0.3,
        "AI",   0.6,
        "ALL",  0.4,
        "ARE",  0.4,
        "BIG",  0.6,
        "CAN",  0.5,
        "CAT",  0.7,
        "EV",   0.6,
        "FOR",  0.4,
        "FUN",  0.6,
        "GO",   0.5,
        "HAS",  0.6,
        "IT",   0.4,
        "LOW",  0.7,
        "NOW",  0.6,
        "ON",   0.5,
        "ONE",  0.5,
        "OUT",  0.5,
        "REAL", 0.6,
        "SEE",  0.6,
        "SO",   0.5,
        "TWO",  0.6,
        "YOU",  0.5,
        DEFAULT_KEY, 1.0
    );

    private final double decayRatePerHour;
    private final Map<String, Double> sourceWeights;
    private final Map<String, Double> symbolWeights;
    private final double postDiversityMultiplier;
    private final double postDiversityCap;

    private AggregationConfig(Builder b) {
        requireNonNegative("decayRatePerHour", b.decayRatePerHour);
        requireNonNegative("postDiversityMultiplier", b.postDiversityMultiplier);
        if (!Double.isFinite(b.postDiversityCap) || b.postDiversityCap < 1.0) {
            throw new IllegalArgumentException(
                "postDiversityCap must be a finite value >= 1.0, was " + b.postDiversityCap);
        }
        validateTable("sourceWeights", b.sourceWeights, Double.MAX_VALUE);
        validateTable("symbolWeights", b.symbolWeights, 1.0);

        this.decayRatePerHour        = b.decayRatePerHour;
        this.sourceWeights           = Map.copyOf(b.sourceWeights);
        this.symbolWeights           = upperCaseKeys(b.symbolWeights);
        this.postDiversityMultiplier = b.postDiversityMultiplier;
        this.postDiversityCap        = b.postDiversityCap;
    }

    public static AggregationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .decayRatePerHour(decayRatePerHour)
            .sourceWeights(sourceWeights)
            .symbolWeights(symbolWeights)
            .postDiversityMultiplier(postDiversityMultiplier)
            .postDiversityCap(postDiversityCap);
    }

    public double decayRatePerHour()        { return decayRatePerHour; }
    public Map<String, Double> sourceWeights() { return sourceWeights; }
    public Map<String, Double> symbolWeights() { return symbolWeights; }
    public double postDiversityMultiplier() { return postDiversityMultiplier; }
    public double postDiversityCap()        { return postDiversityCap; }

    @Override
    public String toString() {
        return "AggregationConfig{decayRatePerHour=" + decayRatePerHour
            + ", sources=" + sourceWeights.size()
            + ", symbols=" + symbolWeights.size()
            + ", postDiversityMultiplier=" + postDiversityMultiplier
            + ", postDiversityCap=" + postDiversityCap + '}';
    }

    // ── validation ─────────────────────────────────────────────────────────

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be a finite value >= 0, was " + value);
        }
    }

    private static void validateTable(String name, Map<String, Double> table, double max) {
        if (table == null || !table.containsKey(DEFAULT_KEY)) {
            throw new IllegalArgumentException(name + " must contain a '" + DEFAULT_KEY + "' entry");
        }
        table.forEach((key, value) -> {
            if (key == null || value == null || !Double.isFinite(value) || value < 0.0 || value > max) {
                throw new IllegalArgumentException(
                    name + " has an invalid entry: " + key + "=" + value);
            }
        });
    }

    private static Map<String, Double> upperCaseKeys(Map<String, Double> table) {
        Map<String, Double> copy = new LinkedHashMap<>();
        table.forEach((key, value) ->
            copy.put(DEFAULT_KEY.equals(key) ? key : key.toUpperCase(Locale.ROOT), value));
        return Map.copyOf(copy);
    }

    private static Map<String, Double> orderedMap(Object... keyValues) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (Double) keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    // ── builder ────────────────────────────────────────────────────────────

    public static final class Builder {

        private double decayRatePerHour        = DEFAULT_DECAY_RATE_PER_HOUR;
        private Map<String, Double> sourceWeights = DEFAULT_SOURCE_WEIGHTS;
        private Map<String, Double> symbolWeights = DEFAULT_SYMBOL_WEIGHTS;
        private double postDiversityMultiplier = DEFAULT_POST_DIVERSITY_MULTIPLIER;
        private double postDiversityCap        = DEFAULT_POST_DIVERSITY_CAP;

        private Builder() {}

        public Builder decayRatePerHour(double decayRatePerHour) {
            this.decayRatePerHour = decayRatePerHour;
            return this;
        }

        public Builder sourceWeights(Map<String, Double> sourceWeights) {
            this.sourceWeights = sourceWeights;
            return this;
        }

        public Builder symbolWeights(Map<String, Double> symbolWeights) {
            this.symbolWeights = symbolWeights;
            return this;
        }

        public Builder postDiversityMultiplier(double postDiversityMultiplier) {
            this.postDiversityMultiplier = postDiversityMultiplier;
            return this;
        }

        public Builder postDiversityCap(double postDiversityCap) {
            this.postDiversityCap = postDiversityCap;
            return this;
        }

        public AggregationConfig build() {
            return new AggregationConfig(this);
        }
    }
}
