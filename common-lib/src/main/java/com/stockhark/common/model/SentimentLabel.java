package com.stockhark.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categorical reading of an aggregated sentiment value.
 *
 * <pre>
 *   sentiment &gt;=  0.3  → STRONG_BULLISH
 *   sentiment &gt;=  0.1  → WEAK_BULLISH
 *   sentiment &lt;= -0.3  → STRONG_BEARISH
 *   sentiment &lt;= -0.1  → WEAK_BEARISH
 *   otherwise          → NEUTRAL
 * </pre>
 */
public enum SentimentLabel {

    STRONG_BULLISH("Strong Bullish"),
    WEAK_BULLISH("Weak Bullish"),
    NEUTRAL("Neutral"),
    WEAK_BEARISH("Weak Bearish"),
    STRONG_BEARISH("Strong Bearish");

    static final double STRONG_THRESHOLD = 0.3;
    static final double WEAK_THRESHOLD   = 0.1;

    private final String displayName;

    SentimentLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public static SentimentLabel classify(double sentiment) {
        if (sentiment >=  STRONG_THRESHOLD) return STRONG_BULLISH;
        if (sentiment >=  WEAK_THRESHOLD)   return WEAK_BULLISH;
        if (sentiment <= -STRONG_THRESHOLD) return STRONG_BEARISH;
        if (sentiment <= -WEAK_THRESHOLD)   return WEAK_BEARISH;
        return NEUTRAL;
    }

    /**
     * Resolves a persisted display name back to the enum.
     * Unrecognised names fall back to {@link #NEUTRAL}.
     */
    public static SentimentLabel fromDisplayName(String displayName) {
        for (SentimentLabel label : values()) {
            if (label.displayName.equalsIgnoreCase(displayName)) {
                return label;
            }
        }
        return NEUTRAL;
    }
}
