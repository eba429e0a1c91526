package com.stockhark.common.weight;

/**
 * Boost for symbols discussed across many distinct posts.
 *
 * <pre>
 *   n &lt;= 1 → 1.0
 *   n  &gt; 1 → min(cap, 1.0 + ln(n) × multiplier)
 * </pre>
 * Logarithmic so one very active symbol cannot run away with the weight.
 */
public final class PostDiversityWeight {

    private static final double BASE_WEIGHT = 1.0;

    private final double multiplier;
    private final double cap;

    public PostDiversityWeight(double multiplier, double cap) {
        this.multiplier = multiplier;
        this.cap        = cap;
    }

    public double weight(int uniquePostCount) {
        if (uniquePostCount <= 1) {
            return BASE_WEIGHT;
        }
        return Math.min(cap, BASE_WEIGHT + Math.log(uniquePostCount) * multiplier);
    }
}
