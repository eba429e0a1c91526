package com.stockhark.common.aggregation;

import java.util.List;

/**
 * Blends three independent sub-scores into one confidence in [0.0, 1.0].
 *
 * <pre>
 *   weightConfidence    = min(1, weightTotal / n)
 *   consensusConfidence = 0.8                              (n == 1)
 *                       = 1 − min(1, stdDev(raw) / 2)      (n  &gt; 1)
 *   sampleConfidence    = min(1, n / 5)
 *
 *   confidence = clamp(0.4·weight + 0.4·consensus + 0.2·sample, 0, 1)
 * </pre>
 *
 * <p>{@code stdDev} is the population standard deviation. Pure static utility.
 */
public final class ConfidenceEstimator {

    static final double WEIGHT_COEFF    = 0.4;
    static final double CONSENSUS_COEFF = 0.4;
    static final double SAMPLE_COEFF    = 0.2;

    /** A single observation cannot show agreement, but is not punished to zero either. */
    static final double SINGLE_OBSERVATION_CONSENSUS = 0.8;

    /** Sample size at which sample confidence saturates. */
    static final int SATURATION_SAMPLE_SIZE = 5;

    /** Largest possible spread of values in [-1, 1]; maps to zero consensus. */
    private static final double MAX_STD_DEV = 2.0;

    private ConfidenceEstimator() {}

    public static double estimate(List<Double> rawSentiments, double weightTotal) {
        int n = rawSentiments.size();
        if (n == 0) return 0.0;

        double blended = WEIGHT_COEFF    * weightConfidence(weightTotal, n)
                       + CONSENSUS_COEFF * consensusConfidence(rawSentiments)
                       + SAMPLE_COEFF    * sampleConfidence(n);
        return clamp(blended);
    }

    static double weightConfidence(double weightTotal, int n) {
        return Math.min(1.0, weightTotal / n);
    }

    static double consensusConfidence(List<Double> rawSentiments) {
        if (rawSentiments.size() == 1) {
            return SINGLE_OBSERVATION_CONSENSUS;
        }
        return 1.0 - Math.min(1.0, populationStdDev(rawSentiments) / MAX_STD_DEV);
    }

    static double sampleConfidence(int n) {
        return Math.min(1.0, (double) n / SATURATION_SAMPLE_SIZE);
    }

    static double populationStdDev(List<Double> values) {
        double mean = 0.0;
        for (double v : values) mean += v;
        mean /= values.size();

        double variance = 0.0;
        for (double v : values) {
            double d = v - mean;
            variance += d * d;
        }
        return Math.sqrt(variance / values.size());
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
