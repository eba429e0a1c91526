package com.stockhark.common.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceEstimatorTest {

    @Test
    @DisplayName("no observations → 0.0")
    void empty() {
        assertEquals(0.0, ConfidenceEstimator.estimate(List.of(), 0.0));
    }

    @Test
    @DisplayName("single observation uses the fixed 0.8 consensus")
    void singleObservation() {
        // 0.4·1.0 + 0.4·0.8 + 0.2·0.2
        assertEquals(0.76, ConfidenceEstimator.estimate(List.of(0.3), 1.0), 1e-12);
    }

    @Test
    @DisplayName("perfect agreement, full weight, five samples → 1.0")
    void saturated() {
        assertEquals(1.0, ConfidenceEstimator.estimate(List.of(0.2, 0.2, 0.2, 0.2, 0.2), 5.0), 1e-12);
    }

    @Test
    @DisplayName("weight confidence saturates at 1.0 even when boosted weights exceed n")
    void weightConfidenceCapped() {
        assertEquals(1.0, ConfidenceEstimator.weightConfidence(9.0, 3));
        assertEquals(0.5, ConfidenceEstimator.weightConfidence(1.5, 3), 1e-12);
    }

    @Test
    @DisplayName("opposite extremes halve consensus")
    void maxDisagreement() {
        // population std dev of {-1, 1} is 1.0 → 1 − 0.5
        assertEquals(0.5, ConfidenceEstimator.consensusConfidence(List.of(-1.0, 1.0)), 1e-12);
        assertEquals(1.0, ConfidenceEstimator.populationStdDev(List.of(-1.0, 1.0)), 1e-12);
    }

    @Test
    @DisplayName("sample confidence grows to 1.0 at five observations")
    void sampleConfidence() {
        assertEquals(0.2, ConfidenceEstimator.sampleConfidence(1), 1e-12);
        assertEquals(0.8, ConfidenceEstimator.sampleConfidence(4), 1e-12);
        assertEquals(1.0, ConfidenceEstimator.sampleConfidence(5));
        assertEquals(1.0, ConfidenceEstimator.sampleConfidence(50));
    }
}
