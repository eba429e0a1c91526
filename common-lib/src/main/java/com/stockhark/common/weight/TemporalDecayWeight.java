package com.stockhark.common.weight;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Exponential time decay: {@code w = e^(−λ · Δh)}.
 *
 * <p>{@code Δh} is the fractional number of hours from the observation to the
 * reference time, floored at zero so future-dated observations weigh 1.0.
 * Output lies in (0.0, 1.0] for any finite age (it may underflow to 0.0 for
 * extremely old observations) and never increases with age.
 */
public final class TemporalDecayWeight {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final double decayRatePerHour;

    public TemporalDecayWeight(double decayRatePerHour) {
        this.decayRatePerHour = decayRatePerHour;
    }

    public double weight(LocalDateTime timestamp, LocalDateTime reference) {
        return Math.exp(-decayRatePerHour * hoursElapsed(timestamp, reference));
    }

    /** Non-negative hours between {@code timestamp} and {@code reference}. */
    public static double hoursElapsed(LocalDateTime timestamp, LocalDateTime reference) {
        Duration elapsed = Duration.between(timestamp, reference);
        double hours = (elapsed.getSeconds() + elapsed.getNano() / 1_000_000_000.0) / SECONDS_PER_HOUR;
        return Math.max(0.0, hours);
    }

    public double decayRatePerHour() {
        return decayRatePerHour;
    }
}
