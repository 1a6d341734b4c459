package com.mnemo.core.decay;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Logistic staleness curve: {@code min(ceiling, 1 / (1 + exp(-steepness * (ageHours - midpointHours))))}.
 * With the defaults a record is about 0.33 stale after a day and hits the ceiling after a week.
 * Negative ages are treated as zero.
 */
@Value
@Builder
public class LogisticDecayModel implements DecayModel {
    public static final double DEFAULT_STEEPNESS = 0.03;
    public static final double DEFAULT_MIDPOINT_HOURS = 48;
    public static final double DEFAULT_CEILING = 0.95;

    public static final LogisticDecayModel DEFAULT = LogisticDecayModel.builder().build();

    @Builder.Default
    double steepness = DEFAULT_STEEPNESS;

    @Builder.Default
    double midpointHours = DEFAULT_MIDPOINT_HOURS;

    @Builder.Default
    double ceiling = DEFAULT_CEILING;

    @Override
    public double decay(Instant lastAccessedAt, Instant now) {
        final var ageHours = Math.max(0.0, ageInHours(lastAccessedAt, now));
        final var raw = 1.0 / (1.0 + Math.exp(-steepness * (ageHours - midpointHours)));
        return Math.min(ceiling, raw);
    }

    public static double ageInHours(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0.0;
        }
        return Duration.between(from, to).toMillis() / 3_600_000.0;
    }
}
