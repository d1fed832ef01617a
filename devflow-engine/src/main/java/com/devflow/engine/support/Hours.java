package com.devflow.engine.support;

import java.time.Duration;
import java.time.Instant;

/** Conversions from {@link Duration}s to fractional hours, the unit every engine statistic is reported in. */
public final class Hours {
    private static final double SECONDS_PER_HOUR = 3_600.0;
    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private Hours() {}

    public static double of(Duration duration) {
        return duration.getSeconds() / SECONDS_PER_HOUR + duration.getNano() / NANOS_PER_HOUR;
    }

    public static double between(Instant from, Instant to) {
        return of(Duration.between(from, to));
    }
}
