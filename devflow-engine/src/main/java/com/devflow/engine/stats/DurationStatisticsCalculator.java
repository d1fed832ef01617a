package com.devflow.engine.stats;

import com.devflow.engine.support.Hours;
import com.devflow.process.error.EmptyEventLogException;
import com.devflow.process.model.Case;
import java.util.Arrays;
import org.springframework.stereotype.Component;

/**
 * Case duration is the span from first to last event in hours; a single-event case lasts 0 hours.
 */
@Component
public class DurationStatisticsCalculator {
    public static final double P90 = 0.9;

    public static double durationHours(Case c) {
        return Hours.between(c.start(), c.end());
    }

    /**
     * @throws EmptyEventLogException if there are no durations
     */
    public DurationStatistics summarize(double[] durations) {
        if (durations == null || durations.length == 0) {
            throw new EmptyEventLogException();
        }
        double[] sorted = durations.clone();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double d : sorted) {
            sum += d;
        }
        // clamp rounding drift so min <= mean <= max holds exactly
        double mean = Math.min(sorted[sorted.length - 1], Math.max(sorted[0], sum / sorted.length));
        return new DurationStatistics(
                Percentiles.median(sorted),
                mean,
                Percentiles.linear(sorted, P90),
                sorted[0],
                sorted[sorted.length - 1]);
    }
}
