package com.devflow.engine.dfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulating count and wait-time samples (hours) of one transition. Owned by a single accumulator; not
 * thread-safe.
 */
public final class TransitionStats {
    private final TransitionKey key;
    private final List<Double> waitSamples = new ArrayList<>();

    public TransitionStats(TransitionKey key) {
        this.key = key;
    }

    public TransitionKey key() {
        return key;
    }

    public long count() {
        return waitSamples.size();
    }

    public List<Double> waitSamples() {
        return List.copyOf(waitSamples);
    }

    void record(double waitHours) {
        waitSamples.add(waitHours);
    }

    void absorb(TransitionStats other) {
        waitSamples.addAll(other.waitSamples);
    }

    /**
     * Mean wait in hours. Samples are summed in ascending order so the value does not depend on the order in
     * which partial graphs were merged.
     */
    public double averageWaitHours() {
        if (waitSamples.isEmpty()) {
            return 0.0;
        }
        double[] sorted = waitSamples.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double sample : sorted) {
            sum += sample;
        }
        return sum / sorted.length;
    }
}
