package com.devflow.engine.rework;

import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags cases in which some activity occurs more than once and collects those activities log-wide. Tallies are
 * kept in an {@link Accumulator} filled during the single pass over cases.
 */
public final class ReworkDetector {

    private ReworkDetector() {}

    /** Activities occurring more than once in {@code c}; empty when the case has no rework. */
    public static Set<String> repeatedActivities(Case c) {
        Map<String, Integer> occurrences = new HashMap<>();
        Set<String> repeated = new TreeSet<>();
        for (Event event : c.events()) {
            if (occurrences.merge(event.activity(), 1, Integer::sum) > 1) {
                repeated.add(event.activity());
            }
        }
        return repeated;
    }

    public static final class Accumulator {
        private final Set<String> reworkActivities = new TreeSet<>();
        private int reworkedCases;
        private int caseCount;

        public void add(Case c) {
            Set<String> repeated = repeatedActivities(c);
            if (!repeated.isEmpty()) {
                reworkedCases++;
                reworkActivities.addAll(repeated);
            }
            caseCount++;
        }

        public Accumulator merge(Accumulator other) {
            reworkActivities.addAll(other.reworkActivities);
            reworkedCases += other.reworkedCases;
            caseCount += other.caseCount;
            return this;
        }

        public ReworkSummary summary() {
            return new ReworkSummary(reworkedCases, caseCount, reworkActivities.stream().toList());
        }
    }
}
