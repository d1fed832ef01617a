package com.devflow.engine.accumulate;

import com.devflow.engine.assemble.LogCounts;
import com.devflow.engine.dfg.DfgBuilder;
import com.devflow.engine.dfg.DirectlyFollowsGraph;
import com.devflow.engine.rework.ReworkDetector;
import com.devflow.engine.stats.DurationStatisticsCalculator;
import com.devflow.engine.variant.VariantAnalyzer;
import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Isolated single-pass state over a run of cases: directly-follows graph, case durations, variant groups, rework
 * tallies and activity counts. Each worker owns one instance; partial instances are combined with {@link #merge}
 * and nothing is ranked until every merge has completed.
 */
public final class CaseLogAccumulator {
    private final DfgBuilder dfgBuilder;
    private final DirectlyFollowsGraph graph = new DirectlyFollowsGraph();
    private final VariantAnalyzer.Accumulator variants = new VariantAnalyzer.Accumulator();
    private final ReworkDetector.Accumulator rework = new ReworkDetector.Accumulator();
    private final Map<String, Long> activityFrequencies = new HashMap<>();
    private double[] durations = new double[16];
    private int caseCount;
    private int eventCount;
    private Instant earliest;
    private Instant latest;

    public CaseLogAccumulator(DfgBuilder dfgBuilder) {
        this.dfgBuilder = dfgBuilder;
    }

    /**
     * @param ordinal position of {@code c} in case-processing order
     */
    public void accept(int ordinal, Case c) {
        dfgBuilder.accumulate(graph, c);
        variants.add(ordinal, c);
        rework.add(c);
        for (Event event : c.events()) {
            activityFrequencies.merge(event.activity(), 1L, Long::sum);
        }
        appendDuration(DurationStatisticsCalculator.durationHours(c));
        eventCount += c.size();
        earliest = earliest == null || c.start().isBefore(earliest) ? c.start() : earliest;
        latest = latest == null || c.end().isAfter(latest) ? c.end() : latest;
    }

    public CaseLogAccumulator merge(CaseLogAccumulator other) {
        graph.merge(other.graph);
        variants.merge(other.variants);
        rework.merge(other.rework);
        other.activityFrequencies.forEach((activity, count) -> activityFrequencies.merge(activity, count, Long::sum));
        for (int i = 0; i < other.caseCount; i++) {
            appendDuration(other.durations[i]);
        }
        eventCount += other.eventCount;
        if (other.earliest != null && (earliest == null || other.earliest.isBefore(earliest))) {
            earliest = other.earliest;
        }
        if (other.latest != null && (latest == null || other.latest.isAfter(latest))) {
            latest = other.latest;
        }
        return this;
    }

    private void appendDuration(double hours) {
        if (caseCount == durations.length) {
            durations = Arrays.copyOf(durations, durations.length * 2);
        }
        durations[caseCount++] = hours;
    }

    public DirectlyFollowsGraph graph() {
        return graph;
    }

    public VariantAnalyzer.Accumulator variants() {
        return variants;
    }

    public ReworkDetector.Accumulator rework() {
        return rework;
    }

    public double[] durations() {
        return Arrays.copyOf(durations, caseCount);
    }

    public int caseCount() {
        return caseCount;
    }

    public LogCounts counts() {
        return new LogCounts(caseCount, eventCount, activityFrequencies, earliest, latest);
    }
}
