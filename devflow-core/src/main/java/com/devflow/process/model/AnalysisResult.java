package com.devflow.process.model;

import com.devflow.process.json.AnalysisResultSerializer;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal aggregate of one analysis run. Instances are immutable and safe to share between threads.
 *
 * <p>The canonical textual form is produced by {@link AnalysisResultSerializer}: fixed field order, snake_case
 * names and six decimal places for every floating-point value.
 */
@JsonSerialize(using = AnalysisResultSerializer.class)
public record AnalysisResult(
        int caseCount,
        int eventCount,
        int activityCount,
        int variantCount,
        double medianDurationHours,
        double meanDurationHours,
        double p90DurationHours,
        double minDurationHours,
        double maxDurationHours,
        List<String> topVariant,
        double topVariantFrequency,
        List<Bottleneck> bottlenecks,
        List<String> reworkActivities,
        double reworkRate,
        Map<String, Long> activityFrequencies,
        Instant dateRangeStart,
        Instant dateRangeEnd) {

    public AnalysisResult {
        topVariant = List.copyOf(topVariant);
        bottlenecks = List.copyOf(bottlenecks);
        reworkActivities = List.copyOf(reworkActivities);
        activityFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(activityFrequencies));
    }

    public boolean hasRework() {
        return !reworkActivities.isEmpty();
    }

    public long frequencyOf(String activity) {
        Long count = activityFrequencies.get(activity);
        return count == null ? 0 : count;
    }
}
