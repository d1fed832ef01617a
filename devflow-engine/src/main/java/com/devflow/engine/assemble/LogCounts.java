package com.devflow.engine.assemble;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Basic counts of an indexed log; activity frequencies are kept in lexical key order. */
public record LogCounts(
        int caseCount,
        int eventCount,
        Map<String, Long> activityFrequencies,
        Instant dateRangeStart,
        Instant dateRangeEnd) {

    public LogCounts {
        activityFrequencies = Collections.unmodifiableMap(new TreeMap<>(activityFrequencies));
    }

    public int activityCount() {
        return activityFrequencies.size();
    }
}
