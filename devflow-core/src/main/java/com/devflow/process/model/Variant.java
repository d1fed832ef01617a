package com.devflow.process.model;

import java.util.List;

/**
 * A distinct activity sequence together with the ids of the cases that followed it, in case-processing order.
 */
public record Variant(List<String> activities, List<String> caseIds) {

    public Variant {
        activities = List.copyOf(activities);
        caseIds = List.copyOf(caseIds);
    }

    public int count() {
        return caseIds.size();
    }

    public double frequency(int totalCases) {
        return totalCases == 0 ? 0.0 : (double) caseIds.size() / (double) totalCases;
    }
}
