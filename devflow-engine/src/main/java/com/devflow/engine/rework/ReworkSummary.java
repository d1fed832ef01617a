package com.devflow.engine.rework;

import java.util.List;

/**
 * @param reworkActivities activities repeated within at least one case, in lexical order
 */
public record ReworkSummary(int reworkedCases, int caseCount, List<String> reworkActivities) {

    public ReworkSummary {
        reworkActivities = List.copyOf(reworkActivities);
    }

    /** Share of cases containing at least one repeated activity, in {@code [0, 1]}. */
    public double reworkRate() {
        return caseCount == 0 ? 0.0 : (double) reworkedCases / (double) caseCount;
    }
}
