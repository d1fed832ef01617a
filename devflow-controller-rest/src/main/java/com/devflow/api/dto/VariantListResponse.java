package com.devflow.api.dto;

import com.devflow.engine.variant.VariantSummary;
import java.util.List;

public record VariantListResponse(int caseCount, int variantCount, List<VariantEntry> variants) {

    public record VariantEntry(List<String> activities, int count, double frequency, List<String> caseIds) {}

    public static VariantListResponse from(VariantSummary summary) {
        List<VariantEntry> entries = summary.variants().stream()
                .map(v -> new VariantEntry(v.activities(), v.count(), v.frequency(summary.caseCount()), v.caseIds()))
                .toList();
        return new VariantListResponse(summary.caseCount(), summary.variantCount(), entries);
    }
}
