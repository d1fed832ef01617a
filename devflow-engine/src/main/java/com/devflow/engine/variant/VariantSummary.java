package com.devflow.engine.variant;

import com.devflow.process.model.Variant;
import java.util.List;

/**
 * All variants of a log ranked by descending case count, ties broken by the earliest first case.
 */
public record VariantSummary(List<Variant> variants, int caseCount) {

    public VariantSummary {
        variants = List.copyOf(variants);
    }

    public int variantCount() {
        return variants.size();
    }

    public Variant dominant() {
        return variants.isEmpty() ? null : variants.get(0);
    }

    public List<String> dominantActivities() {
        Variant top = dominant();
        return top == null ? List.of() : top.activities();
    }

    public double dominantFrequency() {
        Variant top = dominant();
        return top == null ? 0.0 : top.frequency(caseCount);
    }
}
