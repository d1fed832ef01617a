package com.devflow.engine.assemble;

import com.devflow.engine.rework.ReworkSummary;
import com.devflow.engine.stats.DurationStatistics;
import com.devflow.engine.variant.VariantSummary;
import com.devflow.process.error.AnalysisFaultException;
import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Bottleneck;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Merges the per-stage reductions into one {@link AnalysisResult}. Holds no state.
 */
@Component
public class MetricsAssembler {

    public AnalysisResult assemble(
            LogCounts counts,
            DurationStatistics durations,
            VariantSummary variants,
            List<Bottleneck> bottlenecks,
            ReworkSummary rework) {
        if (variants.caseCount() != counts.caseCount() || rework.caseCount() != counts.caseCount()) {
            throw new AnalysisFaultException(String.format(
                    "Stage case counts disagree: log=%d variants=%d rework=%d",
                    counts.caseCount(), variants.caseCount(), rework.caseCount()));
        }
        AnalysisResult result = new AnalysisResult(
                counts.caseCount(),
                counts.eventCount(),
                counts.activityCount(),
                variants.variantCount(),
                durations.median(),
                durations.mean(),
                durations.p90(),
                durations.min(),
                durations.max(),
                variants.dominantActivities(),
                variants.dominantFrequency(),
                bottlenecks,
                rework.reworkActivities(),
                rework.reworkRate(),
                counts.activityFrequencies(),
                counts.dateRangeStart(),
                counts.dateRangeEnd());
        requireFinite(result);
        return result;
    }

    private static void requireFinite(AnalysisResult result) {
        requireFinite("median_duration_hours", result.medianDurationHours());
        requireFinite("mean_duration_hours", result.meanDurationHours());
        requireFinite("p90_duration_hours", result.p90DurationHours());
        requireFinite("min_duration_hours", result.minDurationHours());
        requireFinite("max_duration_hours", result.maxDurationHours());
        requireFinite("top_variant_frequency", result.topVariantFrequency());
        requireFinite("rework_rate", result.reworkRate());
        for (Bottleneck bottleneck : result.bottlenecks()) {
            requireFinite("avg_wait_hours[" + bottleneck.label() + "]", bottleneck.avgWaitHours());
        }
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new AnalysisFaultException("Non-finite value for " + field + ": " + value);
        }
    }
}
