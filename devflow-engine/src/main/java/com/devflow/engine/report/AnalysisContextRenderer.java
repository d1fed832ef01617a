package com.devflow.engine.report;

import com.devflow.process.model.AnalysisResult;
import com.devflow.process.model.Bottleneck;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders an {@link AnalysisResult} as a fixed-format markdown block for report and prompt collaborators.
 * Output is a pure function of the result.
 */
@Component
public class AnalysisContextRenderer {

    static final int TOP_ACTIVITIES = 10;

    public String render(AnalysisResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("# Process Analysis Results");
        lines.add("");
        lines.add("## Summary");
        lines.add(format("- Cases analyzed: %,d", result.caseCount()));
        lines.add(format("- Events: %,d", result.eventCount()));
        lines.add(format("- Distinct activities: %d", result.activityCount()));
        lines.add(format("- Variants: %d", result.variantCount()));
        if (result.dateRangeStart() != null && result.dateRangeEnd() != null) {
            lines.add(format("- Date range: %s to %s", result.dateRangeStart(), result.dateRangeEnd()));
        }
        lines.add("");
        lines.add("## Case Duration (hours)");
        lines.add(format("- Median: %.2f", result.medianDurationHours()));
        lines.add(format("- Mean: %.2f", result.meanDurationHours()));
        lines.add(format("- P90: %.2f", result.p90DurationHours()));
        lines.add(format("- Min: %.2f", result.minDurationHours()));
        lines.add(format("- Max: %.2f", result.maxDurationHours()));
        lines.add("");
        lines.add("## Dominant Path");
        lines.add(format(
                "- %s (%s of cases)",
                String.join(" -> ", result.topVariant()), percent(result.topVariantFrequency())));
        lines.add("");

        if (!result.bottlenecks().isEmpty()) {
            lines.add("## Bottlenecks");
            for (Bottleneck b : result.bottlenecks()) {
                lines.add(format(
                        "- %s: avg wait %.2fh (%d occurrences)", b.label(), b.avgWaitHours(), b.frequency()));
            }
            lines.add("");
        }

        lines.add("## Rework");
        lines.add(format("- Rework rate: %s", percent(result.reworkRate())));
        if (result.hasRework()) {
            lines.add("- Repeated activities: " + String.join(", ", result.reworkActivities()));
        }
        lines.add("");

        lines.add("## Activity Frequencies");
        result.activityFrequencies().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue()
                        .reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_ACTIVITIES)
                .forEach(e -> lines.add(format("- %s: %d", e.getKey(), e.getValue())));

        return String.join("\n", lines);
    }

    private static String percent(double ratio) {
        return format("%.1f%%", ratio * 100.0);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
