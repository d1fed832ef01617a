package com.devflow.engine.rework;

import static com.devflow.engine.EngineFixtures.event;
import static com.devflow.engine.EngineFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;

import com.devflow.process.model.Case;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReworkDetectorTest {

    @Test
    void repeatedActivityMarksTheCase() {
        Case c = new Case("c-1", List.of(event("c-1", "A", 0), event("c-1", "B", 1), event("c-1", "A", 2)));

        ReworkSummary summary = detect(List.of(c));

        assertThat(summary.reworkActivities()).containsExactly("A");
        assertThat(summary.reworkedCases()).isEqualTo(1);
        assertThat(summary.reworkRate()).isEqualTo(1.0);
    }

    @Test
    void reworkActivitiesAreASet() {
        ReworkSummary summary = detect(List.of(
                hourly("c-1", "Review", "Fix", "Review"),
                hourly("c-2", "Review", "Fix", "Review", "Fix"),
                hourly("c-3", "Submit", "Approve"),
                hourly("c-4", "Submit")));

        assertThat(summary.reworkActivities()).containsExactly("Fix", "Review");
        assertThat(summary.reworkedCases()).isEqualTo(2);
        assertThat(summary.reworkRate()).isEqualTo(0.5);
    }

    @Test
    void selfLoopCountsAsRework() {
        assertThat(ReworkDetector.repeatedActivities(hourly("c-1", "A", "A"))).containsExactly("A");
    }

    @Test
    void noRepeatsMeansZeroRate() {
        ReworkSummary summary = detect(List.of(hourly("c-1", "A", "B", "C"), hourly("c-2", "C", "B")));

        assertThat(summary.reworkRate()).isZero();
        assertThat(summary.reworkActivities()).isEmpty();
    }

    @Test
    void mergeSumsTallies() {
        ReworkDetector.Accumulator left = new ReworkDetector.Accumulator();
        ReworkDetector.Accumulator right = new ReworkDetector.Accumulator();
        left.add(hourly("c-1", "A", "A"));
        right.add(hourly("c-2", "B", "B"));
        right.add(hourly("c-3", "C"));

        ReworkSummary summary = left.merge(right).summary();

        assertThat(summary.caseCount()).isEqualTo(3);
        assertThat(summary.reworkedCases()).isEqualTo(2);
        assertThat(summary.reworkActivities()).containsExactly("A", "B");
    }

    private static ReworkSummary detect(List<Case> cases) {
        ReworkDetector.Accumulator accumulator = new ReworkDetector.Accumulator();
        cases.forEach(accumulator::add);
        return accumulator.summary();
    }
}
