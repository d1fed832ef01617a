package com.devflow.engine.stats;

import static com.devflow.engine.EngineFixtures.event;
import static com.devflow.engine.EngineFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.devflow.process.error.EmptyEventLogException;
import com.devflow.process.model.Case;
import java.util.List;
import org.junit.jupiter.api.Test;

class DurationStatisticsCalculatorTest {

    private final DurationStatisticsCalculator calculator = new DurationStatisticsCalculator();

    @Test
    void computesDistributionOverCaseDurations() {
        List<Case> cases = List.of(
                hourly("c-1", "A", "B"), // 1h
                hourly("c-2", "A", "B", "C"), // 2h
                hourly("c-3", "A", "B", "C", "D"), // 3h
                hourly("c-4", "A", "B", "C", "D", "E")); // 4h

        DurationStatistics stats = summarize(cases);

        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(4.0);
        assertThat(stats.median()).isEqualTo(2.5);
        assertThat(stats.mean()).isEqualTo(2.5);
        assertThat(stats.p90()).isCloseTo(3.7, within(1e-12));
    }

    @Test
    void singleEventCaseLastsZeroHours() {
        Case solo = new Case("solo", List.of(event("solo", "A", 5)));

        assertThat(DurationStatisticsCalculator.durationHours(solo)).isEqualTo(0.0);
        DurationStatistics stats = summarize(List.of(solo));
        assertThat(stats).isEqualTo(new DurationStatistics(0.0, 0.0, 0.0, 0.0, 0.0));
    }

    @Test
    void subHourPrecisionIsKept() {
        Case c = new Case("c-1", List.of(event("c-1", "A", 0), event("c-1", "B", 0.25)));

        assertThat(DurationStatisticsCalculator.durationHours(c)).isEqualTo(0.25);
    }

    @Test
    void statisticsStayWithinBounds() {
        double[] durations = {0.1, 0.1, 0.1, 1e6, 3.3, 7.7, 0.3};

        DurationStatistics stats = calculator.summarize(durations);

        assertThat(stats.mean()).isBetween(stats.min(), stats.max());
        assertThat(stats.median()).isBetween(stats.min(), stats.max());
        assertThat(stats.p90()).isBetween(stats.min(), stats.max());
    }

    @Test
    void emptyInputIsAnEmptyLog() {
        assertThatThrownBy(() -> calculator.summarize(new double[0])).isInstanceOf(EmptyEventLogException.class);
    }

    private DurationStatistics summarize(List<Case> cases) {
        return calculator.summarize(cases.stream()
                .mapToDouble(DurationStatisticsCalculator::durationHours)
                .toArray());
    }
}
