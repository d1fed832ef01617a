package com.devflow.engine.index;

import static com.devflow.engine.EngineFixtures.at;
import static com.devflow.engine.EngineFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.devflow.process.error.EventValidationException;
import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CaseIndexerTest {

    private final CaseIndexer indexer = new CaseIndexer();

    @Test
    void keepsFirstSeenCaseOrderAndSortsEachCase() {
        List<Event> events = List.of(
                event("c-2", "B", 2),
                event("c-1", "B", 5),
                event("c-2", "A", 1),
                event("c-1", "A", 3),
                event("c-3", "A", 0));

        Map<String, Case> cases = indexer.index(events);

        assertThat(cases.keySet()).containsExactly("c-2", "c-1", "c-3");
        assertThat(cases.get("c-2").activities()).containsExactly("A", "B");
        assertThat(cases.get("c-1").activities()).containsExactly("A", "B");
    }

    @Test
    void equalTimestampsKeepInputOrder() {
        List<Event> events = List.of(
                event("c-1", "Late", 4), event("c-1", "First", 1), event("c-1", "Second", 1), event("c-1", "Third", 1));

        Case c = indexer.index(events).get("c-1");

        assertThat(c.activities()).containsExactly("First", "Second", "Third", "Late");
    }

    @Test
    void singleEventCaseIsValid() {
        Map<String, Case> cases = indexer.index(List.of(event("solo", "Only", 0)));

        assertThat(cases).hasSize(1);
        assertThat(cases.get("solo").size()).isEqualTo(1);
    }

    @Test
    void emptyInputYieldsNoCases() {
        assertThat(indexer.index(List.of())).isEmpty();
        assertThat(indexer.index(null)).isEmpty();
    }

    @Test
    void rejectsMissingCaseIdWithPosition() {
        List<Event> events = List.of(event("c-1", "A", 0), new Event(" ", "B", at(1)));

        assertThatThrownBy(() -> indexer.index(events))
                .isInstanceOfSatisfying(EventValidationException.class, ex -> {
                    assertThat(ex.eventIndex()).isEqualTo(1);
                    assertThat(ex.field()).isEqualTo("caseId");
                });
    }

    @Test
    void rejectsMissingActivityAndTimestamp() {
        assertThatThrownBy(() -> indexer.index(List.of(new Event("c-1", null, at(0)))))
                .isInstanceOfSatisfying(
                        EventValidationException.class, ex -> assertThat(ex.field()).isEqualTo("activity"));
        assertThatThrownBy(() -> indexer.index(List.of(new Event("c-1", "A", null))))
                .isInstanceOfSatisfying(
                        EventValidationException.class, ex -> assertThat(ex.field()).isEqualTo("timestamp"));
    }

    @Test
    void rejectsNullEvent() {
        assertThatThrownBy(() -> indexer.index(Arrays.asList(event("c-1", "A", 0), null)))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("#1");
    }
}
