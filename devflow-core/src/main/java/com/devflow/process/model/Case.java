package com.devflow.process.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A case identifier plus its events ordered by non-decreasing timestamp.
 */
public record Case(String caseId, List<Event> events) {

    public Case {
        Objects.requireNonNull(caseId, "caseId");
        events = List.copyOf(events);
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Case " + caseId + " must contain at least one event");
        }
    }

    public int size() {
        return events.size();
    }

    public Instant start() {
        return events.get(0).timestamp();
    }

    public Instant end() {
        return events.get(events.size() - 1).timestamp();
    }

    /** Activity skeleton of the case: activity names in event order, timestamps stripped. */
    public List<String> activities() {
        return events.stream().map(Event::activity).toList();
    }

    public Duration duration() {
        return Duration.between(start(), end());
    }
}
