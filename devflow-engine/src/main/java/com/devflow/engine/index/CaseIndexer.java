package com.devflow.engine.index;

import com.devflow.process.error.EventValidationException;
import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups raw events by case id and orders each case by timestamp.
 *
 * <p>The returned map iterates in the order case ids were first observed in the input; that order is the
 * case-processing order used for variant tie-breaks. Within a case the sort is stable, so events sharing a
 * timestamp keep their input order.
 */
@Slf4j
@Component
public class CaseIndexer {

    private static final Comparator<Event> BY_TIMESTAMP = Comparator.comparing(Event::timestamp);

    public Map<String, Case> index(Collection<Event> events) {
        if (events == null || events.isEmpty()) {
            return Map.of();
        }
        Map<String, List<Event>> grouped = new LinkedHashMap<>();
        int position = 0;
        for (Event event : events) {
            validate(event, position++);
            grouped.computeIfAbsent(event.caseId(), k -> new ArrayList<>()).add(event);
        }

        Map<String, Case> cases = new LinkedHashMap<>(grouped.size() * 2);
        for (Map.Entry<String, List<Event>> entry : grouped.entrySet()) {
            List<Event> caseEvents = entry.getValue();
            // List.sort is a stable merge sort
            caseEvents.sort(BY_TIMESTAMP);
            cases.put(entry.getKey(), new Case(entry.getKey(), caseEvents));
        }
        log.debug("Indexed events={} into cases={}", events.size(), cases.size());
        return Collections.unmodifiableMap(cases);
    }

    private static void validate(Event event, int position) {
        if (event == null) {
            throw new EventValidationException(position, "event", "Event #" + position + " is null");
        }
        if (isBlank(event.caseId())) {
            throw EventValidationException.missingField(position, "caseId");
        }
        if (isBlank(event.activity())) {
            throw EventValidationException.missingField(position, "activity");
        }
        if (event.timestamp() == null) {
            throw EventValidationException.missingField(position, "timestamp");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
