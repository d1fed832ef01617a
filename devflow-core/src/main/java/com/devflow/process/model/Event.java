package com.devflow.process.model;

import java.time.Instant;

/**
 * One timestamped activity occurrence within a case, as handed over by an event-log loader.
 *
 * <p>Components are not validated on construction; {@code CaseIndexer} rejects events with a missing case id,
 * activity or timestamp when the log is indexed.
 */
public record Event(String caseId, String activity, Instant timestamp) {

    public static Event of(String caseId, String activity, Instant timestamp) {
        return new Event(caseId, activity, timestamp);
    }
}
