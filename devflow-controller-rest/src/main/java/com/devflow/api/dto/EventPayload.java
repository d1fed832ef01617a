package com.devflow.api.dto;

import com.devflow.process.model.Event;
import com.devflow.process.validation.TimestampParser;
import com.fasterxml.jackson.annotation.JsonInclude;

/** One raw event as posted by a client; the timestamp is any format {@link TimestampParser} accepts. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventPayload(String caseId, String activity, String timestamp) {

    /**
     * Missing case ids and activities are passed through so the indexer reports them with the event position.
     */
    public Event toEvent(int index) {
        return new Event(caseId, activity, TimestampParser.parse(timestamp, index));
    }
}
