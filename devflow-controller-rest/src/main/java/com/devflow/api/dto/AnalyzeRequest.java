package com.devflow.api.dto;

import com.devflow.process.model.Event;
import java.util.ArrayList;
import java.util.List;

public record AnalyzeRequest(List<EventPayload> events) {

    public List<Event> toEvents() {
        if (events == null) {
            return List.of();
        }
        List<Event> result = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            EventPayload payload = events.get(i);
            result.add(payload == null ? null : payload.toEvent(i));
        }
        return result;
    }
}
