package com.devflow.engine.dfg;

import com.devflow.engine.support.Hours;
import com.devflow.process.error.InvariantViolationException;
import com.devflow.process.model.Case;
import com.devflow.process.model.Event;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives the directly-follows graph of a case collection. Every consecutive event pair of a case adds one
 * transition and one wait sample; self-loops count like any other edge and a single-event case adds nothing.
 */
@Component
public class DfgBuilder {

    public DirectlyFollowsGraph build(Collection<Case> cases) {
        DirectlyFollowsGraph graph = new DirectlyFollowsGraph();
        for (Case c : cases) {
            accumulate(graph, c);
        }
        return graph;
    }

    /**
     * Adds the transitions of {@code c} to {@code graph}.
     *
     * @throws InvariantViolationException if two consecutive events are out of timestamp order
     */
    public void accumulate(DirectlyFollowsGraph graph, Case c) {
        List<Event> events = c.events();
        for (int i = 0; i + 1 < events.size(); i++) {
            Event from = events.get(i);
            Event to = events.get(i + 1);
            double waitHours = Hours.between(from.timestamp(), to.timestamp());
            if (waitHours < 0) {
                throw new InvariantViolationException(c.caseId(), from.activity(), to.activity(), waitHours);
            }
            graph.record(from.activity(), to.activity(), waitHours);
        }
    }
}
