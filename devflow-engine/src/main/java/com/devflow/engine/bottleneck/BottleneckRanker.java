package com.devflow.engine.bottleneck;

import com.devflow.engine.config.AnalysisProperties;
import com.devflow.engine.dfg.DirectlyFollowsGraph;
import com.devflow.engine.dfg.TransitionStats;
import com.devflow.process.model.Bottleneck;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reduces the transitions of a directly-follows graph to the slowest ones.
 *
 * <p>Order: average wait descending, then frequency descending, then {@code fromActivity} and {@code toActivity}
 * ascending. The comparison is total, so every input has exactly one ranking.
 */
@Component
@RequiredArgsConstructor
public class BottleneckRanker {

    public static final Comparator<Bottleneck> RANKING = Comparator.comparingDouble(Bottleneck::avgWaitHours)
            .reversed()
            .thenComparing(Comparator.comparingLong(Bottleneck::frequency).reversed())
            .thenComparing(Bottleneck::fromActivity)
            .thenComparing(Bottleneck::toActivity);

    private final AnalysisProperties properties;

    public List<Bottleneck> rank(DirectlyFollowsGraph graph) {
        return rank(graph, properties.getBottleneckLimit());
    }

    public List<Bottleneck> rank(DirectlyFollowsGraph graph, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Bottleneck limit must be positive: " + limit);
        }
        return graph.transitions().stream()
                .map(BottleneckRanker::summarize)
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    static Bottleneck summarize(TransitionStats stats) {
        return new Bottleneck(
                stats.key().fromActivity(), stats.key().toActivity(), stats.averageWaitHours(), stats.count());
    }
}
