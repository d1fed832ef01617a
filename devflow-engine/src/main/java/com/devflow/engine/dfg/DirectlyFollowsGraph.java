package com.devflow.engine.dfg;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Activities as nodes, ordered activity pairs as edges, each edge carrying its {@link TransitionStats}.
 *
 * <p>A graph is mutable while it is being built and merged; {@link #merge} is associative and commutative over
 * counts and sample multisets, so partial graphs built by separate workers can be combined in any order.
 */
public final class DirectlyFollowsGraph {
    private final Map<TransitionKey, TransitionStats> edges = new LinkedHashMap<>();

    void record(String fromActivity, String toActivity, double waitHours) {
        TransitionKey key = new TransitionKey(fromActivity, toActivity);
        edges.computeIfAbsent(key, TransitionStats::new).record(waitHours);
    }

    public DirectlyFollowsGraph merge(DirectlyFollowsGraph other) {
        other.edges.forEach((key, stats) ->
                edges.computeIfAbsent(key, TransitionStats::new).absorb(stats));
        return this;
    }

    public Collection<TransitionStats> transitions() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public TransitionStats transition(String fromActivity, String toActivity) {
        return edges.get(new TransitionKey(fromActivity, toActivity));
    }

    public Set<String> activities() {
        Set<String> nodes = new LinkedHashSet<>();
        for (TransitionKey key : edges.keySet()) {
            nodes.add(key.fromActivity());
            nodes.add(key.toActivity());
        }
        return nodes;
    }

    public int edgeCount() {
        return edges.size();
    }

    public long totalTransitions() {
        long total = 0;
        for (TransitionStats stats : edges.values()) {
            total += stats.count();
        }
        return total;
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }
}
