package com.platform.resilience.estimator;

import com.platform.resilience.error.ValidationException;
import com.platform.resilience.fleet.ServiceNames;
import com.platform.resilience.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Endpoint-less evaluation: a trial succeeds when some entrypoint reaches an alive sink.
 * Sinks are the configured services, or the nodes without outgoing edges under the mode's edge set.
 */
public final class AggregateEvaluator implements TrialEvaluator {
    
    private final DependencyGraph graph;
    private final int[] entries;
    private final boolean[] sinks;
    private final boolean excludeAsync;
    
    private AggregateEvaluator(DependencyGraph graph, int[] entries, boolean[] sinks, boolean excludeAsync) {
        this.graph = graph;
        this.entries = entries;
        this.sinks = sinks;
        this.excludeAsync = excludeAsync;
    }
    
    public static AggregateEvaluator compile(DependencyGraph graph, SemanticsMode mode,
                                             Collection<String> entrypoints, Collection<String> sinkServices) {
        boolean excludeAsync = mode == SemanticsMode.NON_BLOCKING;
        
        List<Integer> entryIndices = new ArrayList<>();
        for (String entry : entrypoints) {
            int index = graph.indexOf(ServiceNames.normalize(entry));
            if (index >= 0) {
                entryIndices.add(index);
            }
        }
        if (entryIndices.isEmpty()) {
            graph.entrypoints().forEach(e -> entryIndices.add(graph.indexOf(e)));
        }
        if (entryIndices.isEmpty()) {
            throw new ValidationException("entrypoints", entrypoints, "no entrypoint is a node of the graph");
        }
        
        boolean[] sinks;
        if (sinkServices == null || sinkServices.isEmpty()) {
            sinks = graph.leaves(excludeAsync);
        } else {
            sinks = new boolean[graph.size()];
            for (String sink : sinkServices) {
                int index = graph.indexOf(ServiceNames.normalize(sink));
                if (index >= 0) {
                    sinks[index] = true;
                }
            }
        }
        return new AggregateEvaluator(graph, 
            entryIndices.stream().mapToInt(Integer::intValue).toArray(), sinks, excludeAsync);
    }
    
    @Override
    public boolean evaluate(boolean[] alive) {
        for (int entry : entries) {
            boolean[] reachable = graph.reachable(entry, i -> alive[i], excludeAsync);
            for (int i = 0; i < reachable.length; i++) {
                if (reachable[i] && sinks[i]) {
                    return true;
                }
            }
        }
        return false;
    }
    
    @Override
    public String endpoint() {
        return null;
    }
}
