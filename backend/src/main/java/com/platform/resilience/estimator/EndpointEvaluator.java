package com.platform.resilience.estimator;

import com.platform.resilience.error.ValidationException;
import com.platform.resilience.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Evaluates one endpoint's success rule against a graph, compiled once per (graph, spec, mode).
 * 
 * Targets must be reachable from the entry through alive nodes. Under non-blocking semantics
 * with {@code excludeAsync}, async edges are ignored and targets that cannot be reached without
 * them even in a healthy system are set aside: dropped from any/all rules, and lowering k by
 * one each for k-of-n rules.
 */
public final class EndpointEvaluator implements TrialEvaluator {
    
    private final DependencyGraph graph;
    private final TargetSpec spec;
    private final int entry;
    private final int[] considered;
    private final int setAside;
    private final boolean excludeAsync;
    
    private EndpointEvaluator(DependencyGraph graph, TargetSpec spec, int entry, int[] considered, 
                              int setAside, boolean excludeAsync) {
        this.graph = graph;
        this.spec = spec;
        this.entry = entry;
        this.considered = considered;
        this.setAside = setAside;
        this.excludeAsync = excludeAsync;
    }
    
    /**
     * @throws ValidationException when the entry or a target is not a graph node
     */
    public static EndpointEvaluator compile(DependencyGraph graph, TargetSpec spec, SemanticsMode mode) {
        int entry = resolveEntry(graph, spec);
        
        List<Integer> targets = new ArrayList<>();
        for (String item : spec.rule().items()) {
            int index = graph.indexOf(item);
            if (index < 0) {
                throw ValidationException.unknownService(item, "endpoint " + spec.endpoint());
            }
            targets.add(index);
        }
        
        boolean excludeAsync = mode == SemanticsMode.NON_BLOCKING && spec.excludeAsync();
        int[] considered = targets.stream().mapToInt(Integer::intValue).toArray();
        int setAside = 0;
        if (excludeAsync) {
            boolean[] structural = graph.reachable(entry, null, true);
            considered = Arrays.stream(considered).filter(i -> structural[i]).toArray();
            setAside = targets.size() - considered.length;
        }
        return new EndpointEvaluator(graph, spec, entry, considered, setAside, excludeAsync);
    }
    
    private static int resolveEntry(DependencyGraph graph, TargetSpec spec) {
        if (spec.entry() != null) {
            int entry = graph.indexOf(spec.entry());
            if (entry < 0) {
                throw ValidationException.unknownService(spec.entry(), "entry of endpoint " + spec.endpoint());
            }
            return entry;
        }
        int entry = graph.indexOf(TargetSpec.DEFAULT_ENTRY);
        if (entry < 0 && !graph.entrypoints().isEmpty()) {
            entry = graph.indexOf(graph.entrypoints().get(0));
        }
        if (entry < 0) {
            throw ValidationException.unknownService(TargetSpec.DEFAULT_ENTRY, "entry of endpoint " + spec.endpoint());
        }
        return entry;
    }
    
    @Override
    public boolean evaluate(boolean[] alive) {
        boolean[] reachable = graph.reachable(entry, i -> alive[i], excludeAsync);
        int satisfied = 0;
        for (int target : considered) {
            if (reachable[target]) {
                satisfied++;
            }
        }
        return spec.rule().isSatisfied(satisfied, considered.length, setAside);
    }
    
    /**
     * Evaluate with the named services dead and every other node alive.
     */
    public boolean evaluate(Set<String> failed) {
        boolean[] alive = new boolean[graph.size()];
        for (int i = 0; i < alive.length; i++) {
            alive[i] = !failed.contains(graph.nodeAt(i));
        }
        return evaluate(alive);
    }
    
    @Override
    public String endpoint() {
        return spec.endpoint();
    }
    
    public TargetSpec spec() {
        return spec;
    }
    
    int setAside() {
        return setAside;
    }
}
