package com.platform.resilience.graph;

import java.util.Comparator;

/**
 * Directed call dependency between two services.
 */
public record DependencyEdge(String caller, String callee, Transport transport) implements Comparable<DependencyEdge> {
    
    private static final Comparator<DependencyEdge> ORDER = Comparator
        .comparing(DependencyEdge::caller)
        .thenComparing(DependencyEdge::callee);
    
    public DependencyEdge {
        if (caller == null || callee == null) {
            throw new IllegalArgumentException("edge endpoints must not be null");
        }
        if (transport == null) {
            transport = Transport.SYNC;
        }
    }
    
    public boolean isAsync() {
        return transport == Transport.ASYNC;
    }
    
    @Override
    public int compareTo(DependencyEdge other) {
        return ORDER.compare(this, other);
    }
}
