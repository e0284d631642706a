package com.platform.resilience.graph;

/**
 * Outcome of dependency discovery.
 *
 * @param graph           the built graph
 * @param source          which input produced the edges
 * @param lookbackMinutes lookback of the successful query, 0 for a graph file
 * @param observedCalls   caller/callee observations before normalization
 */
public record DiscoveryResult(DependencyGraph graph, DiscoverySource source, int lookbackMinutes, int observedCalls) {
}
