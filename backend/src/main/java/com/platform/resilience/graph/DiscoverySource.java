package com.platform.resilience.graph;

/**
 * Where the dependency edges of a graph came from.
 */
public enum DiscoverySource {
    TRACES,
    DEPENDENCY_SUMMARY,
    GRAPH_FILE
}
