package com.platform.resilience.graph;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a distributed tracing backend.
 */
public interface TraceBackend {
    
    /**
     * Services known to the backend; empty when none are reported.
     */
    List<String> services();
    
    /**
     * Raw trace payload for one service over the lookback, if any backend answered.
     */
    Optional<JsonNode> traces(String service, int lookbackMinutes);
    
    /**
     * Backend-computed service dependency summary over the lookback, if available.
     */
    Optional<JsonNode> dependencySummary(int lookbackMinutes);
}
