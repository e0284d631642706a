package com.platform.resilience.probe;

/**
 * Issues a single probe request. Never throws for request failures; they are reported in the result.
 */
@FunctionalInterface
public interface ProbeClient {
    
    ProbeResult probe(ProbeTarget target);
}
