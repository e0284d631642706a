package com.platform.resilience.estimator;

/**
 * Decides whether a request succeeds given which graph nodes are alive.
 */
public interface TrialEvaluator {
    
    /**
     * @param alive liveness indexed like the graph's nodes
     */
    boolean evaluate(boolean[] alive);
    
    /**
     * Endpoint label, or {@code null} for aggregate evaluation.
     */
    String endpoint();
}
