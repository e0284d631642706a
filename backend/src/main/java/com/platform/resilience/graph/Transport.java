package com.platform.resilience.graph;

/**
 * How a caller reaches a callee.
 */
public enum Transport {
    /** Request/response; the caller waits for the callee. */
    SYNC,
    /** Through a message broker; the caller does not wait. */
    ASYNC
}
