package com.platform.resilience.estimator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure semantics applied to dependency edges.
 */
public enum SemanticsMode {
    
    /** Every edge is blocking: a dead callee fails its caller. */
    BLOCKING("all-block"),
    
    /** Async (broker) edges do not propagate failure. */
    NON_BLOCKING("async");
    
    private final String label;
    
    SemanticsMode(String label) {
        this.label = label;
    }
    
    @JsonValue
    public String getLabel() {
        return label;
    }
    
    @JsonCreator
    public static SemanticsMode fromLabel(String value) {
        for (SemanticsMode mode : values()) {
            if (mode.label.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown semantics mode: " + value);
    }
}
