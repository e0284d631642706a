package com.platform.resilience.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Two-sided percentile interval.
 */
public record ConfidenceInterval(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper) {
    
    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
