package com.platform.resilience.probe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Probe tally for one endpoint in one window.
 */
public record ProbeCounts(@JsonProperty("total") long total, @JsonProperty("ok") long ok) {
    
    public ProbeCounts {
        if (total < 0 || ok < 0 || ok > total) {
            throw new IllegalArgumentException(String.format("invalid probe counts ok=%d total=%d", ok, total));
        }
    }
    
    public static ProbeCounts empty() {
        return new ProbeCounts(0, 0);
    }
    
    @JsonIgnore
    public boolean hasSamples() {
        return total > 0;
    }
    
    /**
     * Success rate, 0 when nothing was probed.
     */
    @JsonIgnore
    public double rate() {
        return total == 0 ? 0.0 : (double) ok / total;
    }
    
    public ProbeCounts plus(ProbeCounts other) {
        return new ProbeCounts(total + other.total, ok + other.ok);
    }
}
