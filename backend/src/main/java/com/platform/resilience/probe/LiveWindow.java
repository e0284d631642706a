package com.platform.resilience.probe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.resilience.estimator.SemanticsMode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Live measurement taken during one chaos window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LiveWindow(
    @JsonProperty("run_id") String runId,
    @JsonProperty("window_id") int windowId,
    @JsonProperty("p_fail") double failureFraction,
    @JsonProperty("mode") SemanticsMode mode,
    @JsonProperty("endpoints") Map<String, ProbeCounts> endpoints,
    @JsonProperty("anomalous") boolean anomalous,
    @JsonProperty("measured_from") Instant measuredFrom,
    @JsonProperty("measured_to") Instant measuredTo
) {
    public LiveWindow {
        endpoints = endpoints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }
    
    /**
     * Probe-count-weighted success rate across every endpoint.
     */
    @JsonProperty("R_live")
    public double overallRate() {
        return totals().rate();
    }
    
    @JsonIgnore
    public ProbeCounts totals() {
        ProbeCounts sum = ProbeCounts.empty();
        for (ProbeCounts counts : endpoints.values()) {
            sum = sum.plus(counts);
        }
        return sum;
    }
    
    public ProbeCounts countsFor(String endpoint) {
        return endpoints.getOrDefault(endpoint, ProbeCounts.empty());
    }
}
