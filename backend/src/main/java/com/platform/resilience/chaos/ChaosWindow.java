package com.platform.resilience.chaos;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one chaos window, written as one JSON line to the window log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChaosWindow(
    @JsonProperty("run_id") String runId,
    @JsonProperty("window_id") int windowId,
    @JsonProperty("p_fail") double failureFraction,
    @JsonProperty("law") SamplingLaw samplingLaw,
    @JsonProperty("eligible") int eligible,
    @JsonProperty("killed") int killed,
    @JsonProperty("containers") List<String> containers,
    @JsonProperty("services") List<String> services,
    @JsonProperty("window_s") long windowSeconds,
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("restore_failures") List<String> restoreFailures,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt
) {
    public ChaosWindow {
        containers = containers == null ? List.of() : List.copyOf(containers);
        services = services == null ? List.of() : List.copyOf(services);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        restoreFailures = restoreFailures == null ? List.of() : List.copyOf(restoreFailures);
    }
    
    /**
     * True when at least one victim failed to reach a stopped state.
     */
    @JsonIgnore
    public boolean isAnomalous() {
        return !anomalies.isEmpty();
    }
}
