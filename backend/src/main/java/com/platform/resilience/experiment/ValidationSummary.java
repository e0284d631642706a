package com.platform.resilience.experiment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.probe.LiveWindow;

import java.util.List;

/**
 * Outcome of a single validation window: chaos must have killed something and the live success
 * rate must have dropped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationSummary(
    @JsonProperty("passed") boolean passed,
    @JsonProperty("failures") List<String> failures,
    @JsonProperty("eligible") int eligible,
    @JsonProperty("killed") int killed,
    @JsonProperty("R_live") double liveRate,
    @JsonProperty("min_kills") int minKills,
    @JsonProperty("max_live") double maxLive,
    @JsonProperty("window") ChaosWindow window,
    @JsonProperty("live") LiveWindow live
) {
    public ValidationSummary {
        failures = List.copyOf(failures);
    }
}
