package com.platform.resilience.chaos;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A victim that did not reach a terminal stopped state after the stop command.
 */
public record Anomaly(
    @JsonProperty("container") String container,
    @JsonProperty("observed_state") String observedState
) {}
