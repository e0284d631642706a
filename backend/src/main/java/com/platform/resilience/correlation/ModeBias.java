package com.platform.resilience.correlation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bias of one semantics mode against live measurements.
 *
 * @param model       model success probability
 * @param meanBias    mean of (model - live)
 * @param ci          bootstrap interval of the mean signed bias
 * @param meanAbsBias mean of |model - live|
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModeBias(
    @JsonProperty("R_model") double model,
    @JsonProperty("mean_bias") double meanBias,
    @JsonProperty("ci") ConfidenceInterval ci,
    @JsonProperty("mean_abs_bias") double meanAbsBias
) {
}
