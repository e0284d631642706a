package com.platform.resilience.estimator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.resilience.chaos.SamplingLaw;

/**
 * Monte Carlo estimate of request success probability for one (endpoint, mode, p).
 *
 * @param endpoint  endpoint label, {@code null} for aggregate evaluation
 * @param mode      failure semantics
 * @param failureFraction p
 * @param trials    trial count N
 * @param successes successful trials
 * @param mean      success rate
 * @param stdDev    sample standard deviation of the per-trial outcome
 * @param samplingLaw kill law used by every trial
 * @param graphHash fingerprint of the graph the estimate was computed over
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelEstimate(
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("mode") SemanticsMode mode,
    @JsonProperty("p_fail") double failureFraction,
    @JsonProperty("samples") long trials,
    @JsonProperty("successes") long successes,
    @JsonProperty("R_model") double mean,
    @JsonProperty("std_dev") double stdDev,
    @JsonProperty("law") SamplingLaw samplingLaw,
    @JsonProperty("graph_hash") String graphHash
) {
    
    /** Endpoint label of estimates that draw the endpoint uniformly per trial. */
    public static final String UNIFORM_ENDPOINT = "uniform";
    
    public static ModelEstimate of(String endpoint, SemanticsMode mode, double failureFraction, long trials, 
                                   long successes, SamplingLaw samplingLaw, String graphHash) {
        double mean = trials == 0 ? 0.0 : (double) successes / trials;
        double stdDev = trials > 1 ? Math.sqrt(mean * (1.0 - mean) * trials / (trials - 1)) : 0.0;
        return new ModelEstimate(endpoint, mode, failureFraction, trials, successes, mean, stdDev, samplingLaw, graphHash);
    }
    
    public boolean isAggregate() {
        return endpoint == null;
    }
}
