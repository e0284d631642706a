package com.platform.resilience.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Paired Wilcoxon signed-rank test outcome.
 *
 * @param statistic min(W+, W-)
 * @param z         normal approximation score
 * @param pValue    two-sided p-value
 * @param pairs     non-zero differences ranked
 */
public record SignedRankResult(
    @JsonProperty("statistic") double statistic,
    @JsonProperty("z") double z,
    @JsonProperty("p_value") double pValue,
    @JsonProperty("pairs") int pairs
) {
}
