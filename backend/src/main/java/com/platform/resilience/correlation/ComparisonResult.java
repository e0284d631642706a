package com.platform.resilience.correlation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Model-versus-live comparison for one endpoint (or the probe-weighted mix) at one p.
 * 
 * Delta values are {@code |bias_blocking| - |bias_non_blocking|} per window: positive means the
 * non-blocking model was closer to what was observed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComparisonResult(
    @JsonProperty("endpoint") String key,
    @JsonProperty("p_fail") double failureFraction,
    @JsonProperty("scope") WindowScope scope,
    @JsonProperty("windows") int windows,
    @JsonProperty("graph_hash") String graphHash,
    @JsonProperty("mean_R_live") double meanLive,
    @JsonProperty("blocking") ModeBias blocking,
    @JsonProperty("non_blocking") ModeBias nonBlocking,
    @JsonProperty("mean_delta_abs_bias") double meanDelta,
    @JsonProperty("ci_delta_abs_bias") ConfidenceInterval deltaCi,
    @JsonProperty("share_non_blocking_closer") double shareNonBlockingCloser,
    @JsonProperty("wilcoxon") SignedRankResult signedRank,
    @JsonProperty("cliffs_delta") Double cliffsDelta
) {
    
    public static final String MIX = "mix";
    
    public boolean isMix() {
        return MIX.equals(key);
    }
}
