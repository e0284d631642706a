package com.platform.resilience.chaos;

/**
 * Random law used to pick a kill set from a population of n eligible containers.
 * The chaos executor and the reliability estimator must use the same law.
 */
public enum SamplingLaw {
    /**
     * Exactly k = max(1, round(n * p)) victims (k = 0 when p = 0), capped at n,
     * drawn uniformly without replacement.
     */
    FIXED_PROPORTION,
    
    /**
     * Each container fails independently with probability p; the kill count is Binomial(n, p)
     * and may be zero at p > 0.
     */
    BERNOULLI
}
