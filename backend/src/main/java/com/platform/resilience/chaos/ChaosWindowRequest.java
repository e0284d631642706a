package com.platform.resilience.chaos;

import java.time.Duration;

/**
 * Parameters of a single chaos window.
 */
public record ChaosWindowRequest(
    String runId,
    int windowId,
    double failureFraction,
    Duration duration,
    SamplingLaw samplingLaw
) {
    public ChaosWindowRequest {
        if (failureFraction < 0.0 || failureFraction > 1.0) {
            throw new IllegalArgumentException("failure fraction must be within [0, 1]: " + failureFraction);
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("window duration must be non-negative");
        }
    }
}
