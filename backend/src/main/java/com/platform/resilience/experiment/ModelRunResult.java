package com.platform.resilience.experiment;

import com.platform.resilience.correlation.ModelMonotonicityCheck;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.graph.DiscoverySource;

import java.util.List;

/**
 * Estimates computed by one model run, for both semantics modes.
 */
public record ModelRunResult(
    double failureFraction,
    DiscoverySource graphSource,
    String graphHash,
    List<ModelEstimate> estimates,
    List<ModelMonotonicityCheck.Violation> monotonicityWarnings
) {
    public ModelRunResult {
        estimates = List.copyOf(estimates);
        monotonicityWarnings = List.copyOf(monotonicityWarnings);
    }
}
