package com.platform.resilience.experiment;

import java.util.List;

/**
 * Windows of one chaos series, in execution order.
 */
public record ChaosSeriesResult(String runId, double failureFraction, List<WindowOutcome> windows) {
    
    public ChaosSeriesResult {
        windows = List.copyOf(windows);
    }
    
    public long anomalousWindows() {
        return windows.stream().filter(w -> w.chaos().isAnomalous()).count();
    }
}
