package com.platform.resilience.experiment;

import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.chaos.ChaosWindowLog;
import com.platform.resilience.correlation.ComparisonResult;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.graph.DependencyGraph;
import com.platform.resilience.probe.LiveWindow;

import java.nio.file.Path;
import java.util.List;

/**
 * Persistence for experiment artifacts. Window logs and live windows are append-only;
 * estimates and comparisons are derived and may be overwritten.
 */
public interface ArtifactStore {
    
    Path runDirectory();
    
    ChaosWindowLog windowLog(String runId, double failureFraction);
    
    List<ChaosWindow> loadChaosWindows();
    
    Path saveModelEstimate(ModelEstimate estimate);
    
    List<ModelEstimate> loadModelEstimates();
    
    List<ModelEstimate> loadModelEstimates(double failureFraction);
    
    Path saveLiveWindow(LiveWindow window);
    
    List<LiveWindow> loadLiveWindows(double failureFraction);
    
    Path saveComparison(ComparisonResult result);
    
    Path saveGraph(DependencyGraph graph);
    
    Path saveValidation(ValidationSummary summary);
}
