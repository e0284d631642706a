package com.platform.resilience.experiment;

import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.chaos.ChaosWindowLog;
import com.platform.resilience.error.ValidationException;
import com.platform.resilience.estimator.SemanticsMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SplittableRandom;

/**
 * Smoke test of the whole loop: one chaos window must kill something and visibly hurt the
 * live success rate.
 */
@Slf4j
@Service
public class ValidationService {
    
    private final ExperimentService experimentService;
    private final ArtifactStore artifactStore;
    
    public ValidationService(ExperimentService experimentService, ArtifactStore artifactStore) {
        this.experimentService = experimentService;
        this.artifactStore = artifactStore;
    }
    
    public ValidationSummary validate(double failureFraction, Duration window, int minKills, double maxLive) {
        if (minKills < 0) {
            throw new ValidationException("minKills", minKills, "must not be negative");
        }
        String runId = "validate-" + ExperimentService.newRunId(failureFraction);
        ChaosWindowLog windowLog = artifactStore.windowLog(runId, failureFraction);
        
        experimentService.awaitWarmup();
        WindowOutcome outcome = experimentService.runWindow(runId, 0, failureFraction, window, 
            SemanticsMode.BLOCKING, windowLog, new SplittableRandom());
        ChaosWindow chaos = outcome.chaos();
        double liveRate = outcome.live().overallRate();
        
        List<String> failures = new ArrayList<>();
        if (chaos.eligible() <= 0) {
            failures.add("no eligible containers");
        }
        if (chaos.killed() < minKills) {
            failures.add(String.format(Locale.ROOT, "killed %d < min kills %d", chaos.killed(), minKills));
        }
        if (outcome.live().totals().total() == 0) {
            failures.add("no probes completed during the outage");
        }
        if (liveRate > maxLive) {
            failures.add(String.format(Locale.ROOT, "live success %.4f > max live %.4f", liveRate, maxLive));
        }
        
        ValidationSummary summary = new ValidationSummary(failures.isEmpty(), failures, chaos.eligible(), 
            chaos.killed(), liveRate, minKills, maxLive, chaos, outcome.live());
        artifactStore.saveValidation(summary);
        
        if (summary.passed()) {
            log.info("Validation passed: killed {}/{} eligible, R_live={}", chaos.killed(), chaos.eligible(), liveRate);
        } else {
            log.warn("Validation failed: {}", failures);
        }
        return summary;
    }
}
