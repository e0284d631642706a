package com.platform.resilience.correlation;

import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.estimator.SemanticsMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Warns when a model estimate rises with p beyond Monte Carlo noise.
 * Live rates are not checked: they may legitimately be non-monotonic.
 */
@Slf4j
@Component
public class ModelMonotonicityCheck {
    
    /** Standard errors of slack before an increase counts. */
    private static final double TOLERANCE_SIGMAS = 3.0;
    
    /**
     * A rise between two consecutive p values of the same (endpoint, mode).
     */
    public record Violation(String endpoint, SemanticsMode mode, double lowerP, double lowerMean, 
                            double higherP, double higherMean) {
    }
    
    public List<Violation> check(List<ModelEstimate> estimates) {
        Map<String, List<ModelEstimate>> series = new LinkedHashMap<>();
        for (ModelEstimate estimate : estimates) {
            String key = Objects.toString(estimate.endpoint(), "aggregate") + "|" + estimate.mode().getLabel()
                + "|" + estimate.samplingLaw();
            series.computeIfAbsent(key, k -> new ArrayList<>()).add(estimate);
        }
        
        List<Violation> violations = new ArrayList<>();
        for (List<ModelEstimate> points : series.values()) {
            points.sort(Comparator.comparingDouble(ModelEstimate::failureFraction));
            for (int i = 1; i < points.size(); i++) {
                ModelEstimate lower = points.get(i - 1);
                ModelEstimate higher = points.get(i);
                if (higher.failureFraction() == lower.failureFraction()) {
                    continue;
                }
                double slack = TOLERANCE_SIGMAS * Math.sqrt(standardErrorSquared(lower) + standardErrorSquared(higher));
                if (higher.mean() > lower.mean() + slack) {
                    Violation violation = new Violation(lower.endpoint(), lower.mode(), 
                        lower.failureFraction(), lower.mean(), higher.failureFraction(), higher.mean());
                    log.warn("Model estimate for {} ({}) rises with p: R={} at p={} but R={} at p={}",
                        Objects.toString(lower.endpoint(), "aggregate"), lower.mode().getLabel(),
                        lower.mean(), lower.failureFraction(), higher.mean(), higher.failureFraction());
                    violations.add(violation);
                }
            }
        }
        return violations;
    }
    
    private static double standardErrorSquared(ModelEstimate estimate) {
        return estimate.trials() == 0 ? 0.0 : estimate.stdDev() * estimate.stdDev() / estimate.trials();
    }
}
