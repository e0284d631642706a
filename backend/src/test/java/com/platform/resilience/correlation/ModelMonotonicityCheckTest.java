package com.platform.resilience.correlation;

import com.platform.resilience.chaos.SamplingLaw;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.estimator.SemanticsMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ModelMonotonicityCheck")
class ModelMonotonicityCheckTest {
    
    private static final long TRIALS = 10_000;
    
    private final ModelMonotonicityCheck check = new ModelMonotonicityCheck();
    
    private static ModelEstimate estimate(String endpoint, SemanticsMode mode, double p, double mean) {
        return ModelEstimate.of(endpoint, mode, p, TRIALS, Math.round(mean * TRIALS), 
            SamplingLaw.FIXED_PROPORTION, "g1");
    }
    
    @Test
    @DisplayName("accepts a decreasing series")
    void decreasing() {
        List<ModelEstimate> estimates = List.of(
            estimate("home", SemanticsMode.BLOCKING, 0.3, 0.7),
            estimate("home", SemanticsMode.BLOCKING, 0.1, 0.9),
            estimate("home", SemanticsMode.BLOCKING, 0.5, 0.5));
        
        assertThat(check.check(estimates)).isEmpty();
    }
    
    @Test
    @DisplayName("tolerates rises within Monte Carlo noise")
    void noise() {
        List<ModelEstimate> estimates = List.of(
            estimate("home", SemanticsMode.BLOCKING, 0.3, 0.700),
            estimate("home", SemanticsMode.BLOCKING, 0.4, 0.705));
        
        assertThat(check.check(estimates)).isEmpty();
    }
    
    @Test
    @DisplayName("flags a rise beyond noise")
    void flagsRise() {
        List<ModelEstimate> estimates = List.of(
            estimate("home", SemanticsMode.NON_BLOCKING, 0.3, 0.7),
            estimate("home", SemanticsMode.NON_BLOCKING, 0.5, 0.95),
            estimate("home", SemanticsMode.BLOCKING, 0.5, 0.5));
        
        List<ModelMonotonicityCheck.Violation> violations = check.check(estimates);
        
        assertThat(violations).hasSize(1);
        ModelMonotonicityCheck.Violation violation = violations.get(0);
        assertThat(violation.endpoint()).isEqualTo("home");
        assertThat(violation.mode()).isEqualTo(SemanticsMode.NON_BLOCKING);
        assertThat(violation.lowerP()).isEqualTo(0.3);
        assertThat(violation.higherP()).isEqualTo(0.5);
    }
    
    @Test
    @DisplayName("keeps endpoints in separate series")
    void separateSeries() {
        List<ModelEstimate> estimates = List.of(
            estimate("home", SemanticsMode.BLOCKING, 0.3, 0.5),
            estimate("cart", SemanticsMode.BLOCKING, 0.5, 0.9));
        
        assertThat(check.check(estimates)).isEmpty();
    }
}
