package com.platform.resilience.experiment;

import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.chaos.SamplingLaw;
import com.platform.resilience.error.ValidationException;
import com.platform.resilience.estimator.SemanticsMode;
import com.platform.resilience.probe.LiveWindow;
import com.platform.resilience.probe.ProbeCounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ValidationService")
class ValidationServiceTest {
    
    private static final Duration WINDOW = Duration.ofSeconds(20);
    
    @Mock
    private ExperimentService experimentService;
    
    @Mock
    private ArtifactStore artifactStore;
    
    @InjectMocks
    private ValidationService validationService;
    
    private void windowOutcome(int eligible, int killed, ProbeCounts live) {
        ChaosWindow chaos = new ChaosWindow("validate-run", 0, 1.0, SamplingLaw.FIXED_PROPORTION, eligible, killed,
            List.of(), List.of(), 20, List.of(), List.of(), Instant.EPOCH, Instant.EPOCH.plusSeconds(20));
        LiveWindow liveWindow = new LiveWindow("validate-run", 0, 1.0, SemanticsMode.BLOCKING,
            Map.of("home", live), false, Instant.EPOCH, Instant.EPOCH.plusSeconds(15));
        when(experimentService.runWindow(anyString(), anyInt(), anyDouble(), eq(WINDOW), eq(SemanticsMode.BLOCKING),
            any(), any())).thenReturn(new WindowOutcome(chaos, liveWindow));
    }
    
    @Test
    @DisplayName("passes when chaos killed enough and live success dropped")
    void passes() {
        windowOutcome(4, 4, new ProbeCounts(100, 10));
        
        ValidationSummary summary = validationService.validate(1.0, WINDOW, 1, 0.99);
        
        assertThat(summary.passed()).isTrue();
        assertThat(summary.failures()).isEmpty();
        assertThat(summary.liveRate()).isEqualTo(0.1);
        verify(artifactStore).saveValidation(summary);
        verify(experimentService).awaitWarmup();
    }
    
    @Test
    @DisplayName("fails when no probe completed during the outage")
    void failsWithoutProbes() {
        windowOutcome(2, 2, ProbeCounts.empty());
        
        ValidationSummary summary = validationService.validate(1.0, WINDOW, 1, 0.99);
        
        assertThat(summary.passed()).isFalse();
        assertThat(summary.failures()).containsExactly("no probes completed during the outage");
    }
    
    @Test
    @DisplayName("reports every unmet condition")
    void reportsFailures() {
        windowOutcome(0, 0, new ProbeCounts(100, 100));
        
        ValidationSummary summary = validationService.validate(1.0, WINDOW, 1, 0.99);
        
        assertThat(summary.passed()).isFalse();
        assertThat(summary.failures()).containsExactly(
            "no eligible containers",
            "killed 0 < min kills 1",
            "live success 1.0000 > max live 0.9900");
    }
    
    @Test
    @DisplayName("uses a validation run id")
    void runId() {
        windowOutcome(2, 2, new ProbeCounts(10, 0));
        
        validationService.validate(1.0, WINDOW, 1, 0.99);
        
        verify(artifactStore).windowLog(startsWith("validate-p1.0-"), eq(1.0));
    }
    
    @Test
    @DisplayName("rejects a negative kill minimum")
    void rejectsNegativeMinKills() {
        assertThatThrownBy(() -> validationService.validate(1.0, WINDOW, -1, 0.99))
            .isInstanceOf(ValidationException.class);
    }
}
