package com.platform.resilience.experiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.chaos.ChaosExecutor;
import com.platform.resilience.chaos.SamplingLaw;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.correlation.ComparisonResult;
import com.platform.resilience.correlation.ModelMonotonicityCheck;
import com.platform.resilience.correlation.StatisticalCorrelator;
import com.platform.resilience.correlation.WindowScope;
import com.platform.resilience.error.ArtifactNotFoundException;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.error.ValidationException;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.estimator.ReliabilityEstimator;
import com.platform.resilience.estimator.SemanticsMode;
import com.platform.resilience.fleet.Disallowlist;
import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.fleet.FleetInspector;
import com.platform.resilience.fleet.InMemoryContainerPlatform;
import com.platform.resilience.graph.DependencyDiscoveryService;
import com.platform.resilience.graph.DependencyEdge;
import com.platform.resilience.graph.DependencyGraph;
import com.platform.resilience.graph.DiscoverySource;
import com.platform.resilience.graph.GraphJson;
import com.platform.resilience.graph.Transport;
import com.platform.resilience.lifecycle.ChaosSafetyNet;
import com.platform.resilience.observability.MetricsRegistry;
import com.platform.resilience.probe.LiveMeasurementService;
import com.platform.resilience.probe.LiveWindow;
import com.platform.resilience.probe.ProbeCounts;
import com.platform.resilience.probe.WarmupGate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExperimentService")
class ExperimentServiceTest {
    
    @TempDir
    Path runDir;
    
    @Mock
    private LiveMeasurementService liveMeasurementService;
    
    @Mock
    private DependencyDiscoveryService discoveryService;
    
    @Mock
    private WarmupGate warmupGate;
    
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private InMemoryContainerPlatform platform;
    private ExperimentProperties properties;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private JsonArtifactStore artifactStore;
    private ExperimentService service;
    
    @BeforeEach
    void setUp() {
        platform = new InMemoryContainerPlatform()
            .add("demo-frontend-1", "frontend")
            .add("demo-checkout-1", "checkout")
            .add("demo-payment-1", "payment");
        
        properties = new ExperimentProperties();
        properties.setRunDir(runDir.resolve("runs").toString());
        properties.getChaos().setWindowDuration(Duration.ofMillis(400));
        properties.getChaos().setSamplingLaw(SamplingLaw.FIXED_PROPORTION);
        properties.getMeasurement().setRevealDelay(Duration.ofMillis(20));
        properties.getMeasurement().setTailMargin(Duration.ofMillis(10));
        properties.getMeasurement().setBootstrapResamples(100);
        properties.getModel().setParallelism(2);
        
        workers = Executors.newFixedThreadPool(2);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        EligibilityPolicy policy = new EligibilityPolicy(
            Disallowlist.of(List.of("frontend"), List.of()), "(frontend)$", List.of("frontend"));
        artifactStore = new JsonArtifactStore(properties, mapper);
        
        service = new ExperimentService(
            new FleetInspector(platform, policy, metrics),
            new ChaosExecutor(platform, properties, workers, metrics, new ChaosSafetyNet(), duration -> { }),
            liveMeasurementService,
            warmupGate,
            discoveryService,
            new ReliabilityEstimator(workers, properties, metrics),
            new StatisticalCorrelator(properties),
            new ModelMonotonicityCheck(),
            artifactStore,
            policy,
            properties,
            mapper,
            scheduler);
    }
    
    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }
    
    @Nested
    @DisplayName("measurement window")
    class MeasurementWindow {
        
        @Test
        @DisplayName("spans the outage minus reveal delay and tail margin")
        void derived() {
            assertThat(service.measurementWindow(Duration.ofMillis(400))).isEqualTo(Duration.ofMillis(370));
        }
        
        @Test
        @DisplayName("rejects a configured window that outlasts the outage")
        void configuredTooLong() {
            properties.getMeasurement().setWindow(Duration.ofMillis(390));
            
            assertThatThrownBy(() -> service.measurementWindow(Duration.ofMillis(400)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("measurement.window");
        }
        
        @Test
        @DisplayName("rejects an outage shorter than the reveal delay")
        void outageTooShort() {
            assertThatThrownBy(() -> service.measurementWindow(Duration.ofMillis(25)))
                .isInstanceOf(ValidationException.class);
        }
    }
    
    @Nested
    @DisplayName("chaos series")
    class ChaosSeries {
        
        @Test
        @DisplayName("measures every window during its outage and restores the fleet")
        void runsWindows() {
            when(liveMeasurementService.measure(any(Duration.class)))
                .thenReturn(Map.of("home", new ProbeCounts(10, 4)));
            
            ChaosSeriesResult result = service.runChaosSeries(0.5, 2, SemanticsMode.BLOCKING);
            
            assertThat(result.runId()).startsWith("p0.5-");
            assertThat(result.windows()).hasSize(2);
            assertThat(result.windows()).allSatisfy(outcome -> {
                assertThat(outcome.chaos().killed()).isEqualTo(1);
                assertThat(outcome.live().countsFor("home")).isEqualTo(new ProbeCounts(10, 4));
                assertThat(outcome.live().measuredFrom()).isNotNull();
            });
            assertThat(platform.runningCount()).isEqualTo(3);
            assertThat(artifactStore.loadLiveWindows(0.5)).hasSize(2);
            assertThat(service.listWindows()).hasSize(2);
            verify(liveMeasurementService, times(2)).measure(Duration.ofMillis(370));
            verify(warmupGate, times(1)).await(List.of());
        }
        
        @Test
        @DisplayName("stops nothing when the system never warms up")
        void warmupTimeout() {
            when(warmupGate.await(any())).thenThrow(new ResilienceException(ErrorCode.WARMUP_TIMEOUT, "cold"));
            
            assertThatThrownBy(() -> service.runChaosSeries(0.5, 2, SemanticsMode.BLOCKING))
                .isInstanceOf(ResilienceException.class)
                .extracting(e -> ((ResilienceException) e).getErrorCode())
                .isEqualTo(ErrorCode.WARMUP_TIMEOUT);
            assertThat(platform.operations()).isEmpty();
            verify(liveMeasurementService, never()).measure(any(Duration.class));
        }
        
        @Test
        @DisplayName("requires at least one window")
        void rejectsZeroWindows() {
            assertThatThrownBy(() -> service.runChaosSeries(0.5, 0, SemanticsMode.BLOCKING))
                .isInstanceOf(ValidationException.class);
        }
    }
    
    @Nested
    @DisplayName("model runs")
    class ModelRuns {
        
        @Test
        @DisplayName("estimate every endpoint, the uniform mix and the aggregate under both modes")
        void estimatesFromGraphFile() throws IOException {
            DependencyGraph graph = new DependencyGraph(List.of("frontend", "checkout", "payment"),
                List.of(
                    new DependencyEdge("frontend", "checkout", Transport.SYNC),
                    new DependencyEdge("checkout", "payment", Transport.ASYNC)),
                List.of("frontend"));
            Path graphFile = runDir.resolve("graph-in.json");
            GraphJson.write(graph, graphFile, mapper);
            Path targets = runDir.resolve("targets.json");
            Files.writeString(targets, """
                {
                  "home": {"entry": "frontend", "any_of": ["checkout"]},
                  "checkout": {"entry": "frontend", "all_of": ["checkout", "payment"], "exclude_async": true}
                }
                """);
            properties.getModel().setGraphPath(graphFile.toString());
            properties.getModel().setTargetsPath(targets.toString());
            properties.getModel().setReplicasPath(null);
            
            ModelRunResult result = service.runModel(0.5, 2_000);
            
            assertThat(result.graphSource()).isEqualTo(DiscoverySource.GRAPH_FILE);
            assertThat(result.graphHash()).isEqualTo(graph.fingerprint());
            assertThat(result.estimates()).hasSize(8);
            assertThat(result.estimates()).filteredOn(ModelEstimate::isAggregate).hasSize(2);
            assertThat(result.estimates())
                .filteredOn(e -> ModelEstimate.UNIFORM_ENDPOINT.equals(e.endpoint()))
                .hasSize(2);
            assertThat(result.monotonicityWarnings()).isEmpty();
            assertThat(artifactStore.loadModelEstimates(0.5)).hasSize(8);
            assertThat(Files.exists(artifactStore.runDirectory().resolve("graph.json"))).isTrue();
            verify(discoveryService, never()).discover();
        }
    }
    
    @Nested
    @DisplayName("comparisons")
    class Comparisons {
        
        @Test
        @DisplayName("require live windows")
        void requireLiveWindows() {
            assertThatThrownBy(() -> service.compare(0.3))
                .isInstanceOf(ArtifactNotFoundException.class);
        }
        
        @Test
        @DisplayName("require model estimates")
        void requireEstimates() {
            artifactStore.saveLiveWindow(new LiveWindow("run", 0, 0.3, SemanticsMode.BLOCKING,
                Map.of("home", new ProbeCounts(10, 8)), false, Instant.EPOCH, Instant.EPOCH));
            
            assertThatThrownBy(() -> service.compare(0.3))
                .isInstanceOf(ArtifactNotFoundException.class)
                .hasMessageContaining("model estimates");
        }
        
        @Test
        @DisplayName("cover both window scopes")
        void bothScopes() {
            artifactStore.saveLiveWindow(new LiveWindow("run", 0, 0.3, SemanticsMode.BLOCKING,
                Map.of("home", new ProbeCounts(10, 8)), false, Instant.EPOCH, Instant.EPOCH));
            artifactStore.saveModelEstimate(ModelEstimate.of("home", SemanticsMode.BLOCKING, 0.3, 100, 50,
                SamplingLaw.FIXED_PROPORTION, "g1"));
            artifactStore.saveModelEstimate(ModelEstimate.of("home", SemanticsMode.NON_BLOCKING, 0.3, 100, 80,
                SamplingLaw.FIXED_PROPORTION, "g1"));
            
            List<ComparisonResult> results = service.compare(0.3);
            
            assertThat(results).extracting(ComparisonResult::scope)
                .containsExactly(WindowScope.ALL, WindowScope.ALL, WindowScope.CLEAN, WindowScope.CLEAN);
            assertThat(Files.exists(artifactStore.runDirectory().resolve("comparison_p0.3_home_clean.json"))).isTrue();
        }
    }
}
