package com.platform.resilience.experiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.chaos.ChaosExecutor;
import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.chaos.ChaosWindowLog;
import com.platform.resilience.chaos.ChaosWindowRequest;
import com.platform.resilience.chaos.OutageListener;
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
import com.platform.resilience.estimator.ReplicaMap;
import com.platform.resilience.estimator.SemanticsMode;
import com.platform.resilience.estimator.SimulationModel;
import com.platform.resilience.estimator.TargetSpec;
import com.platform.resilience.estimator.TargetSpecLoader;
import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.fleet.FleetInspector;
import com.platform.resilience.fleet.FleetSnapshot;
import com.platform.resilience.graph.DependencyDiscoveryService;
import com.platform.resilience.graph.DiscoveryResult;
import com.platform.resilience.graph.DiscoverySource;
import com.platform.resilience.graph.GraphJson;
import com.platform.resilience.probe.LiveMeasurementService;
import com.platform.resilience.probe.LiveWindow;
import com.platform.resilience.probe.ProbeCounts;
import com.platform.resilience.probe.WarmupGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.random.RandomGenerator;

/**
 * Orchestrates experiments: chaos series with live measurement, model runs, and comparisons.
 * Chaos windows never overlap; every window-running entry point holds the window lock.
 */
@Slf4j
@Service
public class ExperimentService {
    
    private final FleetInspector fleetInspector;
    private final ChaosExecutor chaosExecutor;
    private final LiveMeasurementService liveMeasurementService;
    private final WarmupGate warmupGate;
    private final DependencyDiscoveryService discoveryService;
    private final ReliabilityEstimator estimator;
    private final StatisticalCorrelator correlator;
    private final ModelMonotonicityCheck monotonicityCheck;
    private final ArtifactStore artifactStore;
    private final EligibilityPolicy eligibilityPolicy;
    private final ExperimentProperties properties;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService measurementScheduler;
    private final ReentrantLock windowLock = new ReentrantLock();
    
    public ExperimentService(
            FleetInspector fleetInspector,
            ChaosExecutor chaosExecutor,
            LiveMeasurementService liveMeasurementService,
            WarmupGate warmupGate,
            DependencyDiscoveryService discoveryService,
            ReliabilityEstimator estimator,
            StatisticalCorrelator correlator,
            ModelMonotonicityCheck monotonicityCheck,
            ArtifactStore artifactStore,
            EligibilityPolicy eligibilityPolicy,
            ExperimentProperties properties,
            ObjectMapper objectMapper,
            @Qualifier("measurementScheduler") ScheduledExecutorService measurementScheduler) {
        this.fleetInspector = fleetInspector;
        this.chaosExecutor = chaosExecutor;
        this.liveMeasurementService = liveMeasurementService;
        this.warmupGate = warmupGate;
        this.discoveryService = discoveryService;
        this.estimator = estimator;
        this.correlator = correlator;
        this.monotonicityCheck = monotonicityCheck;
        this.artifactStore = artifactStore;
        this.eligibilityPolicy = eligibilityPolicy;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.measurementScheduler = measurementScheduler;
    }
    
    public FleetSnapshot inspectFleet() {
        return fleetInspector.inspect();
    }
    
    /**
     * Run {@code windows} sequential chaos windows at failure fraction p, measuring live success
     * during each outage. The first window waits for the warm-up gate.
     */
    public ChaosSeriesResult runChaosSeries(double failureFraction, int windows, SemanticsMode mode) {
        if (windows < 1) {
            throw new ValidationException("windows", windows, "must be at least 1");
        }
        Duration duration = properties.getChaos().getWindowDuration();
        measurementWindow(duration);
        
        String runId = newRunId(failureFraction);
        ChaosWindowLog windowLog = artifactStore.windowLog(runId, failureFraction);
        RandomGenerator random = new SplittableRandom();
        List<WindowOutcome> outcomes = new ArrayList<>();
        
        log.info("Starting chaos series {}: p={} windows={} duration={} law={}", 
            runId, failureFraction, windows, duration, properties.getChaos().getSamplingLaw());
        lock();
        try {
            log.info("Chaos series {} warm-up: {}", runId, awaitWarmup());
            for (int windowId = 0; windowId < windows; windowId++) {
                WindowOutcome outcome = runWindow(runId, windowId, failureFraction, duration, mode, windowLog, random);
                artifactStore.saveLiveWindow(outcome.live());
                outcomes.add(outcome);
            }
        } finally {
            windowLock.unlock();
        }
        
        ChaosSeriesResult result = new ChaosSeriesResult(runId, failureFraction, outcomes);
        log.info("Chaos series {} finished: {} windows, {} anomalous", runId, outcomes.size(), result.anomalousWindows());
        return result;
    }
    
    /**
     * Wait until the system under test serves traffic, using the configured probes.
     */
    public WarmupGate.Signal awaitWarmup() {
        return warmupGate.await(liveMeasurementService.configuredProbes());
    }
    
    /**
     * Run one chaos window and measure live success after the reveal delay.
     */
    public WindowOutcome runWindow(String runId, int windowId, double failureFraction, Duration duration,
                                   SemanticsMode mode, ChaosWindowLog windowLog, RandomGenerator random) {
        Duration measurement = measurementWindow(duration);
        Duration revealDelay = properties.getMeasurement().getRevealDelay();
        SamplingLaw law = properties.getChaos().getSamplingLaw();
        
        CompletableFuture<Map<String, ProbeCounts>> measured = new CompletableFuture<>();
        AtomicReference<ScheduledFuture<?>> scheduled = new AtomicReference<>();
        AtomicReference<Instant> measuredFrom = new AtomicReference<>();
        OutageListener listener = (id, victims, outageStart) -> scheduled.set(measurementScheduler.schedule(() -> {
            try {
                measuredFrom.set(Instant.now());
                measured.complete(liveMeasurementService.measure(measurement));
            } catch (RuntimeException e) {
                measured.completeExceptionally(e);
            }
        }, revealDelay.toMillis(), TimeUnit.MILLISECONDS));
        
        lock();
        ChaosWindow window;
        try {
            FleetSnapshot fleet = fleetInspector.prepareWindow(fleetInspector.inspect());
            window = chaosExecutor.runWindow(
                new ChaosWindowRequest(runId, windowId, failureFraction, duration, law),
                fleet, windowLog, random, listener);
        } catch (RuntimeException e) {
            ScheduledFuture<?> pending = scheduled.get();
            if (pending != null) {
                pending.cancel(true);
            }
            throw e;
        } finally {
            windowLock.unlock();
        }
        
        Map<String, ProbeCounts> counts = awaitMeasurement(measured, windowId);
        LiveWindow live = new LiveWindow(runId, windowId, failureFraction, mode, counts, 
            window.isAnomalous(), measuredFrom.get(), Instant.now());
        return new WindowOutcome(window, live);
    }
    
    /**
     * Measurement length for an outage of the given duration. It starts after the reveal delay
     * and must end before the outage does.
     *
     * @throws ValidationException when no positive measurement window fits inside the outage
     */
    public Duration measurementWindow(Duration outage) {
        Duration revealDelay = properties.getMeasurement().getRevealDelay();
        Duration configured = properties.getMeasurement().getWindow();
        Duration window = configured != null 
            ? configured 
            : outage.minus(revealDelay).minus(properties.getMeasurement().getTailMargin());
        if (window.isNegative() || window.isZero()) {
            throw new ValidationException("measurement.window", window, 
                String.format("must be positive (outage %s, reveal delay %s)", outage, revealDelay));
        }
        if (revealDelay.plus(window).compareTo(outage) >= 0) {
            throw new ValidationException("measurement.window", window, 
                String.format("reveal delay %s plus measurement must be shorter than the outage %s", revealDelay, outage));
        }
        return window;
    }
    
    /**
     * Current dependency graph: from the configured graph file, else discovered from traces.
     */
    public DiscoveryResult loadGraph() {
        String graphPath = properties.getModel().getGraphPath();
        if (graphPath != null && !graphPath.isBlank()) {
            return new DiscoveryResult(GraphJson.read(Paths.get(graphPath), objectMapper), DiscoverySource.GRAPH_FILE, 0, 0);
        }
        return discoveryService.discover();
    }
    
    /**
     * Estimate every declared endpoint, the uniform endpoint mix and the aggregate, under both modes.
     */
    public ModelRunResult runModel(double failureFraction, int trials) {
        DiscoveryResult discovery = loadGraph();
        artifactStore.saveGraph(discovery.graph());
        
        ExperimentProperties.Model model = properties.getModel();
        ReplicaMap replicas = model.getReplicasPath() == null 
            ? ReplicaMap.single() 
            : ReplicaMap.load(Paths.get(model.getReplicasPath()), objectMapper);
        Map<String, TargetSpec> targets = model.getTargetsPath() == null 
            ? new LinkedHashMap<>() 
            : new TargetSpecLoader(objectMapper).load(Paths.get(model.getTargetsPath()));
        SimulationModel simulation = new SimulationModel(discovery.graph(), replicas, 
            eligibilityPolicy.classify(discovery.graph().nodes()));
        SamplingLaw law = properties.getChaos().getSamplingLaw();
        
        log.info("Model run p={} N={} law={} over {} ({} eligible replicas, {} endpoints)", 
            failureFraction, trials, law, discovery.graph(), simulation.populationSize(), targets.size());
        
        List<ModelEstimate> estimates = new ArrayList<>();
        for (SemanticsMode mode : SemanticsMode.values()) {
            for (TargetSpec target : targets.values()) {
                estimates.add(estimator.estimateEndpoint(simulation, target, mode, failureFraction, trials, law));
            }
            if (targets.size() > 1) {
                estimates.add(estimator.estimateUniform(simulation, targets.values(), mode, failureFraction, trials, law));
            }
            estimates.add(estimator.estimateAggregate(simulation, mode, failureFraction, trials, law));
        }
        estimates.forEach(artifactStore::saveModelEstimate);
        
        List<ModelMonotonicityCheck.Violation> warnings = monotonicityCheck.check(artifactStore.loadModelEstimates());
        return new ModelRunResult(failureFraction, discovery.source(), discovery.graph().fingerprint(), estimates, warnings);
    }
    
    /**
     * Compare stored live windows with stored estimates at p, for every window scope.
     *
     * @throws ArtifactNotFoundException when no live window or no estimate exists for p
     */
    public List<ComparisonResult> compare(double failureFraction) {
        List<LiveWindow> windows = artifactStore.loadLiveWindows(failureFraction);
        if (windows.isEmpty()) {
            throw new ArtifactNotFoundException("live windows", "p=" + failureFraction);
        }
        List<ModelEstimate> estimates = artifactStore.loadModelEstimates(failureFraction);
        if (estimates.isEmpty()) {
            throw new ArtifactNotFoundException("model estimates", "p=" + failureFraction);
        }
        
        List<ComparisonResult> results = new ArrayList<>();
        for (WindowScope scope : WindowScope.values()) {
            for (ComparisonResult result : correlator.compare(failureFraction, windows, estimates, scope)) {
                artifactStore.saveComparison(result);
                results.add(result);
            }
        }
        return results;
    }
    
    public List<ChaosWindow> listWindows() {
        return artifactStore.loadChaosWindows();
    }
    
    static String newRunId(double failureFraction) {
        return "p" + failureFraction + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
    
    private void lock() {
        try {
            windowLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Interrupted waiting for the chaos window lock", e);
        }
    }
    
    private Map<String, ProbeCounts> awaitMeasurement(CompletableFuture<Map<String, ProbeCounts>> measured, int windowId) {
        try {
            return measured.get(properties.getMeasurement().getRevealDelay().toMillis() + 30_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Interrupted awaiting live measurement", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ResilienceException) {
                throw (ResilienceException) e.getCause();
            }
            throw new ResilienceException(ErrorCode.PROBE_ERROR, 
                "Live measurement failed for window " + windowId + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new ResilienceException(ErrorCode.PROBE_ERROR, "Live measurement for window " + windowId + " timed out", e);
        }
    }
}
