package com.platform.resilience.estimator;

import com.platform.resilience.chaos.KillSetSampler;
import com.platform.resilience.chaos.SamplingLaw;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.observability.LoggingConfig;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.random.RandomGenerator;

/**
 * Monte Carlo estimator of request success probability under random replica failure.
 * 
 * Trials are split into chunks executed on the simulation pool. Each chunk draws from its own
 * {@link SplittableRandom}, split from an unseeded root, and shares only read-only inputs.
 */
@Slf4j
@Service
public class ReliabilityEstimator {
    
    private final ExecutorService simulationExecutor;
    private final ExperimentProperties properties;
    private final MetricsRegistry metricsRegistry;
    
    public ReliabilityEstimator(
            @Qualifier("simulationExecutor") ExecutorService simulationExecutor,
            ExperimentProperties properties,
            MetricsRegistry metricsRegistry) {
        this.simulationExecutor = simulationExecutor;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Estimate success of one endpoint.
     */
    public ModelEstimate estimateEndpoint(SimulationModel model, TargetSpec target, SemanticsMode mode,
                                          double failureFraction, int trials, SamplingLaw law) {
        EndpointEvaluator evaluator = EndpointEvaluator.compile(model.graph(), target, mode);
        return estimate(model, List.of(evaluator), target.endpoint(), mode, failureFraction, trials, law);
    }
    
    /**
     * Estimate success when each trial targets an endpoint drawn uniformly from {@code targets}.
     */
    public ModelEstimate estimateUniform(SimulationModel model, Collection<TargetSpec> targets, SemanticsMode mode,
                                         double failureFraction, int trials, SamplingLaw law) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("at least one target is required");
        }
        List<TrialEvaluator> evaluators = new ArrayList<>();
        for (TargetSpec target : targets) {
            evaluators.add(EndpointEvaluator.compile(model.graph(), target, mode));
        }
        return estimate(model, evaluators, ModelEstimate.UNIFORM_ENDPOINT, mode, failureFraction, trials, law);
    }
    
    /**
     * Estimate aggregate success: some entrypoint reaches an alive sink.
     */
    public ModelEstimate estimateAggregate(SimulationModel model, SemanticsMode mode, double failureFraction, 
                                           int trials, SamplingLaw law) {
        AggregateEvaluator evaluator = AggregateEvaluator.compile(model.graph(), mode,
            properties.getModel().getEntrypoints(), properties.getModel().getSinks());
        return estimate(model, List.of(evaluator), null, mode, failureFraction, trials, law);
    }
    
    /**
     * Draw and evaluate a single trial.
     */
    public SimulationTrial simulateTrial(SimulationModel model, TrialEvaluator evaluator, SemanticsMode mode,
                                         double failureFraction, SamplingLaw law, RandomGenerator random) {
        int[] killed = KillSetSampler.sampleIndices(model.populationSize(), failureFraction, law, random);
        boolean[] alive = model.aliveAfter(killed, new int[model.graph().size()], new boolean[model.graph().size()]);
        List<ReplicaSlot> killSet = new ArrayList<>(killed.length);
        for (int slot : killed) {
            killSet.add(model.population().get(slot));
        }
        return new SimulationTrial(killSet, mode, evaluator.endpoint(), evaluator.evaluate(alive));
    }
    
    private ModelEstimate estimate(SimulationModel model, List<TrialEvaluator> evaluators, String label,
                                   SemanticsMode mode, double failureFraction, int trials, SamplingLaw law) {
        if (failureFraction < 0.0 || failureFraction > 1.0 || Double.isNaN(failureFraction)) {
            throw new IllegalArgumentException("failure fraction must be within [0, 1]: " + failureFraction);
        }
        if (trials < 1) {
            throw new IllegalArgumentException("trial count must be positive: " + trials);
        }
        
        LoggingConfig.setModelContext(mode.getLabel(), failureFraction);
        Instant start = Instant.now();
        try {
            int chunks = Math.min(trials, Math.max(1, properties.getModel().getParallelism()));
            SplittableRandom root = new SplittableRandom();
            List<Future<Long>> futures = new ArrayList<>(chunks);
            for (int c = 0; c < chunks; c++) {
                int chunkTrials = trials / chunks + (c < trials % chunks ? 1 : 0);
                SplittableRandom random = root.split();
                futures.add(simulationExecutor.submit(
                    () -> runChunk(model, evaluators, failureFraction, law, chunkTrials, random)));
            }
            
            long successes = 0;
            for (Future<Long> future : futures) {
                successes += await(future, futures);
            }
            
            ModelEstimate estimate = ModelEstimate.of(label, mode, failureFraction, trials, successes, law, 
                model.graph().fingerprint());
            metricsRegistry.recordSimulation(mode.getLabel(), trials, successes);
            metricsRegistry.recordDuration("model.estimate", Duration.between(start, Instant.now()));
            log.info("Model {} mode={} p={} law={}: R={} (N={}, sd={})", 
                label == null ? "aggregate" : label, mode.getLabel(), failureFraction, law,
                String.format("%.4f", estimate.mean()), trials, String.format("%.4f", estimate.stdDev()));
            return estimate;
        } finally {
            LoggingConfig.clearModelContext();
        }
    }
    
    private static long runChunk(SimulationModel model, List<TrialEvaluator> evaluators, double failureFraction,
                                 SamplingLaw law, int trials, SplittableRandom random) {
        int nodes = model.graph().size();
        int[] survivors = new int[nodes];
        boolean[] alive = new boolean[nodes];
        long successes = 0;
        for (int t = 0; t < trials; t++) {
            int[] killed = KillSetSampler.sampleIndices(model.populationSize(), failureFraction, law, random);
            model.aliveAfter(killed, survivors, alive);
            TrialEvaluator evaluator = evaluators.size() == 1 
                ? evaluators.get(0) 
                : evaluators.get(random.nextInt(evaluators.size()));
            if (evaluator.evaluate(alive)) {
                successes++;
            }
        }
        return successes;
    }
    
    private static long await(Future<Long> future, List<Future<Long>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(f -> f.cancel(true));
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Simulation interrupted", e);
        } catch (ExecutionException e) {
            all.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof ResilienceException) {
                throw (ResilienceException) cause;
            }
            throw new ResilienceException(ErrorCode.INTERNAL_ERROR, "Simulation chunk failed: " + cause.getMessage(), cause);
        }
    }
}
