package com.platform.resilience.correlation;

import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.estimator.ModelEstimate;
import com.platform.resilience.estimator.SemanticsMode;
import com.platform.resilience.probe.LiveWindow;
import com.platform.resilience.probe.ProbeCounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Compares blocking and non-blocking model estimates with live success rates.
 * 
 * Endpoints without live samples or without an estimate for both modes are omitted.
 */
@Slf4j
@Component
public class StatisticalCorrelator {
    
    private final ExperimentProperties properties;
    
    public StatisticalCorrelator(ExperimentProperties properties) {
        this.properties = properties;
    }
    
    public List<ComparisonResult> compare(double failureFraction, List<LiveWindow> windows, 
                                          List<ModelEstimate> estimates, WindowScope scope) {
        return compare(failureFraction, windows, estimates, scope, new SplittableRandom());
    }
    
    /**
     * Compare per endpoint and for the probe-weighted mix.
     *
     * @throws ResilienceException with {@link ErrorCode#GRAPH_MISMATCH} when the estimates were
     *         computed over different graphs
     */
    public List<ComparisonResult> compare(double failureFraction, List<LiveWindow> windows,
                                          List<ModelEstimate> estimates, WindowScope scope, RandomGenerator random) {
        String graphHash = commonGraphHash(estimates);
        
        Map<SemanticsMode, Map<String, Double>> models = new EnumMap<>(SemanticsMode.class);
        for (SemanticsMode mode : SemanticsMode.values()) {
            models.put(mode, new LinkedHashMap<>());
        }
        for (ModelEstimate estimate : estimates) {
            if (estimate.failureFraction() == failureFraction && !estimate.isAggregate() 
                    && !ModelEstimate.UNIFORM_ENDPOINT.equals(estimate.endpoint())) {
                models.get(estimate.mode()).put(estimate.endpoint(), estimate.mean());
            }
        }
        
        List<LiveWindow> selected = new ArrayList<>();
        Set<String> endpoints = new LinkedHashSet<>();
        for (LiveWindow window : windows) {
            if (window.failureFraction() == failureFraction && scope.includes(window)) {
                selected.add(window);
                endpoints.addAll(window.endpoints().keySet());
            }
        }
        
        List<ComparisonResult> results = new ArrayList<>();
        Map<String, double[]> comparable = new LinkedHashMap<>();
        for (String endpoint : endpoints) {
            Double blocking = models.get(SemanticsMode.BLOCKING).get(endpoint);
            Double nonBlocking = models.get(SemanticsMode.NON_BLOCKING).get(endpoint);
            if (blocking == null || nonBlocking == null) {
                log.debug("Omitting {} at p={} ({}): missing model estimate", endpoint, failureFraction, scope);
                continue;
            }
            comparable.put(endpoint, new double[]{blocking, nonBlocking});
            
            List<Double> live = new ArrayList<>();
            for (LiveWindow window : selected) {
                ProbeCounts counts = window.countsFor(endpoint);
                if (counts.hasSamples()) {
                    live.add(counts.rate());
                }
            }
            if (live.isEmpty()) {
                log.debug("Omitting {} at p={} ({}): no live samples", endpoint, failureFraction, scope);
                continue;
            }
            double[] liveRates = live.stream().mapToDouble(Double::doubleValue).toArray();
            double[] blockingModel = filled(liveRates.length, blocking);
            double[] nonBlockingModel = filled(liveRates.length, nonBlocking);
            results.add(summarize(endpoint, failureFraction, scope, graphHash, liveRates, 
                blockingModel, nonBlockingModel, null, random));
        }
        
        ComparisonResult mix = mix(failureFraction, scope, graphHash, selected, comparable, random);
        if (mix != null) {
            results.add(mix);
        }
        return results;
    }
    
    private ComparisonResult mix(double failureFraction, WindowScope scope, String graphHash,
                                 List<LiveWindow> windows, Map<String, double[]> models, RandomGenerator random) {
        if (models.isEmpty()) {
            return null;
        }
        List<double[]> rows = new ArrayList<>();
        for (LiveWindow window : windows) {
            long total = 0;
            long ok = 0;
            double blocking = 0.0;
            double nonBlocking = 0.0;
            for (Map.Entry<String, double[]> entry : models.entrySet()) {
                ProbeCounts counts = window.countsFor(entry.getKey());
                total += counts.total();
                ok += counts.ok();
                blocking += counts.total() * entry.getValue()[0];
                nonBlocking += counts.total() * entry.getValue()[1];
            }
            if (total > 0) {
                rows.add(new double[]{(double) ok / total, blocking / total, nonBlocking / total, total});
            }
        }
        if (rows.isEmpty()) {
            log.debug("Omitting mix at p={} ({}): no live samples", failureFraction, scope);
            return null;
        }
        int n = rows.size();
        double[] live = new double[n];
        double[] blocking = new double[n];
        double[] nonBlocking = new double[n];
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            live[i] = rows.get(i)[0];
            blocking[i] = rows.get(i)[1];
            nonBlocking[i] = rows.get(i)[2];
            weights[i] = rows.get(i)[3];
        }
        return summarize(ComparisonResult.MIX, failureFraction, scope, graphHash, live, blocking, nonBlocking, weights, random);
    }
    
    private ComparisonResult summarize(String key, double failureFraction, WindowScope scope, String graphHash,
                                       double[] live, double[] blockingModel, double[] nonBlockingModel,
                                       double[] weights, RandomGenerator random) {
        int n = live.length;
        double[] biasBlocking = new double[n];
        double[] biasNonBlocking = new double[n];
        double[] absBlocking = new double[n];
        double[] absNonBlocking = new double[n];
        double[] delta = new double[n];
        for (int i = 0; i < n; i++) {
            biasBlocking[i] = blockingModel[i] - live[i];
            biasNonBlocking[i] = nonBlockingModel[i] - live[i];
            absBlocking[i] = Math.abs(biasBlocking[i]);
            absNonBlocking[i] = Math.abs(biasNonBlocking[i]);
            delta[i] = absBlocking[i] - absNonBlocking[i];
        }
        
        int resamples = properties.getMeasurement().getBootstrapResamples();
        double alpha = properties.getMeasurement().getAlpha();
        
        ModeBias blocking = new ModeBias(
            average(blockingModel, weights),
            average(biasBlocking, weights),
            interval(biasBlocking, weights, resamples, alpha, random),
            average(absBlocking, weights));
        ModeBias nonBlocking = new ModeBias(
            average(nonBlockingModel, weights),
            average(biasNonBlocking, weights),
            interval(biasNonBlocking, weights, resamples, alpha, random),
            average(absNonBlocking, weights));
        
        ComparisonResult result = new ComparisonResult(
            key,
            failureFraction,
            scope,
            n,
            graphHash,
            average(live, weights),
            blocking,
            nonBlocking,
            average(delta, weights),
            interval(delta, weights, resamples, alpha, random),
            BiasStatistics.sharePositive(delta),
            BiasStatistics.wilcoxonSignedRank(absBlocking, absNonBlocking),
            BiasStatistics.cliffsDelta(absBlocking, absNonBlocking));
        
        log.info("Comparison {} p={} scope={} windows={}: live={} bias(block)={} bias(async)={} delta={}",
            key, failureFraction, scope.label(), n,
            format(result.meanLive()), format(blocking.meanBias()), format(nonBlocking.meanBias()), format(result.meanDelta()));
        return result;
    }
    
    /**
     * The single graph fingerprint shared by all estimates, {@code null} if none carries one.
     */
    static String commonGraphHash(List<ModelEstimate> estimates) {
        String hash = null;
        for (ModelEstimate estimate : estimates) {
            if (estimate.graphHash() == null) {
                continue;
            }
            if (hash == null) {
                hash = estimate.graphHash();
            } else if (!hash.equals(estimate.graphHash())) {
                throw new ResilienceException(ErrorCode.GRAPH_MISMATCH, 
                    String.format("Graph hash mismatch between estimates: %s vs %s", hash, estimate.graphHash()));
            }
        }
        return hash;
    }
    
    private static double average(double[] values, double[] weights) {
        return weights == null ? BiasStatistics.mean(values) : BiasStatistics.weightedMean(values, weights);
    }
    
    private static ConfidenceInterval interval(double[] values, double[] weights, int resamples,
                                               double alpha, RandomGenerator random) {
        return weights == null
            ? BiasStatistics.bootstrapMeanCi(values, resamples, alpha, random)
            : BiasStatistics.weightedBootstrapMeanCi(values, weights, resamples, alpha, random);
    }
    
    private static double[] filled(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }
    
    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
