package com.platform.resilience.correlation;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.Arrays;
import java.util.random.RandomGenerator;

/**
 * Statistics for comparing model predictions against live measurements.
 */
public final class BiasStatistics {
    
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);
    
    private BiasStatistics() {
    }
    
    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
    
    public static double weightedMean(double[] values, double[] weights) {
        double sum = 0.0;
        double total = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
            total += weights[i];
        }
        return total == 0.0 ? Double.NaN : sum / total;
    }
    
    /**
     * Percentile bootstrap interval of the mean. Bounds are read at indices
     * {@code floor(alpha/2 * B)} and {@code min(B-1, floor((1-alpha/2) * B))} of the sorted
     * resample means.
     *
     * @return {@code null} for an empty sample
     */
    public static ConfidenceInterval bootstrapMeanCi(double[] values, int resamples, double alpha, RandomGenerator random) {
        if (values.length == 0 || resamples < 1) {
            return null;
        }
        int n = values.length;
        double[] means = new double[resamples];
        for (int b = 0; b < resamples; b++) {
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                sum += values[random.nextInt(n)];
            }
            means[b] = sum / n;
        }
        return percentileInterval(means, alpha);
    }
    
    /**
     * Percentile bootstrap interval of the weighted mean {@code sum(w*x) / sum(w)}. Each resample
     * draws (value, weight) pairs together and recomputes the weighted mean over the draw, so the
     * interval describes the same statistic as {@link #weightedMean}.
     *
     * @param weights strictly positive, one per value
     * @return {@code null} for an empty sample
     */
    public static ConfidenceInterval weightedBootstrapMeanCi(double[] values, double[] weights, int resamples,
                                                             double alpha, RandomGenerator random) {
        if (values.length != weights.length) {
            throw new IllegalArgumentException("values and weights differ in length");
        }
        if (values.length == 0 || resamples < 1) {
            return null;
        }
        for (double w : weights) {
            if (!(w > 0.0)) {
                throw new IllegalArgumentException("weights must be positive, got " + w);
            }
        }
        int n = values.length;
        double[] means = new double[resamples];
        for (int b = 0; b < resamples; b++) {
            double sum = 0.0;
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                int pick = random.nextInt(n);
                sum += values[pick] * weights[pick];
                total += weights[pick];
            }
            means[b] = sum / total;
        }
        return percentileInterval(means, alpha);
    }
    
    private static ConfidenceInterval percentileInterval(double[] estimates, double alpha) {
        Arrays.sort(estimates);
        int resamples = estimates.length;
        int lower = (int) ((alpha / 2) * resamples);
        int upper = Math.min(resamples - 1, (int) ((1 - alpha / 2) * resamples));
        return new ConfidenceInterval(estimates[lower], estimates[upper]);
    }
    
    /**
     * Paired Wilcoxon signed-rank test with normal approximation.
     * Zero differences are dropped, tied magnitudes share their average rank and the variance is
     * tie-corrected by {@code sum(t^3 - t) / 48}.
     *
     * @return {@code null} when no non-zero difference remains or the variance is not positive
     */
    public static SignedRankResult wilcoxonSignedRank(double[] x, double[] y) {
        int pairs = Math.min(x.length, y.length);
        double[] diffs = new double[pairs];
        int n = 0;
        for (int i = 0; i < pairs; i++) {
            double d = x[i] - y[i];
            if (d != 0.0) {
                diffs[n++] = d;
            }
        }
        if (n == 0) {
            return null;
        }
        diffs = Arrays.copyOf(diffs, n);
        double[] magnitudes = new double[n];
        for (int i = 0; i < n; i++) {
            magnitudes[i] = Math.abs(diffs[i]);
        }
        double[] ranks = new NaturalRanking(NaNStrategy.FIXED, TiesStrategy.AVERAGE).rank(magnitudes);
        
        double positive = 0.0;
        double negative = 0.0;
        for (int i = 0; i < n; i++) {
            if (diffs[i] > 0) {
                positive += ranks[i];
            } else {
                negative += ranks[i];
            }
        }
        double w = Math.min(positive, negative);
        double mean = n * (n + 1) / 4.0;
        double variance = n * (n + 1) * (2.0 * n + 1) / 24.0 - tieCorrection(magnitudes);
        if (variance <= 0.0) {
            return null;
        }
        double z = (w - mean) / Math.sqrt(variance);
        double p = 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(z));
        return new SignedRankResult(w, z, Math.min(1.0, p), n);
    }
    
    private static double tieCorrection(double[] magnitudes) {
        double[] sorted = magnitudes.clone();
        Arrays.sort(sorted);
        double correction = 0.0;
        int i = 0;
        while (i < sorted.length) {
            int j = i;
            while (j < sorted.length && sorted[j] == sorted[i]) {
                j++;
            }
            long t = j - i;
            if (t > 1) {
                correction += t * (t * t - 1);
            }
            i = j;
        }
        return correction / 48.0;
    }
    
    /**
     * Cliff's delta: P(x > y) - P(x < y) over all pairs.
     *
     * @return {@code null} when either sample is empty
     */
    public static Double cliffsDelta(double[] x, double[] y) {
        if (x.length == 0 || y.length == 0) {
            return null;
        }
        long dominance = 0;
        for (double a : x) {
            for (double b : y) {
                if (a > b) {
                    dominance++;
                } else if (a < b) {
                    dominance--;
                }
            }
        }
        return (double) dominance / ((long) x.length * y.length);
    }
    
    /**
     * Share of strictly positive values.
     */
    public static double sharePositive(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        int positive = 0;
        for (double v : values) {
            if (v > 0) {
                positive++;
            }
        }
        return (double) positive / values.length;
    }
}
