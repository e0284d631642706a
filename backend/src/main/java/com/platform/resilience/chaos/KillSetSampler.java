package com.platform.resilience.chaos;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Draws kill sets. Single implementation of the kill law for live chaos windows and
 * Monte Carlo trials alike.
 */
public final class KillSetSampler {
    
    private KillSetSampler() {
    }
    
    /**
     * Number of victims under {@link SamplingLaw#FIXED_PROPORTION}.
     * Rounding is half-to-even, so n * p = 2.5 yields 2.
     */
    public static int killCount(int eligible, double failureFraction) {
        if (eligible <= 0 || failureFraction <= 0.0) {
            return 0;
        }
        int k = (int) Math.rint(eligible * failureFraction);
        return Math.min(eligible, Math.max(1, k));
    }
    
    /**
     * Draw a kill set from {@code population}. The returned list is an immutable snapshot.
     */
    public static <T> List<T> sample(List<T> population, double failureFraction, SamplingLaw law, RandomGenerator random) {
        int[] indices = sampleIndices(population.size(), failureFraction, law, random);
        List<T> victims = new ArrayList<>(indices.length);
        for (int index : indices) {
            victims.add(population.get(index));
        }
        return List.copyOf(victims);
    }
    
    /**
     * Draw victim positions in {@code [0, populationSize)}, distinct, in draw order.
     */
    public static int[] sampleIndices(int populationSize, double failureFraction, SamplingLaw law, RandomGenerator random) {
        if (failureFraction < 0.0 || failureFraction > 1.0 || Double.isNaN(failureFraction)) {
            throw new IllegalArgumentException("failure fraction must be within [0, 1]: " + failureFraction);
        }
        if (populationSize <= 0 || failureFraction == 0.0) {
            return new int[0];
        }
        return switch (law) {
            case FIXED_PROPORTION -> drawFixed(populationSize, killCount(populationSize, failureFraction), random);
            case BERNOULLI -> drawBernoulli(populationSize, failureFraction, random);
        };
    }
    
    private static int[] drawFixed(int n, int k, RandomGenerator random) {
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) {
            pool[i] = i;
        }
        // Partial Fisher-Yates: the first k slots end up a uniform k-subset
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        return Arrays.copyOf(pool, k);
    }
    
    private static int[] drawBernoulli(int n, double failureFraction, RandomGenerator random) {
        int[] victims = new int[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < failureFraction) {
                victims[count++] = i;
            }
        }
        return Arrays.copyOf(victims, count);
    }
}
