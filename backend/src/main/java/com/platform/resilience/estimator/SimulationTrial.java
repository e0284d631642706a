package com.platform.resilience.estimator;

import java.util.List;

/**
 * One Monte Carlo draw and its outcome.
 *
 * @param killSet  replicas killed in this trial
 * @param mode     semantics the trial was evaluated under
 * @param endpoint endpoint evaluated, {@code null} for aggregate evaluation
 * @param success  whether the request succeeded
 */
public record SimulationTrial(List<ReplicaSlot> killSet, SemanticsMode mode, String endpoint, boolean success) {
    public SimulationTrial {
        killSet = List.copyOf(killSet);
    }
}
