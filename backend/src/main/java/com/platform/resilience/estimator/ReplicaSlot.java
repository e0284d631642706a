package com.platform.resilience.estimator;

/**
 * One replica of a service in the simulated kill population.
 */
public record ReplicaSlot(String service, int index) {
}
