package com.platform.resilience.fleet;

/**
 * One container observed on the platform.
 *
 * @param name         platform container name
 * @param serviceLabel raw compose service label
 * @param service      normalized service name
 * @param state        lifecycle state at observation time
 */
public record ContainerInstance(
    String name,
    String serviceLabel,
    String service,
    ContainerState state
) {
    public boolean isRunning() {
        return state == ContainerState.RUNNING;
    }
    
    public ContainerInstance withState(ContainerState newState) {
        return new ContainerInstance(name, serviceLabel, service, newState);
    }
}
