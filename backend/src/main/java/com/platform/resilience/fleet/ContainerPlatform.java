package com.platform.resilience.fleet;

import com.platform.resilience.error.PlatformOperationException;

import java.util.List;
import java.util.Optional;

/**
 * Container platform operations needed by the chaos executor.
 * Every per-container operation may fail independently with {@link PlatformOperationException}.
 */
public interface ContainerPlatform {
    
    /**
     * List the fleet's containers, including stopped ones, with their service label and state.
     */
    List<ContainerInstance> listContainers();
    
    /**
     * Stop a container, allowing {@code graceSeconds} before it is killed.
     */
    void stop(String container, int graceSeconds);
    
    /**
     * Start a stopped container.
     */
    void start(String container);
    
    /**
     * Current lifecycle state of a container.
     */
    ContainerState inspectState(String container);
    
    /**
     * Logical service label of a container, empty when the container carries none.
     */
    Optional<String> serviceLabel(String container);
    
    /**
     * Replace the container's restart policy ("no", "unless-stopped", ...).
     */
    void updateRestartPolicy(String container, String policy);
}
