package com.platform.resilience.fleet;

import com.platform.resilience.error.PlatformOperationException;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps logical services to their containers and partitions them by chaos eligibility.
 */
@Slf4j
@Component
public class FleetInspector {
    
    private final ContainerPlatform platform;
    private final EligibilityPolicy eligibilityPolicy;
    private final MetricsRegistry metricsRegistry;
    
    public FleetInspector(ContainerPlatform platform, EligibilityPolicy eligibilityPolicy, MetricsRegistry metricsRegistry) {
        this.platform = platform;
        this.eligibilityPolicy = eligibilityPolicy;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Enumerate the fleet and classify every container.
     * A platform failure yields an empty snapshot; the window then runs as a no-op.
     */
    public FleetSnapshot inspect() {
        List<ContainerInstance> containers;
        try {
            containers = platform.listContainers();
        } catch (PlatformOperationException e) {
            log.warn("Fleet enumeration failed, treating fleet as empty: {}", e.getMessage());
            metricsRegistry.recordPlatformFailure("ps");
            return FleetSnapshot.empty();
        }
        
        Set<String> services = new LinkedHashSet<>();
        containers.forEach(c -> services.add(c.service()));
        EligibilityPolicy.Classification classification = eligibilityPolicy.classify(services);
        
        List<ContainerInstance> eligible = new ArrayList<>();
        List<ContainerInstance> excluded = new ArrayList<>();
        for (ContainerInstance container : containers) {
            if (classification.isEligible(container.service())) {
                eligible.add(container);
            } else {
                excluded.add(container);
            }
        }
        
        if (eligible.isEmpty()) {
            log.warn("No chaos-eligible containers among {} observed (exclusion by {})", 
                containers.size(), classification.source());
        } else {
            log.info("Fleet: {} eligible, {} excluded (exclusion by {})", 
                eligible.size(), excluded.size(), classification.source());
        }
        return new FleetSnapshot(eligible, excluded, classification.services(), classification.source());
    }
    
    /**
     * Restart every eligible container that is not running so the window samples from the full
     * population. Containers that cannot be restored are dropped from this window's eligible set.
     */
    public FleetSnapshot prepareWindow(FleetSnapshot snapshot) {
        List<ContainerInstance> ready = new ArrayList<>();
        for (ContainerInstance container : snapshot.eligible()) {
            if (container.isRunning()) {
                ready.add(container);
                continue;
            }
            try {
                log.info("Restoring eligible container {} (state {}) before window", 
                    container.name(), container.state());
                platform.start(container.name());
                ContainerState state = platform.inspectState(container.name());
                if (state == ContainerState.RUNNING) {
                    ready.add(container.withState(state));
                } else {
                    log.warn("Container {} still {} after restart, dropping from window", container.name(), state);
                }
            } catch (PlatformOperationException e) {
                log.warn("Failed to restore {} before window, dropping from window: {}", 
                    container.name(), e.getMessage());
                metricsRegistry.recordPlatformFailure(e.getOperation());
            }
        }
        return snapshot.withEligible(ready);
    }
}
