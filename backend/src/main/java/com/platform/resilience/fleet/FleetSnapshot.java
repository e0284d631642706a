package com.platform.resilience.fleet;

import java.util.List;
import java.util.Map;

/**
 * Fleet partitioned into chaos-eligible and excluded containers at one point in time.
 */
public record FleetSnapshot(
    List<ContainerInstance> eligible,
    List<ContainerInstance> excluded,
    Map<String, MeshService> services,
    ExclusionSource exclusionSource
) {
    public FleetSnapshot {
        eligible = List.copyOf(eligible);
        excluded = List.copyOf(excluded);
        services = Map.copyOf(services);
    }
    
    public static FleetSnapshot empty() {
        return new FleetSnapshot(List.of(), List.of(), Map.of(), ExclusionSource.INFRASTRUCTURE_PATTERN);
    }
    
    public int eligibleCount() {
        return eligible.size();
    }
    
    public FleetSnapshot withEligible(List<ContainerInstance> newEligible) {
        return new FleetSnapshot(newEligible, excluded, services, exclusionSource);
    }
}
