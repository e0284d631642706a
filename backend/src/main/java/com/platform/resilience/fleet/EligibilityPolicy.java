package com.platform.resilience.fleet;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which services may be chaos targets.
 *
 * <p>Entrypoints and services matching the built-in infrastructure pattern (proxies, tracing
 * backends, dashboards, brokers) are never eligible; disallowlist entries add further
 * exclusions. A service's eligibility depends only on its own name, never on the population it
 * is classified with, so the fleet and the graph nodes handed to the reliability estimator
 * always agree on every service they share.
 */
public class EligibilityPolicy {
    
    private final Disallowlist disallowlist;
    private final Pattern infrastructurePattern;
    private final Set<String> entrypoints;
    
    public EligibilityPolicy(Disallowlist disallowlist, String infrastructurePattern, Collection<String> entrypoints) {
        this.disallowlist = disallowlist;
        this.infrastructurePattern = Pattern.compile(infrastructurePattern);
        Set<String> normalized = new LinkedHashSet<>();
        entrypoints.forEach(e -> normalized.add(ServiceNames.normalize(e)));
        this.entrypoints = Collections.unmodifiableSet(normalized);
    }
    
    /**
     * Classify a set of normalized service names.
     */
    public Classification classify(Collection<String> services) {
        Map<String, MeshService> classified = new LinkedHashMap<>();
        for (String service : services) {
            ServiceCategory category = categorize(service);
            classified.put(service, new MeshService(service, category, isEligible(service, category)));
        }
        return new Classification(Collections.unmodifiableMap(classified), exclusionSource());
    }
    
    public boolean isEligible(String service) {
        return isEligible(service, categorize(service));
    }
    
    private boolean isEligible(String service, ServiceCategory category) {
        return category == ServiceCategory.APPLICATION && !disallowlist.contains(service);
    }
    
    /**
     * The disallowlist counts as a source once it is configured with entries; the infrastructure
     * pattern applies either way.
     */
    public ExclusionSource exclusionSource() {
        return disallowlist.isEmpty() ? ExclusionSource.INFRASTRUCTURE_PATTERN : ExclusionSource.DISALLOWLIST;
    }
    
    public ServiceCategory categorize(String service) {
        if (entrypoints.contains(service)) {
            return ServiceCategory.ENTRYPOINT;
        }
        if (isInfrastructure(service)) {
            return ServiceCategory.INFRASTRUCTURE;
        }
        return ServiceCategory.APPLICATION;
    }
    
    private boolean isInfrastructure(String service) {
        return infrastructurePattern.matcher(service).find();
    }
    
    public Disallowlist getDisallowlist() {
        return disallowlist;
    }
    
    /**
     * Result of classifying a service population.
     */
    public record Classification(
        Map<String, MeshService> services,
        ExclusionSource source
    ) {
        public boolean isEligible(String service) {
            MeshService s = services.get(service);
            return s != null && s.eligible();
        }
        
        public Set<String> eligibleServices() {
            Set<String> eligible = new LinkedHashSet<>();
            services.values().stream()
                .filter(MeshService::eligible)
                .forEach(s -> eligible.add(s.name()));
            return eligible;
        }
    }
}
