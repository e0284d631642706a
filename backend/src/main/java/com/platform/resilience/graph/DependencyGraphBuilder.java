package com.platform.resilience.graph;

import com.platform.resilience.fleet.ServiceNames;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a {@link DependencyGraph} from observed calls.
 * 
 * Names are normalized; self-loops and infrastructure services are dropped. Broker hops
 * ({@code A -> broker -> B}) collapse into a single async edge {@code A -> B}; brokers never
 * become nodes. An edge stays async only if it was never observed as a direct synchronous call.
 */
@Slf4j
public class DependencyGraphBuilder {
    
    private final Set<String> brokers;
    private final Set<String> skipped;
    private final List<String> domainSuffixes;
    
    public DependencyGraphBuilder(Collection<String> brokers, Collection<String> skipped, List<String> domainSuffixes) {
        this.domainSuffixes = List.copyOf(domainSuffixes);
        this.brokers = normalizeAll(brokers);
        this.skipped = normalizeAll(skipped);
    }
    
    public DependencyGraph build(Collection<ObservedCall> calls, Collection<String> entrypoints) {
        Map<String, EdgeObservation> observations = new HashMap<>();
        Map<String, Set<String>> producers = new HashMap<>();
        Map<String, Set<String>> consumers = new HashMap<>();
        
        for (ObservedCall call : calls) {
            String caller = normalize(call.caller());
            String callee = normalize(call.callee());
            if (caller.isEmpty() || callee.isEmpty() || caller.equals(callee)) {
                continue;
            }
            if (brokers.contains(callee) && !brokers.contains(caller)) {
                producers.computeIfAbsent(callee, b -> new LinkedHashSet<>()).add(caller);
                continue;
            }
            if (brokers.contains(caller) && !brokers.contains(callee)) {
                consumers.computeIfAbsent(caller, b -> new LinkedHashSet<>()).add(callee);
                continue;
            }
            if (brokers.contains(caller) || isSkipped(caller) || isSkipped(callee)) {
                continue;
            }
            observations.computeIfAbsent(caller + "\u0000" + callee, k -> new EdgeObservation(caller, callee))
                .record(call.transport());
        }
        
        int collapsed = 0;
        for (Map.Entry<String, Set<String>> entry : producers.entrySet()) {
            for (String producer : entry.getValue()) {
                for (String consumer : consumers.getOrDefault(entry.getKey(), Set.of())) {
                    if (producer.equals(consumer) || isSkipped(producer) || isSkipped(consumer)) {
                        continue;
                    }
                    observations.computeIfAbsent(producer + "\u0000" + consumer, k -> new EdgeObservation(producer, consumer))
                        .record(Transport.ASYNC);
                    collapsed++;
                }
            }
        }
        
        Set<String> nodes = new TreeSet<>();
        List<DependencyEdge> edges = new ArrayList<>();
        for (EdgeObservation observation : observations.values()) {
            nodes.add(observation.caller);
            nodes.add(observation.callee);
            edges.add(new DependencyEdge(observation.caller, observation.callee, 
                observation.sawSync ? Transport.SYNC : Transport.ASYNC));
        }
        
        List<String> entries = new ArrayList<>();
        for (String entry : entrypoints) {
            String name = normalize(entry);
            if (nodes.contains(name)) {
                entries.add(name);
            }
        }
        
        DependencyGraph graph = new DependencyGraph(nodes, edges, entries);
        log.info("Built {} from {} observed calls ({} broker hops collapsed)", graph, calls.size(), collapsed);
        return graph;
    }
    
    private boolean isSkipped(String service) {
        return skipped.contains(service) || brokers.contains(service);
    }
    
    private String normalize(String label) {
        return ServiceNames.normalize(label, domainSuffixes);
    }
    
    private Set<String> normalizeAll(Collection<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            result.add(normalize(name));
        }
        return result;
    }
    
    private static final class EdgeObservation {
        private final String caller;
        private final String callee;
        private boolean sawSync;
        
        EdgeObservation(String caller, String callee) {
            this.caller = caller;
            this.callee = callee;
        }
        
        void record(Transport transport) {
            if (transport != Transport.ASYNC) {
                sawSync = true;
            }
        }
    }
}
