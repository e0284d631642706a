package com.platform.resilience.estimator;

import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read-only simulation inputs shared by every Monte Carlo chunk: the graph, and the replica
 * population of its eligible nodes. Ineligible nodes contribute no replicas and never fail.
 */
public final class SimulationModel {
    
    private final DependencyGraph graph;
    private final ReplicaMap replicas;
    private final List<ReplicaSlot> population;
    private final int[] slotNode;
    private final int[] replicasPerNode;
    
    public SimulationModel(DependencyGraph graph, ReplicaMap replicas, EligibilityPolicy.Classification eligibility) {
        this.graph = graph;
        this.replicas = replicas;
        List<ReplicaSlot> slots = new ArrayList<>();
        List<Integer> nodes = new ArrayList<>();
        this.replicasPerNode = new int[graph.size()];
        for (int i = 0; i < graph.size(); i++) {
            String service = graph.nodeAt(i);
            if (!eligibility.isEligible(service)) {
                continue;
            }
            int count = replicas.replicas(service);
            replicasPerNode[i] = count;
            for (int r = 0; r < count; r++) {
                slots.add(new ReplicaSlot(service, r));
                nodes.add(i);
            }
        }
        this.population = List.copyOf(slots);
        this.slotNode = nodes.stream().mapToInt(Integer::intValue).toArray();
    }
    
    public DependencyGraph graph() {
        return graph;
    }
    
    public ReplicaMap replicas() {
        return replicas;
    }
    
    public List<ReplicaSlot> population() {
        return population;
    }
    
    public int populationSize() {
        return slotNode.length;
    }
    
    /**
     * Liveness per node after killing the given population slots.
     */
    boolean[] aliveAfter(int[] killedSlots, int[] survivorsScratch, boolean[] aliveScratch) {
        System.arraycopy(replicasPerNode, 0, survivorsScratch, 0, replicasPerNode.length);
        Arrays.fill(aliveScratch, true);
        for (int slot : killedSlots) {
            int node = slotNode[slot];
            if (--survivorsScratch[node] == 0) {
                aliveScratch[node] = false;
            }
        }
        return aliveScratch;
    }
}
