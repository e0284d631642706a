package com.platform.resilience.graph;

import com.platform.resilience.error.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntPredicate;

/**
 * Immutable service dependency graph. Async edges are a tagged subset of the edges, so both
 * failure semantics see the same nodes and edges.
 * 
 * Nodes are held in sorted order and addressed by index for the simulation hot path.
 */
public final class DependencyGraph {
    
    private final List<String> nodes;
    private final Map<String, Integer> index;
    private final List<DependencyEdge> edges;
    private final List<String> entrypoints;
    private final int[][] adjacency;
    private final int[][] syncAdjacency;
    
    public DependencyGraph(Collection<String> nodes, Collection<DependencyEdge> edges, Collection<String> entrypoints) {
        this.nodes = List.copyOf(new TreeSet<>(nodes));
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            idx.put(this.nodes.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
        
        Map<String, DependencyEdge> unique = new HashMap<>();
        for (DependencyEdge edge : edges) {
            if (!idx.containsKey(edge.caller())) {
                throw ValidationException.unknownService(edge.caller(), "edge " + edge.caller() + "->" + edge.callee());
            }
            if (!idx.containsKey(edge.callee())) {
                throw ValidationException.unknownService(edge.callee(), "edge " + edge.caller() + "->" + edge.callee());
            }
            unique.merge(edge.caller() + "\u0000" + edge.callee(), edge,
                (a, b) -> a.isAsync() && b.isAsync() ? a : new DependencyEdge(a.caller(), a.callee(), Transport.SYNC));
        }
        this.edges = List.copyOf(new TreeSet<>(unique.values()));
        
        Set<String> entries = new LinkedHashSet<>();
        for (String entry : entrypoints) {
            if (idx.containsKey(entry)) {
                entries.add(entry);
            }
        }
        this.entrypoints = List.copyOf(entries);
        
        this.adjacency = buildAdjacency(false);
        this.syncAdjacency = buildAdjacency(true);
    }
    
    private int[][] buildAdjacency(boolean syncOnly) {
        List<List<Integer>> lists = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            lists.add(new ArrayList<>());
        }
        for (DependencyEdge edge : edges) {
            if (syncOnly && edge.isAsync()) {
                continue;
            }
            lists.get(index.get(edge.caller())).add(index.get(edge.callee()));
        }
        int[][] result = new int[nodes.size()][];
        for (int i = 0; i < result.length; i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }
    
    public List<String> nodes() {
        return nodes;
    }
    
    public List<DependencyEdge> edges() {
        return edges;
    }
    
    public List<DependencyEdge> asyncEdges() {
        return edges.stream().filter(DependencyEdge::isAsync).toList();
    }
    
    public List<String> entrypoints() {
        return entrypoints;
    }
    
    public int size() {
        return nodes.size();
    }
    
    public boolean contains(String service) {
        return index.containsKey(service);
    }
    
    /**
     * Index of a node, or -1 when absent.
     */
    public int indexOf(String service) {
        Integer i = index.get(service);
        return i == null ? -1 : i;
    }
    
    public String nodeAt(int i) {
        return nodes.get(i);
    }
    
    /**
     * Successor indices of a node, optionally ignoring async edges.
     */
    public int[] successors(int node, boolean excludeAsync) {
        return excludeAsync ? syncAdjacency[node] : adjacency[node];
    }
    
    /**
     * Nodes reachable from {@code entry} through alive nodes. The entry itself counts only when alive.
     *
     * @param entry        start node index
     * @param alive        liveness per node index; {@code null} treats every node as alive
     * @param excludeAsync ignore async edges
     */
    public boolean[] reachable(int entry, IntPredicate alive, boolean excludeAsync) {
        boolean[] seen = new boolean[nodes.size()];
        if (entry < 0 || entry >= nodes.size() || (alive != null && !alive.test(entry))) {
            return seen;
        }
        int[][] adj = excludeAsync ? syncAdjacency : adjacency;
        Deque<Integer> queue = new ArrayDeque<>();
        seen[entry] = true;
        queue.add(entry);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (int v : adj[u]) {
                if (!seen[v] && (alive == null || alive.test(v))) {
                    seen[v] = true;
                    queue.add(v);
                }
            }
        }
        return seen;
    }
    
    /**
     * Names reachable from {@code entry} when every node is alive.
     */
    public Set<String> reachableFrom(String entry, boolean excludeAsync) {
        boolean[] seen = reachable(indexOf(entry), null, excludeAsync);
        Set<String> result = new TreeSet<>();
        for (int i = 0; i < seen.length; i++) {
            if (seen[i]) {
                result.add(nodes.get(i));
            }
        }
        return result;
    }
    
    /**
     * Nodes without outgoing edges under the given edge set.
     */
    public boolean[] leaves(boolean excludeAsync) {
        int[][] adj = excludeAsync ? syncAdjacency : adjacency;
        boolean[] leaves = new boolean[nodes.size()];
        for (int i = 0; i < adj.length; i++) {
            leaves[i] = adj[i].length == 0;
        }
        return leaves;
    }
    
    /**
     * SHA-256 over the canonical node list, edge list and async subset. Equal graphs always
     * produce equal fingerprints regardless of construction order.
     */
    public String fingerprint() {
        StringBuilder canonical = new StringBuilder();
        canonical.append("nodes:");
        nodes.forEach(n -> canonical.append(n).append(','));
        canonical.append("\nedges:");
        edges.forEach(e -> canonical.append(e.caller()).append("->").append(e.callee()).append(','));
        canonical.append("\nasync:");
        edges.stream().filter(DependencyEdge::isAsync)
            .forEach(e -> canonical.append(e.caller()).append("->").append(e.callee()).append(','));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    @Override
    public String toString() {
        return String.format("DependencyGraph{nodes=%d, edges=%d, async=%d}", 
            nodes.size(), edges.size(), asyncEdges().size());
    }
}
