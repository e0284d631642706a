package com.platform.resilience.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resilience.error.ConfigurationException;
import com.platform.resilience.fleet.ServiceNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes graphs in the index-based {@code graph.json} layout:
 * {@code {"services": [...], "edges": [[u, v], ...], "async_edges": [[u, v], ...], "entrypoints": [i, ...]}}.
 */
public final class GraphJson {
    
    private GraphJson() {
    }
    
    public static ObjectNode toJson(DependencyGraph graph, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode services = root.putArray("services");
        graph.nodes().forEach(services::add);
        ArrayNode edges = root.putArray("edges");
        ArrayNode asyncEdges = root.putArray("async_edges");
        for (DependencyEdge edge : graph.edges()) {
            ArrayNode pair = mapper.createArrayNode()
                .add(graph.indexOf(edge.caller()))
                .add(graph.indexOf(edge.callee()));
            edges.add(pair);
            if (edge.isAsync()) {
                asyncEdges.add(pair.deepCopy());
            }
        }
        ArrayNode entrypoints = root.putArray("entrypoints");
        graph.entrypoints().forEach(e -> entrypoints.add(graph.indexOf(e)));
        return root;
    }
    
    /**
     * Parse a graph document. Out-of-range or malformed index pairs are ignored.
     */
    public static DependencyGraph fromJson(JsonNode root) {
        List<String> services = new ArrayList<>();
        root.path("services").forEach(s -> services.add(ServiceNames.normalize(s.asText())));
        
        Set<List<Integer>> asyncPairs = new HashSet<>();
        for (JsonNode pair : root.path("async_edges")) {
            List<Integer> indices = indexPair(pair, services.size());
            if (indices != null) {
                asyncPairs.add(indices);
            }
        }
        List<DependencyEdge> edges = new ArrayList<>();
        for (JsonNode pair : root.path("edges")) {
            List<Integer> indices = indexPair(pair, services.size());
            if (indices == null) {
                continue;
            }
            edges.add(new DependencyEdge(
                services.get(indices.get(0)),
                services.get(indices.get(1)),
                asyncPairs.contains(indices) ? Transport.ASYNC : Transport.SYNC));
        }
        List<String> entrypoints = new ArrayList<>();
        for (JsonNode entry : root.path("entrypoints")) {
            if (entry.isInt() && entry.asInt() >= 0 && entry.asInt() < services.size()) {
                entrypoints.add(services.get(entry.asInt()));
            }
        }
        return new DependencyGraph(services, edges, entrypoints);
    }
    
    public static DependencyGraph read(Path path, ObjectMapper mapper) {
        if (!Files.exists(path)) {
            throw new ConfigurationException(path.toString(), "graph file not found");
        }
        try {
            return fromJson(mapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "cannot read graph file: " + e.getMessage(), e);
        }
    }
    
    public static void write(DependencyGraph graph, Path path, ObjectMapper mapper) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toJson(graph, mapper));
    }
    
    private static List<Integer> indexPair(JsonNode pair, int size) {
        if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isInt() || !pair.get(1).isInt()) {
            return null;
        }
        int u = pair.get(0).asInt();
        int v = pair.get(1).asInt();
        if (u < 0 || u >= size || v < 0 || v >= size) {
            return null;
        }
        return List.of(u, v);
    }
}
