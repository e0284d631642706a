package com.platform.resilience.estimator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.error.ConfigurationException;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ValidationException;
import com.platform.resilience.fleet.ServiceNames;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replica count per service. Services not listed run one replica.
 */
@Slf4j
public final class ReplicaMap {
    
    private static final ReplicaMap SINGLE = new ReplicaMap(Map.of());
    
    private final Map<String, Integer> replicas;
    
    private ReplicaMap(Map<String, Integer> replicas) {
        this.replicas = Collections.unmodifiableMap(replicas);
    }
    
    public static ReplicaMap single() {
        return SINGLE;
    }
    
    /**
     * Build from raw labels. Names are normalized; every count must be positive.
     */
    public static ReplicaMap of(Map<String, Integer> counts) {
        Map<String, Integer> normalized = new LinkedHashMap<>();
        counts.forEach((service, count) -> {
            if (count == null || count <= 0) {
                throw new ValidationException(ErrorCode.INVALID_REPLICA_MAP, service, 
                    "replica count must be positive, was " + count);
            }
            normalized.put(ServiceNames.normalize(service), count);
        });
        return new ReplicaMap(normalized);
    }
    
    public static ReplicaMap fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationException(ErrorCode.INVALID_REPLICA_MAP, "replicas", "must be a JSON object");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isIntegralNumber()) {
                throw new ValidationException(ErrorCode.INVALID_REPLICA_MAP, field.getKey(), 
                    "replica count must be an integer, was " + field.getValue());
            }
            counts.put(field.getKey(), field.getValue().asInt());
        }
        return of(counts);
    }
    
    /**
     * Load from a JSON file. An absent file means one replica everywhere.
     */
    public static ReplicaMap load(Path path, ObjectMapper objectMapper) {
        if (path == null || !Files.exists(path)) {
            log.warn("Replica file {} not found, assuming one replica per service", path);
            return SINGLE;
        }
        try {
            return fromJson(objectMapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "cannot read replica file: " + e.getMessage(), e);
        }
    }
    
    public int replicas(String service) {
        return replicas.getOrDefault(service, 1);
    }
    
    public Map<String, Integer> asMap() {
        return replicas;
    }
}
