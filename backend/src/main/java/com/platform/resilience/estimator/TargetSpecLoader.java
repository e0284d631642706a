package com.platform.resilience.estimator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.error.ConfigurationException;
import com.platform.resilience.error.ValidationException;
import com.platform.resilience.fleet.ServiceNames;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads endpoint target specifications from JSON:
 * 
 * <pre>
 * {
 *   "/api/checkout": {"entry": "frontend", "all_of": ["checkout", "cart"], "exclude_async": true},
 *   "/api/recommendations": {"k_of_n": {"k": 1, "items": ["recommendation", "product-catalog"]}}
 * }
 * </pre>
 * 
 * Every endpoint declares exactly one of {@code any_of}, {@code all_of}, {@code k_of_n}.
 */
@Slf4j
public class TargetSpecLoader {
    
    private static final List<String> RULE_FIELDS = List.of("any_of", "all_of", "k_of_n");
    
    private final ObjectMapper objectMapper;
    
    public TargetSpecLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public Map<String, TargetSpec> load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException(path.toString(), "targets file not found");
        }
        try {
            Map<String, TargetSpec> specs = parse(objectMapper.readTree(path.toFile()));
            log.info("Loaded {} endpoint target specs from {}", specs.size(), path);
            return specs;
        } catch (IOException e) {
            throw new ConfigurationException(path.toString(), "cannot read targets file: " + e.getMessage(), e);
        }
    }
    
    /**
     * Parse and validate a targets document, preserving declaration order.
     */
    public Map<String, TargetSpec> parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationException("targets document must be a JSON object");
        }
        Map<String, TargetSpec> specs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            specs.put(field.getKey(), parseSpec(field.getKey(), field.getValue()));
        }
        return specs;
    }
    
    private TargetSpec parseSpec(String endpoint, JsonNode node) {
        if (!node.isObject()) {
            throw ValidationException.targetSpec(endpoint, "must map to an object");
        }
        List<String> declared = new ArrayList<>();
        for (String ruleField : RULE_FIELDS) {
            if (node.has(ruleField)) {
                declared.add(ruleField);
            }
        }
        if (declared.size() != 1) {
            throw ValidationException.targetSpec(endpoint, 
                "must declare exactly one of any_of/all_of/k_of_n, found " + declared);
        }
        
        String entry = node.hasNonNull("entry") && !node.get("entry").asText().isBlank()
            ? ServiceNames.normalize(node.get("entry").asText())
            : null;
        boolean excludeAsync = node.path("exclude_async").asBoolean(false);
        
        String ruleField = declared.get(0);
        SuccessRule rule = switch (ruleField) {
            case "any_of" -> new SuccessRule.AnyOf(items(endpoint, ruleField, node.get(ruleField)));
            case "all_of" -> new SuccessRule.AllOf(items(endpoint, ruleField, node.get(ruleField)));
            default -> kOfN(endpoint, node.get(ruleField));
        };
        return new TargetSpec(endpoint, entry, rule, excludeAsync);
    }
    
    private SuccessRule kOfN(String endpoint, JsonNode block) {
        if (!block.isObject()) {
            throw ValidationException.targetSpec(endpoint, "k_of_n must be an object");
        }
        JsonNode kNode = block.get("k");
        if (kNode == null || !kNode.canConvertToInt() || !kNode.isIntegralNumber()) {
            throw ValidationException.targetSpec(endpoint, "k_of_n.k must be an integer");
        }
        List<String> items = items(endpoint, "k_of_n.items", block.get("items"));
        int k = kNode.asInt();
        if (k < 1 || k > items.size()) {
            throw ValidationException.targetSpec(endpoint, 
                String.format("k_of_n.k must be within 1..%d, was %d", items.size(), k));
        }
        return new SuccessRule.KOfN(k, items);
    }
    
    private List<String> items(String endpoint, String field, JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw ValidationException.targetSpec(endpoint, field + " must be a non-empty list");
        }
        List<String> items = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            String name = ServiceNames.normalize(item.asText());
            if (name.isEmpty()) {
                throw ValidationException.targetSpec(endpoint, field + " contains a blank service name");
            }
            items.add(name);
        }
        return items;
    }
}
