package com.platform.resilience.estimator;

/**
 * What an endpoint needs to succeed.
 *
 * @param endpoint     endpoint label as declared
 * @param entry        normalized entry service, {@code null} for the graph default
 * @param rule         success rule over target services
 * @param excludeAsync under non-blocking semantics, ignore targets only reachable through async edges
 */
public record TargetSpec(String endpoint, String entry, SuccessRule rule, boolean excludeAsync) {
    
    public static final String DEFAULT_ENTRY = "frontend";
    
    /**
     * Filesystem-safe form of the endpoint label used in artifact names.
     */
    public String safeLabel() {
        return safeLabel(endpoint);
    }
    
    public static String safeLabel(String endpoint) {
        String replaced = endpoint.strip().replace('/', '_').replace(' ', '_');
        StringBuilder out = new StringBuilder();
        for (String segment : replaced.split("_")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append('_');
            }
            out.append(segment);
        }
        return out.length() == 0 ? "endpoint" : out.toString().toLowerCase();
    }
}
