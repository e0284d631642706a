package com.platform.resilience.probe;

import com.platform.resilience.config.ProbeProperties;

/**
 * One HTTP request issued as a probe.
 */
public record ProbeTarget(String label, String method, String path, String body, String contentType) {
    
    public ProbeTarget {
        if (label == null || label.isBlank()) {
            label = path;
        }
        method = method == null ? "GET" : method.toUpperCase();
    }
    
    public static ProbeTarget get(String label, String path) {
        return new ProbeTarget(label, "GET", path, null, null);
    }
    
    public static ProbeTarget from(ProbeProperties.Target target) {
        return new ProbeTarget(target.getLabel(), target.getMethod(), target.getPath(), 
            target.getBody(), target.getContentType());
    }
}
