package com.platform.resilience.fleet;

/**
 * Which rule decided chaos eligibility for a classification.
 */
public enum ExclusionSource {
    /**
     * A non-empty disallowlist excludes services on top of the infrastructure pattern.
     */
    DISALLOWLIST,
    
    /**
     * No disallowlist entries; only the built-in infrastructure pattern and entrypoints exclude.
     */
    INFRASTRUCTURE_PATTERN
}
