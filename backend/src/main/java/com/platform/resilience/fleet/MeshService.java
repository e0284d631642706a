package com.platform.resilience.fleet;

/**
 * A logical service of the mesh after name normalization.
 */
public record MeshService(
    String name,
    ServiceCategory category,
    boolean eligible
) {}
