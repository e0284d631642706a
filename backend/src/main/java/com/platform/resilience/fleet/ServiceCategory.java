package com.platform.resilience.fleet;

public enum ServiceCategory {
    ENTRYPOINT,
    INFRASTRUCTURE,
    APPLICATION
}
