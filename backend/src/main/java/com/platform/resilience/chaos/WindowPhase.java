package com.platform.resilience.chaos;

/**
 * Phases of a single chaos window, in order.
 */
public enum WindowPhase {
    IDLE,
    SAMPLING,
    STOPPING,
    COOLING,
    RESTORING,
    LOGGED
}
