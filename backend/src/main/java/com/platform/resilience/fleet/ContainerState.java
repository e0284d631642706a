package com.platform.resilience.fleet;

import java.util.Locale;

/**
 * Container lifecycle state as reported by the platform.
 */
public enum ContainerState {
    RUNNING,
    EXITED,
    DEAD,
    UNKNOWN;
    
    /**
     * Map a platform status string ("running", "exited", ...) to a state.
     * Transitional states (created, restarting, paused, removing) map to UNKNOWN.
     */
    public static ContainerState fromPlatform(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.strip().toLowerCase(Locale.ROOT)) {
            case "running" -> RUNNING;
            case "exited" -> EXITED;
            case "dead" -> DEAD;
            default -> UNKNOWN;
        };
    }
    
    /**
     * Terminal stopped state expected after a successful stop.
     */
    public boolean isStopped() {
        return this == EXITED || this == DEAD;
    }
}
