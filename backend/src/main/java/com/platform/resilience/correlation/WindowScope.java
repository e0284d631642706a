package com.platform.resilience.correlation;

import com.platform.resilience.probe.LiveWindow;

/**
 * Which live windows enter a comparison.
 */
public enum WindowScope {
    
    ALL,
    
    /** Only windows whose chaos window reported no anomaly. */
    CLEAN;
    
    public boolean includes(LiveWindow window) {
        return this == ALL || !window.anomalous();
    }
    
    public String label() {
        return name().toLowerCase();
    }
}
