package com.platform.resilience.chaos;

import java.time.Instant;
import java.util.List;

/**
 * Notified once per window when the outage begins (victims stopped, or no victims).
 * Called on the window thread; implementations must not block.
 */
@FunctionalInterface
public interface OutageListener {
    
    OutageListener NONE = (windowId, victims, outageStart) -> { };
    
    void onOutageStarted(int windowId, List<String> victims, Instant outageStart);
}
