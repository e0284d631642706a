package com.platform.resilience.chaos;

import java.time.Duration;

/**
 * Wall-clock suspension used for the cooling phase.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
