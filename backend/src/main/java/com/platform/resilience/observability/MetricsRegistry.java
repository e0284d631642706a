package com.platform.resilience.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for experiment metrics.
 * Wraps Micrometer so components record domain events instead of meter names.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger containersHeldStopped;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.containersHeldStopped = new AtomicInteger(0);
        
        Gauge.builder("resilience.chaos.containers.stopped", containersHeldStopped, AtomicInteger::get)
            .description("Containers currently held stopped by a chaos window")
            .register(meterRegistry);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        incrementCounter(name, 1, tags);
    }
    
    /**
     * Increment a counter with tags by an amount.
     */
    public void incrementCounter(String name, double amount, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment(amount);
    }
    
    /**
     * Record duration of an operation.
     */
    public void recordDuration(String operation, Duration duration) {
        Timer timer = timers.computeIfAbsent(operation, k -> 
            Timer.builder("resilience.operation.duration")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(duration);
    }
    
    /**
     * Record a completed chaos window.
     */
    public void recordChaosWindow(double failureFraction, int eligible, int killed, boolean anomalous) {
        String p = String.valueOf(failureFraction);
        incrementCounter("resilience.chaos.windows", "p", p, "anomalous", String.valueOf(anomalous));
        incrementCounter("resilience.chaos.kills", killed, "p", p);
        log.debug("Recorded chaos window: p={} eligible={} killed={} anomalous={}", 
            p, eligible, killed, anomalous);
    }
    
    /**
     * Record a victim that did not reach a stopped state.
     */
    public void recordAnomaly(String observedState) {
        incrementCounter("resilience.chaos.anomalies", "state", observedState);
    }
    
    /**
     * Record a failed platform command.
     */
    public void recordPlatformFailure(String operation) {
        incrementCounter("resilience.platform.failures", "operation", operation);
    }
    
    public void containersStopped(int count) {
        containersHeldStopped.addAndGet(count);
    }
    
    public void containersRestored(int count) {
        containersHeldStopped.addAndGet(-count);
    }
    
    /**
     * Record a finished Monte Carlo estimate.
     */
    public void recordSimulation(String mode, long trials, long successes) {
        incrementCounter("resilience.model.trials", trials, "mode", mode);
        incrementCounter("resilience.model.successes", successes, "mode", mode);
    }
    
    /**
     * Record one probe outcome.
     */
    public void recordProbe(String endpoint, boolean ok) {
        incrementCounter("resilience.probe.requests", "endpoint", endpoint, "ok", String.valueOf(ok));
    }
    
    /**
     * Record dependency discovery outcome.
     */
    public void recordDiscovery(String source, int edges) {
        incrementCounter("resilience.discovery.runs", "source", source);
        log.debug("Recorded discovery from {} with {} edges", source, edges);
    }
    
    public int getContainersHeldStopped() {
        return containersHeldStopped.get();
    }
}
