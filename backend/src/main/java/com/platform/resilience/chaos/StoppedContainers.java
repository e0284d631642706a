package com.platform.resilience.chaos;

import com.platform.resilience.error.PlatformOperationException;
import com.platform.resilience.fleet.ContainerInstance;
import com.platform.resilience.fleet.ContainerPlatform;
import com.platform.resilience.fleet.ContainerState;
import com.platform.resilience.lifecycle.ChaosSafetyNet;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * A kill set held stopped for the duration of a window.
 * 
 * Registered with the {@link ChaosSafetyNet} while held. {@link #close()} restarts every victim,
 * re-applies the restart policy and is safe to call more than once.
 */
@Slf4j
public class StoppedContainers implements AutoCloseable {
    
    static final String RESTART_DISABLED = "no";
    
    private final List<ContainerInstance> victims;
    private final ContainerPlatform platform;
    private final ExecutorService executor;
    private final String restorePolicy;
    private final ChaosSafetyNet safetyNet;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<String> restoreFailures = Collections.synchronizedList(new ArrayList<>());
    
    StoppedContainers(
            List<ContainerInstance> victims,
            ContainerPlatform platform,
            ExecutorService executor,
            String restorePolicy,
            ChaosSafetyNet safetyNet,
            MetricsRegistry metricsRegistry) {
        this.victims = List.copyOf(victims);
        this.platform = platform;
        this.executor = executor;
        this.restorePolicy = restorePolicy;
        this.safetyNet = safetyNet;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Disable automatic restart on every victim, then stop them in parallel.
     * Per-container failures are logged; the remaining victims are still stopped.
     */
    public void stopAll(int graceSeconds) {
        safetyNet.register(this);
        forEachVictim(container -> {
            try {
                platform.updateRestartPolicy(container.name(), RESTART_DISABLED);
            } catch (PlatformOperationException e) {
                log.warn("Could not disable restart policy on {}: {}", container.name(), e.getMessage());
                metricsRegistry.recordPlatformFailure(e.getOperation());
            }
            return null;
        });
        forEachVictim(container -> {
            try {
                platform.stop(container.name(), graceSeconds);
                log.debug("Stopped {}", container.name());
            } catch (PlatformOperationException e) {
                log.warn("Stop failed for {}: {}", container.name(), e.getMessage());
                metricsRegistry.recordPlatformFailure(e.getOperation());
            }
            return null;
        });
        metricsRegistry.containersStopped(victims.size());
    }
    
    /**
     * Inspect every victim. A victim in any state other than exited or dead is an anomaly,
     * including one whose state cannot be read.
     */
    public List<Anomaly> detectAnomalies() {
        List<Optional<Anomaly>> observed = forEachVictim(container -> {
            try {
                ContainerState state = platform.inspectState(container.name());
                if (!state.isStopped()) {
                    log.warn("Victim {} is {} after stop", container.name(), state);
                    metricsRegistry.recordAnomaly(state.name());
                    return Optional.of(new Anomaly(container.name(), state.name()));
                }
            } catch (PlatformOperationException e) {
                log.warn("Could not inspect {} after stop, recording as {}: {}", 
                    container.name(), ContainerState.UNKNOWN, e.getMessage());
                metricsRegistry.recordAnomaly(ContainerState.UNKNOWN.name());
                return Optional.of(new Anomaly(container.name(), ContainerState.UNKNOWN.name()));
            }
            return Optional.<Anomaly>empty();
        });
        List<Anomaly> anomalies = new ArrayList<>();
        observed.forEach(a -> a.ifPresent(anomalies::add));
        return anomalies;
    }
    
    /**
     * Start every victim and re-apply the restore policy. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            forEachVictim(container -> {
                try {
                    platform.start(container.name());
                } catch (PlatformOperationException e) {
                    log.error("Restore failed for {}: {}", container.name(), e.getMessage());
                    metricsRegistry.recordPlatformFailure(e.getOperation());
                    restoreFailures.add(container.name());
                    return null;
                }
                try {
                    platform.updateRestartPolicy(container.name(), restorePolicy);
                } catch (PlatformOperationException e) {
                    log.warn("Could not re-apply restart policy {} on {}: {}", 
                        restorePolicy, container.name(), e.getMessage());
                    metricsRegistry.recordPlatformFailure(e.getOperation());
                }
                return null;
            });
        } finally {
            metricsRegistry.containersRestored(victims.size());
            safetyNet.unregister(this);
        }
        if (!restoreFailures.isEmpty()) {
            log.error("{} of {} victims could not be restarted: {}", 
                restoreFailures.size(), victims.size(), restoreFailures);
        }
    }
    
    public List<ContainerInstance> victims() {
        return victims;
    }
    
    public List<String> restoreFailures() {
        synchronized (restoreFailures) {
            return List.copyOf(restoreFailures);
        }
    }
    
    public boolean isClosed() {
        return closed.get();
    }
    
    private <R> List<R> forEachVictim(Function<ContainerInstance, R> operation) {
        List<CompletableFuture<R>> futures = new ArrayList<>(victims.size());
        for (ContainerInstance victim : victims) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> operation.apply(victim), executor));
            } catch (RejectedExecutionException e) {
                // executor already shut down (JVM exit), run on the calling thread
                futures.add(CompletableFuture.completedFuture(operation.apply(victim)));
            }
        }
        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}
