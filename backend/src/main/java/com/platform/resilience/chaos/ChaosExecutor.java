package com.platform.resilience.chaos;

import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.PlatformOperationException;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.fleet.ContainerInstance;
import com.platform.resilience.fleet.ContainerPlatform;
import com.platform.resilience.fleet.FleetSnapshot;
import com.platform.resilience.fleet.ServiceNames;
import com.platform.resilience.lifecycle.ChaosSafetyNet;
import com.platform.resilience.observability.LoggingConfig;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.random.RandomGenerator;

/**
 * Runs one chaos window: sample a kill set, stop it, hold the outage, restore, log.
 * 
 * Victims are always restored before this method returns or throws. Every window, including
 * one that kills nothing, produces exactly one record in the window log.
 */
@Slf4j
@Component
public class ChaosExecutor {
    
    private final ContainerPlatform platform;
    private final ExperimentProperties properties;
    private final ExecutorService operationsExecutor;
    private final MetricsRegistry metricsRegistry;
    private final ChaosSafetyNet safetyNet;
    private final Sleeper sleeper;
    
    public ChaosExecutor(
            ContainerPlatform platform,
            ExperimentProperties properties,
            @Qualifier("chaosOperationsExecutor") ExecutorService operationsExecutor,
            MetricsRegistry metricsRegistry,
            ChaosSafetyNet safetyNet,
            Sleeper sleeper) {
        this.platform = platform;
        this.properties = properties;
        this.operationsExecutor = operationsExecutor;
        this.metricsRegistry = metricsRegistry;
        this.safetyNet = safetyNet;
        this.sleeper = sleeper;
    }
    
    /**
     * Execute one window against the given fleet snapshot.
     *
     * @param request   window parameters
     * @param fleet     eligible population, already prepared for this window
     * @param windowLog run log receiving the window record
     * @param random    source for kill-set sampling
     * @param listener  notified when the outage begins
     * @return the logged window record
     * @throws ResilienceException with {@link ErrorCode#EXPERIMENT_INTERRUPTED} if the cooling
     *         phase is interrupted; victims are restored and the window is logged first
     */
    public ChaosWindow runWindow(
            ChaosWindowRequest request,
            FleetSnapshot fleet,
            ChaosWindowLog windowLog,
            RandomGenerator random,
            OutageListener listener) {
        
        LoggingConfig.setWindowContext(request.runId(), request.windowId(), request.failureFraction());
        Instant startedAt = Instant.now();
        
        WindowPhase phase = WindowPhase.SAMPLING;
        List<ContainerInstance> victims = KillSetSampler.sample(
            fleet.eligible(), request.failureFraction(), request.samplingLaw(), random);
        List<String> containerNames = victims.stream().map(ContainerInstance::name).toList();
        List<String> services = resolveServices(victims);
        
        log.info("Window {}: p={} law={} eligible={} killed={} services={}", 
            request.windowId(), request.failureFraction(), request.samplingLaw(),
            fleet.eligibleCount(), victims.size(), services);
        
        List<Anomaly> anomalies = List.of();
        boolean interrupted = false;
        StoppedContainers stopped = new StoppedContainers(
            victims, platform, operationsExecutor, properties.getChaos().getRestorePolicy(),
            safetyNet, metricsRegistry);
        
        ChaosWindow window = null;
        try {
            try (stopped) {
                if (!victims.isEmpty()) {
                    phase = WindowPhase.STOPPING;
                    stopped.stopAll(properties.getChaos().getStopGraceSeconds());
                }
                listener.onOutageStarted(request.windowId(), containerNames, Instant.now());
                if (!victims.isEmpty()) {
                    anomalies = stopped.detectAnomalies();
                }
                
                phase = WindowPhase.COOLING;
                sleeper.sleep(request.duration());
                phase = WindowPhase.RESTORING;
            } catch (InterruptedException e) {
                // flag restored after logging; the log append uses an interruptible channel
                interrupted = true;
                log.warn("Window {} interrupted during {}, victims restored", request.windowId(), phase);
            } finally {
                window = new ChaosWindow(
                    request.runId(),
                    request.windowId(),
                    request.failureFraction(),
                    request.samplingLaw(),
                    fleet.eligibleCount(),
                    victims.size(),
                    containerNames,
                    services,
                    request.duration().getSeconds(),
                    anomalies,
                    stopped.restoreFailures(),
                    startedAt,
                    Instant.now()
                );
                windowLog.append(window);
                phase = WindowPhase.LOGGED;
                metricsRegistry.recordChaosWindow(
                    request.failureFraction(), fleet.eligibleCount(), victims.size(), window.isAnomalous());
                metricsRegistry.recordDuration("chaos.window", Duration.between(startedAt, window.endedAt()));
            }
        } finally {
            LoggingConfig.clearWindowContext();
        }
        
        if (interrupted) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, 
                "Chaos window " + request.windowId() + " interrupted");
        }
        log.info("Window {} {}: killed={} anomalies={} restoreFailures={}", 
            request.windowId(), phase, window.killed(), window.anomalies().size(), window.restoreFailures().size());
        return window;
    }
    
    /**
     * Logical service names of the victims, sorted and de-duplicated. A victim whose label cannot
     * be read contributes no name.
     */
    private List<String> resolveServices(List<ContainerInstance> victims) {
        TreeSet<String> services = new TreeSet<>();
        List<String> domainSuffixes = properties.getChaos().getDomainSuffixes();
        for (ContainerInstance victim : victims) {
            try {
                platform.serviceLabel(victim.name())
                    .map(label -> ServiceNames.normalize(label, domainSuffixes))
                    .ifPresent(services::add);
            } catch (PlatformOperationException e) {
                log.warn("Service label lookup failed for {}: {}", victim.name(), e.getMessage());
            }
        }
        return new ArrayList<>(services);
    }
}
