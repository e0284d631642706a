package com.platform.resilience.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.resilience.chaos.Sleeper;
import com.platform.resilience.config.ProbeProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.graph.TraceBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Holds a chaos series back until the system under test is serving traffic.
 *
 * <p>Each attempt first sends the first step of every configured probe; one successful response
 * is enough. Otherwise the trace backend is asked whether any of its first few services has
 * recent traces. Attempts repeat every poll interval until the timeout is used up.
 */
@Slf4j
@Service
public class WarmupGate {
    
    private final ProbeClient probeClient;
    private final TraceBackend traceBackend;
    private final ProbeProperties properties;
    private final Sleeper sleeper;
    
    public WarmupGate(ProbeClient probeClient, TraceBackend traceBackend, ProbeProperties properties, Sleeper sleeper) {
        this.probeClient = probeClient;
        this.traceBackend = traceBackend;
        this.properties = properties;
        this.sleeper = sleeper;
    }
    
    /**
     * Which evidence showed the system to be warm.
     */
    public enum Signal {
        DISABLED,
        PROBE,
        TRACES
    }
    
    /**
     * Block until the system is warm.
     *
     * @param probes probes whose first steps are tried on each attempt
     * @throws ResilienceException with {@link ErrorCode#WARMUP_TIMEOUT} when no attempt succeeds,
     *         or {@link ErrorCode#EXPERIMENT_INTERRUPTED} when interrupted while waiting
     */
    public Signal await(List<WorkflowProbe> probes) {
        ProbeProperties.Warmup warmup = properties.getWarmup();
        if (!warmup.isEnabled()) {
            return Signal.DISABLED;
        }
        int attempts = attempts(warmup.getTimeout(), warmup.getPollInterval());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (anyProbeServed(probes)) {
                log.info("Warm-up passed on attempt {}: a probe was served", attempt);
                return Signal.PROBE;
            }
            if (hasRecentTraces(warmup)) {
                log.info("Warm-up passed on attempt {}: trace backend shows recent traces", attempt);
                return Signal.TRACES;
            }
            if (attempt < attempts) {
                log.debug("System not warm yet (attempt {}/{}), retrying in {}", attempt, attempts, warmup.getPollInterval());
                pause(warmup.getPollInterval());
            }
        }
        throw new ResilienceException(ErrorCode.WARMUP_TIMEOUT, String.format(
            "No served probe or recent traces within %s (%d attempts)", warmup.getTimeout(), attempts));
    }
    
    /**
     * One attempt at time zero plus one per full poll interval within the timeout.
     */
    static int attempts(Duration timeout, Duration pollInterval) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return 1;
        }
        return (int) Math.min(Integer.MAX_VALUE, 1 + timeout.toMillis() / pollInterval.toMillis());
    }
    
    private boolean anyProbeServed(List<WorkflowProbe> probes) {
        for (WorkflowProbe probe : probes) {
            ProbeResult result = probeClient.probe(probe.steps().get(0));
            if (result.isSuccess()) {
                return true;
            }
            log.debug("Warm-up probe {} not served: status={} error={}", probe.label(), result.status(), result.error());
        }
        return false;
    }
    
    private boolean hasRecentTraces(ProbeProperties.Warmup warmup) {
        try {
            List<String> services = traceBackend.services();
            for (String service : services.subList(0, Math.min(services.size(), warmup.getTraceServices()))) {
                Optional<JsonNode> payload = traceBackend.traces(service, warmup.getTraceLookbackMinutes());
                if (payload.isPresent() && !payload.get().path("data").isEmpty()) {
                    return true;
                }
            }
        } catch (ResilienceException e) {
            log.debug("Trace backend not usable for warm-up: {}", e.getMessage());
        }
        return false;
    }
    
    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Interrupted during warm-up", e);
        }
    }
}
