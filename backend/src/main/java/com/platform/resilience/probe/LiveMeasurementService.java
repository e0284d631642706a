package com.platform.resilience.probe;

import com.platform.resilience.config.ProbeProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures live success rates by probing the system under test for a bounded period.
 * 
 * Probes are issued round-robin across the configured targets and workflows with at most
 * {@code concurrency} in flight. Only counts are kept.
 */
@Slf4j
@Service
public class LiveMeasurementService {
    
    private final ProbeClient probeClient;
    private final ProbeProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService probeExecutor;
    
    public LiveMeasurementService(
            ProbeClient probeClient,
            ProbeProperties properties,
            MetricsRegistry metricsRegistry,
            @Qualifier("probeExecutor") ExecutorService probeExecutor) {
        this.probeClient = probeClient;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.probeExecutor = probeExecutor;
    }
    
    /**
     * Configured probes: plain targets first, then workflows.
     */
    public List<WorkflowProbe> configuredProbes() {
        List<WorkflowProbe> probes = new ArrayList<>();
        properties.getTargets().forEach(t -> probes.add(WorkflowProbe.single(ProbeTarget.from(t))));
        properties.getWorkflows().forEach(w -> probes.add(WorkflowProbe.from(w)));
        return probes;
    }
    
    public Map<String, ProbeCounts> measure(Duration window) {
        return measure(configuredProbes(), window);
    }
    
    /**
     * Probe until {@code window} has elapsed, then wait for in-flight probes.
     *
     * @return counts per probe label, in probe order
     */
    public Map<String, ProbeCounts> measure(List<WorkflowProbe> probes, Duration window) {
        Map<String, ProbeCounts> result = new LinkedHashMap<>();
        if (probes.isEmpty()) {
            log.warn("No probe targets configured, live measurement is empty");
            return result;
        }
        
        Map<String, AtomicLong[]> tallies = new ConcurrentHashMap<>();
        probes.forEach(p -> tallies.put(p.label(), new AtomicLong[]{new AtomicLong(), new AtomicLong()}));
        
        int concurrency = properties.getConcurrency();
        Semaphore inFlight = new Semaphore(concurrency);
        long deadline = System.nanoTime() + window.toNanos();
        int next = 0;
        
        try {
            while (System.nanoTime() < deadline) {
                long remaining = deadline - System.nanoTime();
                if (!inFlight.tryAcquire(remaining, TimeUnit.NANOSECONDS)) {
                    break;
                }
                WorkflowProbe probe = probes.get(next);
                next = (next + 1) % probes.size();
                try {
                    probeExecutor.execute(() -> {
                        try {
                            boolean ok = runProbe(probe);
                            AtomicLong[] tally = tallies.get(probe.label());
                            tally[0].incrementAndGet();
                            if (ok) {
                                tally[1].incrementAndGet();
                            }
                            metricsRegistry.recordProbe(probe.label(), ok);
                        } finally {
                            inFlight.release();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    inFlight.release();
                    throw new ResilienceException(ErrorCode.PROBE_ERROR, "Probe executor rejected work", e);
                }
                if (next == 0 && !properties.getPacing().isZero()) {
                    long pause = Math.min(properties.getPacing().toNanos(), Math.max(0, deadline - System.nanoTime()));
                    TimeUnit.NANOSECONDS.sleep(pause);
                }
            }
            long drain = properties.getRequestTimeout().toNanos() * maxSteps(probes) + TimeUnit.SECONDS.toNanos(1);
            if (!inFlight.tryAcquire(concurrency, drain, TimeUnit.NANOSECONDS)) {
                log.warn("Probes still in flight after drain timeout, counting completed ones only");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Live measurement interrupted", e);
        }
        
        for (WorkflowProbe probe : probes) {
            AtomicLong[] tally = tallies.get(probe.label());
            result.put(probe.label(), new ProbeCounts(tally[0].get(), tally[1].get()));
        }
        log.info("Live measurement over {}: {}", window, summarize(result));
        return result;
    }
    
    /**
     * Run every step in order; the first failing step fails the probe and skips the rest.
     */
    boolean runProbe(WorkflowProbe probe) {
        for (ProbeTarget step : probe.steps()) {
            ProbeResult result = probeClient.probe(step);
            if (!result.isSuccess()) {
                log.debug("Probe {} failed at step {}: status={} error={}", 
                    probe.label(), step.label(), result.status(), result.error());
                return false;
            }
        }
        return true;
    }
    
    private static int maxSteps(List<WorkflowProbe> probes) {
        return probes.stream().mapToInt(p -> p.steps().size()).max().orElse(1);
    }
    
    private static String summarize(Map<String, ProbeCounts> counts) {
        StringBuilder sb = new StringBuilder();
        counts.forEach((label, c) -> sb.append(label).append('=').append(c.ok()).append('/').append(c.total()).append(' '));
        return sb.toString().trim();
    }
}
