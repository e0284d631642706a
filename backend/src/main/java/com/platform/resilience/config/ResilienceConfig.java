package com.platform.resilience.config;

import com.platform.resilience.chaos.Sleeper;
import com.platform.resilience.fleet.ContainerPlatform;
import com.platform.resilience.fleet.Disallowlist;
import com.platform.resilience.fleet.DockerCliPlatform;
import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.fleet.ProcessCommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the container platform, the eligibility policy and the worker pools.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ExperimentProperties.class, TracingProperties.class, ProbeProperties.class})
public class ResilienceConfig {
    
    @Bean
    public EligibilityPolicy eligibilityPolicy(ExperimentProperties properties) {
        ExperimentProperties.Chaos chaos = properties.getChaos();
        String path = chaos.getDisallowlistPath();
        Disallowlist disallowlist = Disallowlist.load(
            path == null || path.isBlank() ? null : Paths.get(path),
            chaos.isDisallowlistRequired(),
            chaos.getDomainSuffixes());
        return new EligibilityPolicy(disallowlist, chaos.getInfrastructurePattern(), chaos.getEntrypoints());
    }
    
    @Bean
    public ContainerPlatform containerPlatform(ExperimentProperties properties) {
        ExperimentProperties.Chaos chaos = properties.getChaos();
        log.info("Using docker CLI platform for compose project '{}'", chaos.getComposeProject());
        return new DockerCliPlatform(
            new ProcessCommandRunner(chaos.getCommandTimeout()),
            chaos.getComposeProject(),
            chaos.getDomainSuffixes());
    }
    
    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
    
    /**
     * Bounds parallel stop/start/inspect calls within one window.
     */
    @Bean(name = "chaosOperationsExecutor", destroyMethod = "shutdownNow")
    public ExecutorService chaosOperationsExecutor(ExperimentProperties properties) {
        return Executors.newFixedThreadPool(properties.getChaos().getFanOut(), 
            new CustomizableThreadFactory("chaos-op-"));
    }
    
    @Bean(name = "simulationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService simulationExecutor(ExperimentProperties properties) {
        return Executors.newFixedThreadPool(properties.getModel().getParallelism(), 
            new CustomizableThreadFactory("monte-carlo-"));
    }
    
    @Bean(name = "probeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService probeExecutor(ProbeProperties probeProperties) {
        return Executors.newFixedThreadPool(probeProperties.getConcurrency(), 
            new CustomizableThreadFactory("probe-"));
    }
    
    @Bean(name = "measurementScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService measurementScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("measurement-"));
    }
}
