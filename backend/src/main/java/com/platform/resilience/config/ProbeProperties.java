package com.platform.resilience.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for live HTTP probing.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience.probe")
public class ProbeProperties {
    
    private String baseUrl = "http://localhost:8080";
    
    /**
     * Maximum probes in flight.
     */
    @Min(1)
    private int concurrency = 8;
    
    private Duration requestTimeout = Duration.ofSeconds(5);
    
    /**
     * Pause between probe rounds per worker.
     */
    private Duration pacing = Duration.ofMillis(100);
    
    private List<Target> targets = new ArrayList<>();
    
    private List<Workflow> workflows = new ArrayList<>();
    
    @Valid
    private Warmup warmup = new Warmup();
    
    /**
     * Single-request probe target.
     */
    @Data
    public static class Target {
        private String label;
        private String method = "GET";
        private String path;
        private String body;
        private String contentType = "application/json";
    }
    
    /**
     * Ordered multi-step probe; succeeds only when every step succeeds.
     */
    @Data
    public static class Workflow {
        private String label;
        private List<Target> steps = new ArrayList<>();
    }
    
    /**
     * Readiness gate run before the first chaos window of a series.
     */
    @Data
    public static class Warmup {
        private boolean enabled = true;
        private Duration timeout = Duration.ofMinutes(5);
        private Duration pollInterval = Duration.ofSeconds(5);
        
        /**
         * How many trace backend services to ask for recent traces per attempt.
         */
        @Min(1)
        private int traceServices = 5;
        
        @Min(1)
        private int traceLookbackMinutes = 15;
    }
}
