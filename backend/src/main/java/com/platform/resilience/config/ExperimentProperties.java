package com.platform.resilience.config;

import com.platform.resilience.chaos.SamplingLaw;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for chaos windows, live measurement and the Monte Carlo model.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience")
public class ExperimentProperties {
    
    /**
     * Directory receiving window logs, model estimates, live windows and comparison reports.
     */
    private String runDir = "runs";
    
    @Valid
    private Chaos chaos = new Chaos();
    
    @Valid
    private Measurement measurement = new Measurement();
    
    @Valid
    private Model model = new Model();
    
    @Data
    public static class Chaos {
        /**
         * Default failure fraction p in [0, 1].
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double failureFraction = 0.3;
        
        /**
         * How long victims stay stopped.
         */
        @NotNull
        private Duration windowDuration = Duration.ofSeconds(30);
        
        /**
         * Grace period handed to the stop command.
         */
        @Min(0)
        private int stopGraceSeconds = 1;
        
        /**
         * Parallel container operations within one window.
         */
        @Min(1)
        private int fanOut = 4;
        
        /**
         * Kill-set law. Shared with the reliability estimator.
         */
        @NotNull
        private SamplingLaw samplingLaw = SamplingLaw.FIXED_PROPORTION;
        
        /**
         * Services never targeted, one per line. Optional.
         */
        private String disallowlistPath;
        
        /**
         * Fail at startup when the disallowlist file is missing.
         */
        private boolean disallowlistRequired = false;
        
        /**
         * Compose project label used to find the fleet.
         */
        private String composeProject = "opentelemetry-demo";
        
        /**
         * Infrastructure services, always excluded alongside entrypoints and disallowlist entries.
         */
        private String infrastructurePattern =
            "(frontend|frontend-proxy|jaeger|grafana|otel-collector|loadgenerator|prometheus|kafka|kafka-server|zipkin|opensearch|flagd)$";
        
        /**
         * Services classified as entrypoints.
         */
        private List<String> entrypoints = new ArrayList<>(List.of("frontend", "frontend-proxy", "loadgenerator"));
        
        /**
         * Extra suffixes stripped during name normalization.
         */
        private List<String> domainSuffixes = new ArrayList<>();
        
        /**
         * Upper bound for a single container platform command.
         */
        @NotNull
        private Duration commandTimeout = Duration.ofSeconds(30);
        
        /**
         * Restart policy re-applied after restore.
         */
        private String restorePolicy = "unless-stopped";
    }
    
    @Data
    public static class Measurement {
        /**
         * Suspension between outage start and measurement start.
         */
        @NotNull
        private Duration revealDelay = Duration.ofSeconds(15);
        
        /**
         * Measurement length. When unset: window duration - reveal delay - tail margin.
         */
        private Duration window;
        
        /**
         * Safety margin keeping the measurement inside the outage.
         */
        @NotNull
        private Duration tailMargin = Duration.ofSeconds(2);
        
        @Min(100)
        private int bootstrapResamples = 10000;
        
        @DecimalMin("0.001")
        @DecimalMax("0.5")
        private double alpha = 0.05;
    }
    
    @Data
    public static class Model {
        @Min(1)
        private int trials = 120000;
        
        @Min(1)
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        
        /**
         * Pre-built graph.json. When set, trace discovery is skipped.
         */
        private String graphPath;
        
        /**
         * Endpoint target specifications (JSON).
         */
        private String targetsPath;
        
        /**
         * Replica counts per service (JSON). Missing file means one replica everywhere.
         */
        private String replicasPath;
        
        /**
         * Explicit sink services for aggregate evaluation. Empty means graph leaves.
         */
        private List<String> sinks = new ArrayList<>();
        
        /**
         * Entrypoints used by aggregate evaluation.
         */
        private List<String> entrypoints = new ArrayList<>(List.of("frontend"));
    }
}
