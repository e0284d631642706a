package com.platform.resilience.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resilience.chaos.ChaosWindow;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.correlation.ComparisonResult;
import com.platform.resilience.estimator.SemanticsMode;
import com.platform.resilience.experiment.ChaosSeriesResult;
import com.platform.resilience.experiment.ExperimentService;
import com.platform.resilience.experiment.ModelRunResult;
import com.platform.resilience.experiment.ValidationService;
import com.platform.resilience.experiment.ValidationSummary;
import com.platform.resilience.fleet.FleetSnapshot;
import com.platform.resilience.graph.DiscoveryResult;
import com.platform.resilience.graph.GraphJson;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * REST API for chaos windows, model runs, comparisons and validation.
 */
@RestController
@RequestMapping("/api/experiments")
@RequiredArgsConstructor
public class ExperimentController {
    
    private final ExperimentService experimentService;
    private final ValidationService validationService;
    private final ExperimentProperties properties;
    private final ObjectMapper objectMapper;
    
    /**
     * Current fleet partitioned into eligible and excluded containers.
     */
    @GetMapping("/fleet")
    public FleetSnapshot getFleet() {
        return experimentService.inspectFleet();
    }
    
    /**
     * Dependency graph in graph.json layout, annotated with its source and hash.
     */
    @GetMapping("/graph")
    public ObjectNode getGraph() {
        DiscoveryResult result = experimentService.loadGraph();
        ObjectNode body = GraphJson.toJson(result.graph(), objectMapper);
        body.put("source", result.source().name());
        body.put("graph_hash", result.graph().fingerprint());
        return body;
    }
    
    /**
     * Run a chaos series with live measurement.
     */
    @PostMapping("/windows")
    public ChaosSeriesResult runWindows(@Valid @RequestBody WindowSeriesRequest request) {
        double p = request.failureFraction != null ? request.failureFraction : properties.getChaos().getFailureFraction();
        int windows = request.windows != null ? request.windows : 1;
        SemanticsMode mode = request.mode != null ? request.mode : SemanticsMode.BLOCKING;
        return experimentService.runChaosSeries(p, windows, mode);
    }
    
    @GetMapping("/windows")
    public List<ChaosWindow> listWindows() {
        return experimentService.listWindows();
    }
    
    @PostMapping("/model")
    public ModelRunResult runModel(@Valid @RequestBody ModelRequest request) {
        double p = request.failureFraction != null ? request.failureFraction : properties.getChaos().getFailureFraction();
        int trials = request.trials != null ? request.trials : properties.getModel().getTrials();
        return experimentService.runModel(p, trials);
    }
    
    @PostMapping("/comparisons")
    public List<ComparisonResult> compare(@Valid @RequestBody ComparisonRequest request) {
        double p = request.failureFraction != null ? request.failureFraction : properties.getChaos().getFailureFraction();
        return experimentService.compare(p);
    }
    
    /**
     * One window that must kill at least minKills containers and push live success below maxLive.
     */
    @PostMapping("/validation")
    public ValidationSummary validate(@Valid @RequestBody ValidationRequest request) {
        Duration window = request.windowSeconds != null 
            ? Duration.ofSeconds(request.windowSeconds) 
            : properties.getChaos().getWindowDuration();
        return validationService.validate(
            request.failureFraction != null ? request.failureFraction : 1.0,
            window,
            request.minKills != null ? request.minKills : 1,
            request.maxLive != null ? request.maxLive : 0.99);
    }
    
    // DTOs
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowSeriesRequest {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double failureFraction;
        @Min(1)
        private Integer windows;
        private SemanticsMode mode;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelRequest {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double failureFraction;
        @Min(1)
        private Integer trials;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ComparisonRequest {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double failureFraction;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationRequest {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double failureFraction;
        @Min(1)
        private Long windowSeconds;
        @Min(0)
        private Integer minKills;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double maxLive;
    }
}
