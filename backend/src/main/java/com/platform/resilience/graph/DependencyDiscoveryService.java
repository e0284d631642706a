package com.platform.resilience.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.config.TracingProperties;
import com.platform.resilience.error.DiscoveryException;
import com.platform.resilience.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Discovers the service dependency graph from trace data.
 * 
 * Traces are tried first, then once more with a widened lookback. Only when both are empty does
 * discovery fall back to the backend's dependency summary, and only outside strict mode.
 */
@Slf4j
@Service
public class DependencyDiscoveryService {
    
    private final TraceBackend traceBackend;
    private final TracingProperties tracingProperties;
    private final ExperimentProperties experimentProperties;
    private final MetricsRegistry metricsRegistry;
    private final SpanRelationshipExtractor extractor = new SpanRelationshipExtractor();
    private final DependencyGraphBuilder builder;
    
    public DependencyDiscoveryService(
            TraceBackend traceBackend,
            TracingProperties tracingProperties,
            ExperimentProperties experimentProperties,
            MetricsRegistry metricsRegistry) {
        this.traceBackend = traceBackend;
        this.tracingProperties = tracingProperties;
        this.experimentProperties = experimentProperties;
        this.metricsRegistry = metricsRegistry;
        this.builder = new DependencyGraphBuilder(
            tracingProperties.getBrokers(),
            tracingProperties.getSkipServices(),
            experimentProperties.getChaos().getDomainSuffixes());
    }
    
    /**
     * Discover the current graph.
     *
     * @throws DiscoveryException when no edges could be found, or traces were empty in strict mode
     */
    public DiscoveryResult discover() {
        List<String> entrypoints = experimentProperties.getModel().getEntrypoints();
        List<String> services = traceBackend.services();
        if (services.isEmpty()) {
            log.warn("Trace backend lists no services, querying {} well-known services", 
                tracingProperties.getFallbackServices().size());
            services = tracingProperties.getFallbackServices();
        }
        
        int lookback = tracingProperties.getLookbackMinutes();
        List<ObservedCall> calls = collectTraceCalls(services, lookback);
        DependencyGraph graph = builder.build(calls, entrypoints);
        
        if (graph.edges().isEmpty()) {
            lookback = Math.max(lookback, tracingProperties.getWidenedLookbackMinutes());
            log.info("No edges in traces, widening lookback to {} minutes", lookback);
            calls = collectTraceCalls(services, lookback);
            graph = builder.build(calls, entrypoints);
        }
        
        if (!graph.edges().isEmpty()) {
            metricsRegistry.recordDiscovery(DiscoverySource.TRACES.name(), graph.edges().size());
            return new DiscoveryResult(graph, DiscoverySource.TRACES, lookback, calls.size());
        }
        
        if (tracingProperties.isStrict()) {
            throw new DiscoveryException(String.format(
                "Trace scraping found zero edges over %d minutes and fallback is disabled (strict mode)", lookback));
        }
        
        log.warn("Discovery mode transition {} -> {}: trace scraping found zero edges over {} minutes", 
            DiscoverySource.TRACES, DiscoverySource.DEPENDENCY_SUMMARY, lookback);
        List<ObservedCall> summary = traceBackend.dependencySummary(lookback)
            .map(extractor::fromDependencySummary)
            .orElse(List.of());
        DependencyGraph fallback = builder.build(summary, entrypoints);
        if (fallback.edges().isEmpty()) {
            throw new DiscoveryException("Dependency summary also returned no edges");
        }
        metricsRegistry.recordDiscovery(DiscoverySource.DEPENDENCY_SUMMARY.name(), fallback.edges().size());
        return new DiscoveryResult(fallback, DiscoverySource.DEPENDENCY_SUMMARY, lookback, summary.size());
    }
    
    private List<ObservedCall> collectTraceCalls(List<String> services, int lookbackMinutes) {
        List<ObservedCall> calls = new ArrayList<>();
        for (String service : services) {
            Optional<JsonNode> payload = traceBackend.traces(service, lookbackMinutes);
            payload.ifPresent(p -> calls.addAll(extractor.fromTraces(p)));
        }
        log.debug("Collected {} observed calls from {} services over {} minutes", 
            calls.size(), services.size(), lookbackMinutes);
        return calls;
    }
}
