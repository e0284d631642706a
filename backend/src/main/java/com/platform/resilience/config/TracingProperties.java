package com.platform.resilience.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the Jaeger trace backend and graph discovery.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience.tracing")
public class TracingProperties {
    
    /**
     * Candidate Jaeger query API bases, tried in order.
     */
    private List<String> baseUrls = new ArrayList<>(List.of(
        "http://localhost:8080/jaeger/api",
        "http://localhost:8080/jaeger/ui/api",
        "http://localhost:16686/api"
    ));
    
    @Min(1)
    private int lookbackMinutes = 30;
    
    /**
     * Lookback used once when the first pass found nothing.
     */
    @Min(1)
    private int widenedLookbackMinutes = 60;
    
    @Min(1)
    private int traceLimit = 1000;
    
    private int connectionTimeoutMs = 5000;
    
    private int readTimeoutMs = 8000;
    
    /**
     * Disallow the dependency-summary fallback; fail when traces yield no edges.
     */
    private boolean strict = false;
    
    /**
     * Message broker services collapsed into async edges.
     */
    private List<String> brokers = new ArrayList<>(List.of("kafka", "kafka-server"));
    
    /**
     * Infrastructure services removed from the graph.
     */
    private List<String> skipServices = new ArrayList<>(List.of(
        "frontend-proxy", "jaeger", "grafana", "otel-collector", "zipkin", "prometheus", "loadgenerator"
    ));
    
    /**
     * Services queried when the backend lists none.
     */
    private List<String> fallbackServices = new ArrayList<>(List.of(
        "checkoutservice", "productcatalogservice", "cartservice", "paymentservice",
        "recommendationservice", "shippingservice", "currencyservice", "adservice",
        "emailservice", "fraudservice", "accountingservice", "frontend", "frontend-proxy"
    ));
    
    @Min(1)
    private int retryMaxAttempts = 3;
    
    private long retryWaitMs = 2000;
}
