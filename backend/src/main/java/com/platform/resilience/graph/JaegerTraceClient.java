package com.platform.resilience.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.config.TracingProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Client for the Jaeger query API. Candidate base URLs are tried in order; each request is
 * retried on transport failure.
 */
@Slf4j
@Component
public class JaegerTraceClient implements TraceBackend {
    
    private final TracingProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Retry retry;
    
    public JaegerTraceClient(TracingProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectionTimeoutMs()))
            .build();
        this.retry = Retry.of("jaeger", RetryConfig.custom()
            .maxAttempts(properties.getRetryMaxAttempts())
            .waitDuration(Duration.ofMillis(properties.getRetryWaitMs()))
            .retryOnException(JaegerTraceClient::isTransient)
            .build());
        this.retry.getEventPublisher().onRetry(event -> 
            log.debug("Retrying Jaeger request (attempt {}): {}", 
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }
    
    @Override
    public List<String> services() {
        for (String base : properties.getBaseUrls()) {
            Optional<JsonNode> payload = fetch(base, "/services");
            if (payload.isEmpty()) {
                continue;
            }
            JsonNode node = payload.get();
            JsonNode list = node.isArray() ? node : node.path("data");
            TreeSet<String> services = new TreeSet<>();
            list.forEach(s -> services.add(s.asText()));
            if (!services.isEmpty()) {
                log.info("Jaeger at {} reports {} services", base, services.size());
                return new ArrayList<>(services);
            }
        }
        return List.of();
    }
    
    @Override
    public Optional<JsonNode> traces(String service, int lookbackMinutes) {
        String query = String.format("/traces?service=%s&lookback=%dm&end=%d&limit=%d",
            URLEncoder.encode(service, StandardCharsets.UTF_8),
            Math.max(1, lookbackMinutes),
            System.currentTimeMillis(),
            properties.getTraceLimit());
        for (String base : properties.getBaseUrls()) {
            Optional<JsonNode> payload = fetch(base, query);
            if (payload.isPresent()) {
                return payload;
            }
        }
        return Optional.empty();
    }
    
    @Override
    public Optional<JsonNode> dependencySummary(int lookbackMinutes) {
        String query = String.format("/dependencies?endTs=%d&lookback=%d",
            System.currentTimeMillis(), Math.max(1, lookbackMinutes) * 60L * 1000L);
        for (String base : properties.getBaseUrls()) {
            Optional<JsonNode> payload = fetch(base, query);
            if (payload.isPresent()) {
                return payload;
            }
        }
        return Optional.empty();
    }
    
    /**
     * GET one JSON document. Unreachable bases and non-JSON answers yield empty.
     */
    private Optional<JsonNode> fetch(String base, String pathAndQuery) {
        String url = stripTrailingSlash(base) + pathAndQuery;
        try {
            return retry.executeSupplier(() -> get(url));
        } catch (ResilienceException e) {
            if (e.getErrorCode() == ErrorCode.EXPERIMENT_INTERRUPTED) {
                throw e;
            }
            log.debug("Jaeger request {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
    
    private Optional<JsonNode> get(String url) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .header("Accept", "application/json")
            .GET()
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ResilienceException(ErrorCode.TRACE_BACKEND_ERROR, "GET " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResilienceException(ErrorCode.EXPERIMENT_INTERRUPTED, "Interrupted during GET " + url, e);
        }
        
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase();
        if (response.statusCode() / 100 != 2 || !contentType.contains("application/json")) {
            log.debug("Ignoring {} answer from {} ({})", response.statusCode(), url, contentType);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON from {}: {}", url, e.getOriginalMessage());
            return Optional.empty();
        }
    }
    
    private static boolean isTransient(Throwable throwable) {
        return throwable instanceof ResilienceException
            && ((ResilienceException) throwable).getErrorCode() == ErrorCode.TRACE_BACKEND_ERROR;
    }
    
    private static String stripTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
