package com.platform.resilience.probe;

import com.platform.resilience.config.ProbeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probe client over the JDK HTTP client. Response bodies are discarded.
 */
@Slf4j
@Component
public class HttpProbeClient implements ProbeClient {
    
    private final ProbeProperties properties;
    private final HttpClient httpClient;
    
    public HttpProbeClient(ProbeProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.getRequestTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }
    
    @Override
    public ProbeResult probe(ProbeTarget target) {
        long start = System.nanoTime();
        try {
            HttpResponse<Void> response = httpClient.send(buildRequest(target), HttpResponse.BodyHandlers.discarding());
            return ProbeResult.response(target.label(), response.statusCode(), Duration.ofNanos(System.nanoTime() - start));
        } catch (IOException e) {
            log.trace("Probe {} failed: {}", target.label(), e.getMessage());
            return ProbeResult.transportError(target.label(), Duration.ofNanos(System.nanoTime() - start), 
                e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.transportError(target.label(), Duration.ofNanos(System.nanoTime() - start), "interrupted");
        } catch (IllegalArgumentException e) {
            log.warn("Invalid probe target {}: {}", target.label(), e.getMessage());
            return ProbeResult.transportError(target.label(), Duration.ZERO, e.getMessage());
        }
    }
    
    HttpRequest buildRequest(ProbeTarget target) {
        HttpRequest.BodyPublisher body = target.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(target.body());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(joinUrl(properties.getBaseUrl(), target.path())))
            .timeout(properties.getRequestTimeout())
            .method(target.method(), body);
        if (target.body() != null && target.contentType() != null) {
            builder.header("Content-Type", target.contentType());
        }
        return builder.build();
    }
    
    static String joinUrl(String base, String path) {
        if (path == null || path.isEmpty()) {
            return base;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        String trimmedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return path.startsWith("/") ? trimmedBase + path : trimmedBase + "/" + path;
    }
}
