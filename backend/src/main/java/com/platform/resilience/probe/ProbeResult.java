package com.platform.resilience.probe;

import java.time.Duration;

/**
 * Outcome of one probe request.
 *
 * @param endpoint probe label
 * @param status   HTTP status, 0 when no response arrived
 * @param latency  time to response or failure
 * @param error    transport error message, {@code null} when a response arrived
 */
public record ProbeResult(String endpoint, int status, Duration latency, String error) {
    
    public static ProbeResult response(String endpoint, int status, Duration latency) {
        return new ProbeResult(endpoint, status, latency, null);
    }
    
    public static ProbeResult transportError(String endpoint, Duration latency, String error) {
        return new ProbeResult(endpoint, 0, latency, error == null ? "transport error" : error);
    }
    
    /**
     * A response below 500. Client errors count as served.
     */
    public boolean isSuccess() {
        return error == null && status > 0 && status < 500;
    }
}
