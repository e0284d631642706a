package com.platform.resilience.error;

/**
 * Raised when dependency discovery produced no edges and fallback is not permitted.
 */
public class DiscoveryException extends ResilienceException {
    
    public DiscoveryException(String message) {
        super(ErrorCode.NO_DEPENDENCY_EDGES, message);
    }
    
    public DiscoveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
