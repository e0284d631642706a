package com.platform.resilience.error;

/**
 * Failure of a single container platform command (stop, start, inspect, update).
 * Always scoped to one container; callers log it and continue with the rest of the window.
 */
public class PlatformOperationException extends ResilienceException {
    
    private final String container;
    private final String operation;
    
    public PlatformOperationException(String container, String operation, String message) {
        super(ErrorCode.PLATFORM_COMMAND_FAILED, message);
        this.container = container;
        this.operation = operation;
    }
    
    public PlatformOperationException(String container, String operation, String message, Throwable cause) {
        super(ErrorCode.PLATFORM_COMMAND_FAILED, message, cause);
        this.container = container;
        this.operation = operation;
    }
    
    public static PlatformOperationException commandFailed(String container, String operation, int exitCode, String output) {
        return new PlatformOperationException(
            container,
            operation,
            String.format("docker %s %s exited with %d: %s", operation, container, exitCode, output)
        );
    }
    
    public String getContainer() {
        return container;
    }
    
    public String getOperation() {
        return operation;
    }
}
