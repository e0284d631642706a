package com.platform.resilience.error;

/**
 * Required configuration input is missing or unreadable.
 */
public class ConfigurationException extends ResilienceException {
    
    private final String source;
    
    public ConfigurationException(String source, String message) {
        super(ErrorCode.CONFIGURATION_ERROR, String.format("%s: %s", source, message));
        this.source = source;
    }
    
    public ConfigurationException(String source, String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, String.format("%s: %s", source, message), cause);
        this.source = source;
    }
    
    public String getSource() {
        return source;
    }
}
