package com.platform.resilience.error;

/**
 * Base exception for all resilience lab exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public class ResilienceException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    public ResilienceException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    public ResilienceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ResilienceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
