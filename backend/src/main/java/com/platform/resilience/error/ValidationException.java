package com.platform.resilience.error;

/**
 * Exception for invalid input: target specifications, replica maps, request parameters.
 */
public class ValidationException extends ResilienceException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String field, String message) {
        super(errorCode, String.format("Invalid value for '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    /**
     * Malformed target specification, reported with the offending endpoint label.
     */
    public static ValidationException targetSpec(String endpoint, String reason) {
        return new ValidationException(ErrorCode.INVALID_TARGET_SPEC, endpoint, reason);
    }
    
    public static ValidationException unknownService(String service, String context) {
        return new ValidationException(ErrorCode.UNKNOWN_SERVICE, context,
            "service '" + service + "' not found in graph");
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
