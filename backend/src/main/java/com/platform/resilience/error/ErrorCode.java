package com.platform.resilience.error;

/**
 * Standardized error codes for the resilience lab.
 * 
 * Format: RL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (target specs, replica maps, request parameters)
 * - 3xx: Resource errors (artifacts not found)
 * - 4xx: External system errors (container platform, trace backend, probes)
 * - 5xx: Experiment domain errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("RL-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_TARGET_SPEC("RL-101", "Invalid target specification", ErrorCategory.FATAL),
    INVALID_REPLICA_MAP("RL-102", "Invalid replica map", ErrorCategory.FATAL),
    INVALID_FIELD_VALUE("RL-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNKNOWN_SERVICE("RL-104", "Service not present in dependency graph", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("RL-105", "Invalid request", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("RL-106", "Missing required field", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("RL-107", "Constraint violation", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    ARTIFACT_NOT_FOUND("RL-300", "Artifact not found", ErrorCategory.RECOVERABLE),
    
    // ==================== External System Errors (4xx) ====================
    
    PLATFORM_COMMAND_FAILED("RL-400", "Container platform command failed", ErrorCategory.RECOVERABLE),
    PLATFORM_UNAVAILABLE("RL-401", "Container platform unavailable", ErrorCategory.RECOVERABLE),
    TRACE_BACKEND_ERROR("RL-410", "Trace backend error", ErrorCategory.RECOVERABLE),
    NO_DEPENDENCY_EDGES("RL-411", "No dependency edges discovered", ErrorCategory.FATAL),
    PROBE_ERROR("RL-420", "Probe request failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Experiment Errors (5xx - Domain) ====================
    
    GRAPH_MISMATCH("RL-500", "Model estimates were computed over different graphs", ErrorCategory.FATAL),
    EXPERIMENT_INTERRUPTED("RL-501", "Experiment interrupted", ErrorCategory.RECOVERABLE),
    WARMUP_TIMEOUT("RL-502", "System under test did not warm up", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("RL-900", "Internal error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("RL-901", "Unexpected error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("RL-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("RL-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the run continues, the failure is logged.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the requested operation cannot proceed with this input.
         */
        FATAL
    }
}
