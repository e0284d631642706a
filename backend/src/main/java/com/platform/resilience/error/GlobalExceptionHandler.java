package com.platform.resilience.error;

import com.platform.resilience.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps exceptions raised by the experiment API to {@link ErrorResponse} bodies.
 * Every error is logged and counted; fatal codes log at ERROR with the stack trace.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Resilience Lab Exceptions ====================
    
    @ExceptionHandler(ResilienceException.class)
    public ResponseEntity<ErrorResponse> handleResilienceException(
            ResilienceException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleArtifactNotFound(
            ArtifactNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Artifact not found: {} ({})", traceId, ex.getArtifactType(), ex.getArtifactKey());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.NOT_FOUND.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "artifactType", ex.getArtifactType(),
            "artifactKey", ex.getArtifactKey()
        ));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        if (ex.getField() != null) {
            response.setFieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(PlatformOperationException.class)
    public ResponseEntity<ErrorResponse> handlePlatformOperation(
            PlatformOperationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] Container platform failure: {} on {} - {}", 
            traceId, ex.getOperation(), ex.getContainer(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), 
            HttpStatus.BAD_GATEWAY.value(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "container", String.valueOf(ex.getContainer()),
            "operation", String.valueOf(ex.getOperation())
        ));
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }
    
    // ==================== Spring Validation ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .collect(Collectors.toList());
        
        log.warn("[{}] Request validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed", 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ErrorResponse.FieldError.builder()
                .field(getFieldName(cv))
                .message(cv.getMessage())
                .rejectedValue(cv.getInvalidValue())
                .build())
            .collect(Collectors.toList());
        
        log.warn("[{}] Constraint violation: {} violations", traceId, fieldErrors.size());
        recordMetric(ErrorCode.CONSTRAINT_VIOLATION);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.CONSTRAINT_VIOLATION, "Constraint violation", 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Unreadable request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Invalid request body", 
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Missing required parameter: %s", ex.getParameterName()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Rejected argument: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE,
            ex.getMessage(), HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId));
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Method not supported: {} on {}", traceId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ErrorResponse.of(ErrorCode.INVALID_REQUEST,
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED.value(), request.getRequestURI(), traceId));
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred", 
            HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
    
    private void logError(ResilienceException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case ARTIFACT_NOT_FOUND -> 
                HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, INVALID_TARGET_SPEC, INVALID_REPLICA_MAP, INVALID_FIELD_VALUE, UNKNOWN_SERVICE,
                 INVALID_REQUEST, MISSING_REQUIRED_FIELD, CONSTRAINT_VIOLATION ->
                HttpStatus.BAD_REQUEST;
            case GRAPH_MISMATCH -> 
                HttpStatus.CONFLICT;
            case PLATFORM_COMMAND_FAILED, TRACE_BACKEND_ERROR, PROBE_ERROR -> 
                HttpStatus.BAD_GATEWAY;
            case PLATFORM_UNAVAILABLE, NO_DEPENDENCY_EDGES, WARMUP_TIMEOUT -> 
                HttpStatus.SERVICE_UNAVAILABLE;
            default -> 
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
    
    private String getFieldName(ConstraintViolation<?> cv) {
        String path = cv.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot > 0 ? path.substring(lastDot + 1) : path;
    }
}
