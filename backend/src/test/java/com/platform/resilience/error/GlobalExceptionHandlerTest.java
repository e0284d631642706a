package com.platform.resilience.error;

import com.platform.resilience.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {
    
    private SimpleMeterRegistry meterRegistry;
    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        handler = new GlobalExceptionHandler(new MetricsRegistry(meterRegistry));
        request = new MockHttpServletRequest("POST", "/api/experiments/comparisons");
    }
    
    @AfterEach
    void tearDown() {
        MDC.clear();
    }
    
    @Nested
    @DisplayName("status mapping")
    class StatusMapping {
        
        @Test
        @DisplayName("maps graph mismatches to conflict")
        void graphMismatch() {
            ResponseEntity<ErrorResponse> response = handler.handleResilienceException(
                new ResilienceException(ErrorCode.GRAPH_MISMATCH, "hash a vs b"), request);
            
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(response.getBody().getCode()).isEqualTo(ErrorCode.GRAPH_MISMATCH.getCode());
            assertThat(response.getBody().getPath()).isEqualTo("/api/experiments/comparisons");
            assertThat(response.getBody().getTraceId()).isNotBlank();
        }
        
        @Test
        @DisplayName("maps upstream failures to bad gateway and missing edges to unavailable")
        void upstream() {
            assertThat(handler.mapErrorCodeToStatus(ErrorCode.TRACE_BACKEND_ERROR)).isEqualTo(HttpStatus.BAD_GATEWAY);
            assertThat(handler.mapErrorCodeToStatus(ErrorCode.PROBE_ERROR)).isEqualTo(HttpStatus.BAD_GATEWAY);
            assertThat(handler.mapErrorCodeToStatus(ErrorCode.NO_DEPENDENCY_EDGES))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(handler.mapErrorCodeToStatus(ErrorCode.EXPERIMENT_INTERRUPTED))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }
    
    @Test
    @DisplayName("reports missing artifacts as not found with their key")
    void artifactNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleArtifactNotFound(
            new ArtifactNotFoundException("live windows", "p=0.3"), request);
        
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getMetadata())
            .containsEntry("artifactType", "live windows")
            .containsEntry("artifactKey", "p=0.3");
    }
    
    @Test
    @DisplayName("reports the rejected field of a validation failure")
    void validation() {
        ResponseEntity<ErrorResponse> response = handler.handleValidation(
            new ValidationException("windows", 0, "must be at least 1"), request);
        
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getFieldErrors()).hasSize(1);
        assertThat(response.getBody().getFieldErrors().get(0).getField()).isEqualTo("windows");
        assertThat(response.getBody().getFieldErrors().get(0).getRejectedValue()).isEqualTo(0);
    }
    
    @Test
    @DisplayName("reports platform failures as bad gateway with the container")
    void platformFailure() {
        ResponseEntity<ErrorResponse> response = handler.handlePlatformOperation(
            new PlatformOperationException("demo-cart-1", "stop", "docker exited with 1"), request);
        
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getMetadata()).containsEntry("container", "demo-cart-1");
    }
    
    @Test
    @DisplayName("counts every handled error")
    void countsErrors() {
        handler.handleGenericException(new IllegalStateException("boom"), request);
        
        assertThat(meterRegistry.find("errors").tag("code", ErrorCode.UNEXPECTED_ERROR.getCode()).counter())
            .isNotNull();
    }
}
