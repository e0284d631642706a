package com.platform.resilience.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.config.TracingProperties;
import com.platform.resilience.error.DiscoveryException;
import com.platform.resilience.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DependencyDiscoveryService")
class DependencyDiscoveryServiceTest {
    
    @Mock
    private TraceBackend traceBackend;
    
    private final ObjectMapper mapper = new ObjectMapper();
    private TracingProperties tracing;
    private ExperimentProperties experiment;
    
    @BeforeEach
    void setUp() {
        tracing = new TracingProperties();
        experiment = new ExperimentProperties();
    }
    
    private DependencyDiscoveryService service() {
        return new DependencyDiscoveryService(traceBackend, tracing, experiment, new MetricsRegistry(new SimpleMeterRegistry()));
    }
    
    private JsonNode fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/jaeger/checkout-traces.json")) {
            return mapper.readTree(in);
        }
    }
    
    @Test
    @DisplayName("builds the graph from traces when they contain edges")
    void fromTraces() throws IOException {
        when(traceBackend.services()).thenReturn(List.of("checkoutservice"));
        when(traceBackend.traces("checkoutservice", 30)).thenReturn(Optional.of(fixture()));
        
        DiscoveryResult result = service().discover();
        
        assertThat(result.source()).isEqualTo(DiscoverySource.TRACES);
        assertThat(result.lookbackMinutes()).isEqualTo(30);
        assertThat(result.graph().nodes())
            .containsExactly("accounting", "cart", "checkout", "currency", "fraud-detection", "frontend");
        assertThat(result.graph().asyncEdges()).extracting(DependencyEdge::callee)
            .containsExactly("accounting", "fraud-detection");
        assertThat(result.graph().entrypoints()).containsExactly("frontend");
        verify(traceBackend, never()).dependencySummary(anyInt());
    }
    
    @Test
    @DisplayName("queries the well-known services when the backend lists none")
    void fallbackServiceList() throws IOException {
        when(traceBackend.services()).thenReturn(List.of());
        when(traceBackend.traces(anyString(), anyInt())).thenReturn(Optional.empty());
        when(traceBackend.traces(eq("checkoutservice"), anyInt())).thenReturn(Optional.of(fixture()));
        
        assertThat(service().discover().graph().edges()).isNotEmpty();
    }
    
    @Nested
    @DisplayName("when traces yield no edges")
    class NoTraceEdges {
        
        @BeforeEach
        void emptyTraces() {
            when(traceBackend.services()).thenReturn(List.of("cart"));
            when(traceBackend.traces(eq("cart"), anyInt())).thenReturn(Optional.empty());
        }
        
        @Test
        @DisplayName("widens the lookback before giving up on traces")
        void widens() {
            tracing.setStrict(true);
            
            assertThatThrownBy(() -> service().discover()).isInstanceOf(DiscoveryException.class);
            
            verify(traceBackend).traces("cart", 30);
            verify(traceBackend).traces("cart", 60);
        }
        
        @Test
        @DisplayName("strict mode fails instead of using the dependency summary")
        void strict() {
            tracing.setStrict(true);
            
            assertThatThrownBy(() -> service().discover())
                .isInstanceOf(DiscoveryException.class)
                .hasMessageContaining("strict");
            verify(traceBackend, never()).dependencySummary(anyInt());
        }
        
        @Test
        @DisplayName("non-strict mode falls back to the dependency summary")
        void fallback() throws IOException {
            when(traceBackend.dependencySummary(60)).thenReturn(Optional.of(mapper.readTree(
                "[{\"parent\":\"frontend\",\"child\":\"cartservice\",\"callCount\":7}]")));
            
            DiscoveryResult result = service().discover();
            
            assertThat(result.source()).isEqualTo(DiscoverySource.DEPENDENCY_SUMMARY);
            assertThat(result.graph().edges()).containsExactly(new DependencyEdge("frontend", "cart", Transport.SYNC));
        }
        
        @Test
        @DisplayName("fails when the dependency summary is empty too")
        void bothEmpty() {
            when(traceBackend.dependencySummary(anyInt())).thenReturn(Optional.empty());
            
            assertThatThrownBy(() -> service().discover()).isInstanceOf(DiscoveryException.class);
        }
    }
}
