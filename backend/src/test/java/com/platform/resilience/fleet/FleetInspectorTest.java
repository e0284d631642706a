package com.platform.resilience.fleet;

import com.platform.resilience.error.PlatformOperationException;
import com.platform.resilience.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
@DisplayName("FleetInspector")
class FleetInspectorTest {
    
    @Mock
    private ContainerPlatform platform;
    
    private FleetInspector inspector;
    
    @BeforeEach
    void setUp() {
        EligibilityPolicy policy = new EligibilityPolicy(
            Disallowlist.of(List.of("frontend"), List.of()), "(frontend|jaeger)$", List.of("frontend"));
        inspector = new FleetInspector(platform, policy, new MetricsRegistry(new SimpleMeterRegistry()));
    }
    
    private static ContainerInstance container(String name, String service, ContainerState state) {
        return new ContainerInstance(name, service, service, state);
    }
    
    @Nested
    @DisplayName("inspect")
    class Inspect {
        
        @Test
        @DisplayName("partitions containers by service eligibility")
        void partitions() {
            when(platform.listContainers()).thenReturn(List.of(
                container("demo-frontend-1", "frontend", ContainerState.RUNNING),
                container("demo-cart-1", "cart", ContainerState.RUNNING),
                container("demo-cart-2", "cart", ContainerState.EXITED),
                container("demo-payment-1", "payment", ContainerState.RUNNING)));
            
            FleetSnapshot snapshot = inspector.inspect();
            
            assertThat(snapshot.eligible()).extracting(ContainerInstance::name)
                .containsExactly("demo-cart-1", "demo-cart-2", "demo-payment-1");
            assertThat(snapshot.excluded()).extracting(ContainerInstance::name).containsExactly("demo-frontend-1");
            assertThat(snapshot.exclusionSource()).isEqualTo(ExclusionSource.DISALLOWLIST);
            assertThat(snapshot.services()).containsKeys("frontend", "cart", "payment");
        }
        
        @Test
        @DisplayName("yields an empty snapshot when enumeration fails")
        void enumerationFailure() {
            when(platform.listContainers()).thenThrow(new PlatformOperationException("*", "ps", "docker not found"));
            
            FleetSnapshot snapshot = inspector.inspect();
            
            assertThat(snapshot.eligibleCount()).isZero();
            assertThat(snapshot.excluded()).isEmpty();
        }
    }
    
    @Nested
    @DisplayName("prepareWindow")
    class PrepareWindow {
        
        @Test
        @DisplayName("restarts stopped eligible containers before the window")
        void restartsStopped() {
            ContainerInstance running = container("demo-cart-1", "cart", ContainerState.RUNNING);
            ContainerInstance stopped = container("demo-payment-1", "payment", ContainerState.EXITED);
            when(platform.inspectState("demo-payment-1")).thenReturn(ContainerState.RUNNING);
            FleetSnapshot snapshot = new FleetSnapshot(List.of(running, stopped), List.of(), Map.of(),
                ExclusionSource.DISALLOWLIST);
            
            FleetSnapshot prepared = inspector.prepareWindow(snapshot);
            
            verify(platform).start("demo-payment-1");
            verify(platform, never()).start("demo-cart-1");
            assertThat(prepared.eligible()).extracting(ContainerInstance::state)
                .containsOnly(ContainerState.RUNNING);
            assertThat(prepared.eligibleCount()).isEqualTo(2);
        }
        
        @Test
        @DisplayName("drops containers that cannot be restored")
        void dropsUnrecoverable() {
            ContainerInstance stopped = container("demo-payment-1", "payment", ContainerState.DEAD);
            doThrow(new PlatformOperationException("demo-payment-1", "start", "no such container"))
                .when(platform).start("demo-payment-1");
            FleetSnapshot snapshot = new FleetSnapshot(List.of(stopped), List.of(), Map.of(),
                ExclusionSource.DISALLOWLIST);
            
            assertThat(inspector.prepareWindow(snapshot).eligible()).isEmpty();
        }
    }
}
