package com.platform.resilience.chaos;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.error.ErrorCode;
import com.platform.resilience.error.ResilienceException;
import com.platform.resilience.fleet.Disallowlist;
import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.fleet.FleetInspector;
import com.platform.resilience.fleet.FleetSnapshot;
import com.platform.resilience.fleet.InMemoryContainerPlatform;
import com.platform.resilience.lifecycle.ChaosSafetyNet;
import com.platform.resilience.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChaosExecutor")
class ChaosExecutorTest {
    
    @TempDir
    Path runDir;
    
    private InMemoryContainerPlatform platform;
    private ExperimentProperties properties;
    private ExecutorService executor;
    private MetricsRegistry metrics;
    private ChaosSafetyNet safetyNet;
    private ChaosWindowLog windowLog;
    private final List<Duration> sleeps = new ArrayList<>();
    
    @BeforeEach
    void setUp() {
        platform = new InMemoryContainerPlatform()
            .add("demo-frontend-1", "frontend")
            .add("demo-cart-1", "cart")
            .add("demo-checkout-1", "checkout")
            .add("demo-payment-1", "payment")
            .add("demo-shipping-1", "shipping");
        properties = new ExperimentProperties();
        executor = Executors.newFixedThreadPool(4);
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        safetyNet = new ChaosSafetyNet();
        windowLog = new ChaosWindowLog(runDir.resolve("window_log.jsonl"), new ObjectMapper().findAndRegisterModules());
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    private ChaosExecutor executor(Sleeper sleeper) {
        return new ChaosExecutor(platform, properties, executor, metrics, safetyNet, sleeper);
    }
    
    private FleetSnapshot fleet() {
        EligibilityPolicy policy = new EligibilityPolicy(
            Disallowlist.of(List.of("frontend"), List.of()), "(frontend)$", List.of("frontend"));
        return new FleetInspector(platform, policy, metrics).inspect();
    }
    
    private ChaosWindowRequest request(int windowId, double p) {
        return new ChaosWindowRequest("run-1", windowId, p, Duration.ofSeconds(20), SamplingLaw.FIXED_PROPORTION);
    }
    
    @Nested
    @DisplayName("a normal window")
    class NormalWindow {
        
        @Test
        @DisplayName("stops the kill set during cooling and restores it afterwards")
        void stopsAndRestores() {
            List<Long> runningDuringCooling = new ArrayList<>();
            ChaosExecutor chaos = executor(duration -> {
                sleeps.add(duration);
                runningDuringCooling.add(platform.runningCount());
            });
            
            ChaosWindow window = chaos.runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.eligible()).isEqualTo(4);
            assertThat(window.killed()).isEqualTo(2);
            assertThat(window.containers()).hasSize(2).doesNotContain("demo-frontend-1");
            assertThat(runningDuringCooling).containsExactly(3L);
            assertThat(sleeps).containsExactly(Duration.ofSeconds(20));
            assertThat(platform.runningCount()).isEqualTo(5);
            window.containers().forEach(c -> assertThat(platform.restartPolicy(c)).isEqualTo("unless-stopped"));
            assertThat(window.anomalies()).isEmpty();
            assertThat(window.restoreFailures()).isEmpty();
        }
        
        @Test
        @DisplayName("records sorted logical service names of the victims")
        void resolvesServices() {
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 1.0), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.services()).containsExactly("cart", "checkout", "payment", "shipping");
        }
        
        @Test
        @DisplayName("appends exactly one record to the window log")
        void logsWindow() {
            ChaosExecutor chaos = executor(d -> { });
            chaos.runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            chaos.runWindow(request(1, 0.5), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(windowLog.readAll()).extracting(ChaosWindow::windowId).containsExactly(0, 1);
            assertThat(MDC.get("runId")).isNull();
        }
        
        @Test
        @DisplayName("notifies the listener once victims are down")
        void notifiesListener() {
            List<List<String>> outages = new ArrayList<>();
            executor(d -> { }).runWindow(request(3, 0.25), fleet(), windowLog, new SplittableRandom(),
                (windowId, victims, start) -> {
                    assertThat(windowId).isEqualTo(3);
                    victims.forEach(v -> assertThat(platform.state(v).isStopped()).isTrue());
                    outages.add(victims);
                });
            
            assertThat(outages).hasSize(1);
            assertThat(outages.get(0)).hasSize(1);
        }
    }
    
    @Nested
    @DisplayName("edge cases")
    class EdgeCases {
        
        @Test
        @DisplayName("p = 0 kills nothing but still logs the window")
        void zeroFraction() {
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 0.0), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.killed()).isZero();
            assertThat(platform.operations()).isEmpty();
            assertThat(windowLog.readAll()).hasSize(1);
        }
        
        @Test
        @DisplayName("an empty fleet produces a logged no-op window")
        void emptyFleet() {
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 0.7), FleetSnapshot.empty(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.eligible()).isZero();
            assertThat(window.killed()).isZero();
            assertThat(windowLog.readAll()).hasSize(1);
        }
        
        @Test
        @DisplayName("a victim that keeps running is recorded as an anomaly")
        void anomaly() {
            platform.ignoreStop("demo-cart-1").ignoreStop("demo-checkout-1")
                .ignoreStop("demo-payment-1").ignoreStop("demo-shipping-1");
            
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 0.25), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.isAnomalous()).isTrue();
            assertThat(window.anomalies()).singleElement()
                .satisfies(a -> assertThat(a.observedState()).isEqualTo("RUNNING"));
        }
        
        @Test
        @DisplayName("an uninspectable victim is recorded as an UNKNOWN anomaly")
        void inspectFailure() {
            platform.failInspect("demo-cart-1").failInspect("demo-checkout-1")
                .failInspect("demo-payment-1").failInspect("demo-shipping-1");
            
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.anomalies()).hasSize(2).allSatisfy(a -> assertThat(a.observedState()).isEqualTo("UNKNOWN"));
        }
        
        @Test
        @DisplayName("a failed stop does not abort the window")
        void stopFailure() {
            platform.failStop("demo-cart-1").failStop("demo-checkout-1")
                .failStop("demo-payment-1").failStop("demo-shipping-1");
            
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.killed()).isEqualTo(2);
            assertThat(window.anomalies()).hasSize(2);
            assertThat(platform.runningCount()).isEqualTo(5);
        }
        
        @Test
        @DisplayName("a failed restart is reported in the window record")
        void restoreFailure() {
            platform.failStart("demo-cart-1").failStart("demo-checkout-1")
                .failStart("demo-payment-1").failStart("demo-shipping-1");
            
            ChaosWindow window = executor(d -> { })
                .runWindow(request(0, 1.0), fleet(), windowLog, new SplittableRandom(), OutageListener.NONE);
            
            assertThat(window.restoreFailures()).containsExactlyInAnyOrder(
                "demo-cart-1", "demo-checkout-1", "demo-payment-1", "demo-shipping-1");
        }
    }
    
    @Nested
    @DisplayName("abnormal exits")
    class AbnormalExits {
        
        @Test
        @DisplayName("restores and logs when the listener throws")
        void listenerFailure() {
            ChaosExecutor chaos = executor(d -> { });
            
            assertThatThrownBy(() -> chaos.runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(),
                (id, victims, start) -> {
                    throw new IllegalStateException("scheduler gone");
                }))
                .isInstanceOf(IllegalStateException.class);
            
            assertThat(platform.runningCount()).isEqualTo(5);
            assertThat(windowLog.readAll()).hasSize(1);
            assertThat(safetyNet.heldCount()).isZero();
        }
        
        @Test
        @DisplayName("restores, logs and reports interruption during cooling")
        void interrupted() {
            ChaosExecutor chaos = executor(d -> {
                throw new InterruptedException("stop requested");
            });
            
            try {
                assertThatThrownBy(() -> chaos.runWindow(request(0, 0.5), fleet(), windowLog, new SplittableRandom(),
                    OutageListener.NONE))
                    .isInstanceOf(ResilienceException.class)
                    .satisfies(e -> assertThat(((ResilienceException) e).getErrorCode())
                        .isEqualTo(ErrorCode.EXPERIMENT_INTERRUPTED));
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
            
            assertThat(platform.runningCount()).isEqualTo(5);
            assertThat(windowLog.readAll()).hasSize(1);
        }
    }
}
