package com.platform.resilience.estimator;

import com.platform.resilience.chaos.SamplingLaw;
import com.platform.resilience.config.ExperimentProperties;
import com.platform.resilience.fleet.Disallowlist;
import com.platform.resilience.fleet.EligibilityPolicy;
import com.platform.resilience.graph.DependencyEdge;
import com.platform.resilience.graph.DependencyGraph;
import com.platform.resilience.graph.Transport;
import com.platform.resilience.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ReliabilityEstimator")
class ReliabilityEstimatorTest {
    
    private static final int TRIALS = 20_000;
    private static final double TOLERANCE = 0.03;
    
    private static final TargetSpec CHECKOUT_AND_PAYMENT = new TargetSpec("checkout", "frontend",
        new SuccessRule.AllOf(List.of("checkout", "payment")), true);
    
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private ReliabilityEstimator estimator;
    
    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        meterRegistry = new SimpleMeterRegistry();
        ExperimentProperties properties = new ExperimentProperties();
        properties.getModel().setParallelism(2);
        estimator = new ReliabilityEstimator(executor, properties, new MetricsRegistry(meterRegistry));
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    private static SimulationModel chain(Transport checkoutToPayment) {
        return chain(checkoutToPayment, ReplicaMap.single());
    }
    
    private static SimulationModel chain(Transport checkoutToPayment, ReplicaMap replicas) {
        DependencyGraph graph = new DependencyGraph(
            List.of("frontend", "checkout", "payment"),
            List.of(
                new DependencyEdge("frontend", "checkout", Transport.SYNC),
                new DependencyEdge("checkout", "payment", checkoutToPayment)),
            List.of("frontend"));
        EligibilityPolicy policy = new EligibilityPolicy(
            Disallowlist.of(List.of("frontend"), List.of()), "(frontend)$", List.of("frontend"));
        return new SimulationModel(graph, replicas, policy.classify(graph.nodes()));
    }
    
    @Nested
    @DisplayName("under the Bernoulli law")
    class Bernoulli {
        
        @Test
        @DisplayName("blocking chain succeeds when both services survive")
        void blockingChain() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.SYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.3, TRIALS, SamplingLaw.BERNOULLI);
            
            assertThat(estimate.mean()).isCloseTo(0.49, within(TOLERANCE));
            assertThat(estimate.trials()).isEqualTo(TRIALS);
            assertThat(estimate.endpoint()).isEqualTo("checkout");
        }
        
        @Test
        @DisplayName("non-blocking semantics set aside the async payment hop")
        void asyncHopSetAside() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.ASYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.NON_BLOCKING, 0.3, TRIALS, SamplingLaw.BERNOULLI);
            
            assertThat(estimate.mean()).isCloseTo(0.70, within(TOLERANCE));
        }
        
        @Test
        @DisplayName("blocking semantics still traverse async edges")
        void blockingTraversesAsync() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.ASYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.3, TRIALS, SamplingLaw.BERNOULLI);
            
            assertThat(estimate.mean()).isCloseTo(0.49, within(TOLERANCE));
        }
    }
    
    @Nested
    @DisplayName("under the fixed-proportion law")
    class FixedProportion {
        
        @Test
        @DisplayName("always kills one of the two eligible services")
        void blockingChainAlwaysFails() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.SYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.3, TRIALS, SamplingLaw.FIXED_PROPORTION);
            
            assertThat(estimate.mean()).isZero();
            assertThat(estimate.successes()).isZero();
        }
        
        @Test
        @DisplayName("succeeds whenever the victim is the async payment hop")
        void asyncHalf() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.ASYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.NON_BLOCKING, 0.3, TRIALS, SamplingLaw.FIXED_PROPORTION);
            
            assertThat(estimate.mean()).isCloseTo(0.5, within(TOLERANCE));
        }
        
        @Test
        @DisplayName("a service survives while one of its replicas is alive")
        void replicasAbsorbKills() {
            SimulationModel model = chain(Transport.SYNC, ReplicaMap.of(Map.of("payment", 2)));
            
            ModelEstimate estimate = estimator.estimateEndpoint(model, CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 1.0 / 3.0, TRIALS, SamplingLaw.FIXED_PROPORTION);
            
            assertThat(model.populationSize()).isEqualTo(3);
            assertThat(estimate.mean()).isCloseTo(2.0 / 3.0, within(TOLERANCE));
        }
    }
    
    @Nested
    @DisplayName("boundary fractions")
    class Boundaries {
        
        @Test
        @DisplayName("p = 0 always succeeds")
        void noFailures() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.SYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.0, 1_000, SamplingLaw.FIXED_PROPORTION);
            
            assertThat(estimate.mean()).isEqualTo(1.0);
            assertThat(estimate.stdDev()).isZero();
        }
        
        @Test
        @DisplayName("p = 1 always fails when targets are eligible")
        void allFail() {
            ModelEstimate estimate = estimator.estimateEndpoint(chain(Transport.SYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 1.0, 1_000, SamplingLaw.BERNOULLI);
            
            assertThat(estimate.mean()).isZero();
        }
        
        @Test
        @DisplayName("rejects fractions outside [0, 1] and empty trial counts")
        void rejectsInvalidInput() {
            SimulationModel model = chain(Transport.SYNC);
            
            assertThatThrownBy(() -> estimator.estimateEndpoint(model, CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 1.5, 100, SamplingLaw.BERNOULLI))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> estimator.estimateEndpoint(model, CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.3, 0, SamplingLaw.BERNOULLI))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
    
    @Nested
    @DisplayName("aggregate and uniform estimates")
    class Composite {
        
        @Test
        @DisplayName("aggregate succeeds while frontend reaches the leaf")
        void aggregate() {
            SimulationModel model = chain(Transport.SYNC);
            
            ModelEstimate healthy = estimator.estimateAggregate(model, SemanticsMode.BLOCKING, 0.0, 500, 
                SamplingLaw.FIXED_PROPORTION);
            ModelEstimate dead = estimator.estimateAggregate(model, SemanticsMode.BLOCKING, 1.0, 500,
                SamplingLaw.FIXED_PROPORTION);
            
            assertThat(healthy.isAggregate()).isTrue();
            assertThat(healthy.mean()).isEqualTo(1.0);
            assertThat(dead.mean()).isZero();
            assertThat(healthy.graphHash()).isEqualTo(model.graph().fingerprint());
        }
        
        @Test
        @DisplayName("uniform estimate averages the endpoints")
        void uniform() {
            TargetSpec checkoutOnly = new TargetSpec("cart", "frontend", 
                new SuccessRule.AllOf(List.of("checkout")), false);
            
            ModelEstimate estimate = estimator.estimateUniform(chain(Transport.SYNC), 
                List.of(checkoutOnly, CHECKOUT_AND_PAYMENT), SemanticsMode.BLOCKING, 0.3, TRIALS, 
                SamplingLaw.BERNOULLI);
            
            assertThat(estimate.endpoint()).isEqualTo(ModelEstimate.UNIFORM_ENDPOINT);
            assertThat(estimate.mean()).isCloseTo((0.7 + 0.49) / 2, within(TOLERANCE));
        }
        
        @Test
        @DisplayName("records simulated trials")
        void recordsMetrics() {
            estimator.estimateEndpoint(chain(Transport.SYNC), CHECKOUT_AND_PAYMENT,
                SemanticsMode.BLOCKING, 0.0, 200, SamplingLaw.BERNOULLI);
            
            assertThat(meterRegistry.getMeters()).isNotEmpty();
        }
    }
    
    @Test
    @DisplayName("a single trial reports its kill set")
    void simulateTrial() {
        SimulationModel model = chain(Transport.SYNC);
        EndpointEvaluator evaluator = EndpointEvaluator.compile(model.graph(), CHECKOUT_AND_PAYMENT, 
            SemanticsMode.BLOCKING);
        
        SimulationTrial trial = estimator.simulateTrial(model, evaluator, SemanticsMode.BLOCKING, 0.5,
            SamplingLaw.FIXED_PROPORTION, new SplittableRandom(7));
        
        assertThat(trial.killSet()).hasSize(1);
        assertThat(trial.killSet().get(0).service()).isIn("checkout", "payment");
        assertThat(trial.success()).isFalse();
        assertThat(trial.endpoint()).isEqualTo("checkout");
    }
}
