package io.perceptflow.core.graph.retry;

import static org.assertj.core.api.Assertions.assertThat;

import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.edge.Edge;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorPolicy")
class ErrorPolicyTest {

    private static final Node NOOP = state -> NodeResult.empty();

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph =
                Graph.builder()
                        .name("g")
                        .entry("capture")
                        .node("capture", NOOP)
                        .node("analyze", NOOP, RetryPolicy.recoverVia("capture", 1))
                        .edge(Edge.always("capture", "analyze"))
                        .edge(Edge.always("analyze", "capture"))
                        .build();
    }

    @Test
    @DisplayName("retries failures up to the allowance and exhausts on the next one")
    void shouldExhaustAfterAllowance() {
        ErrorPolicy policy =
                new ErrorPolicy(graph, EngineConfig.builder().defaultMaxRetries(2).build());

        assertThat(policy.decide("capture", 1)).isEqualTo(new RetryDecision.Retry("capture", 1, 2));
        assertThat(policy.decide("capture", 2)).isInstanceOf(RetryDecision.Retry.class);
        assertThat(policy.decide("capture", 3)).isEqualTo(new RetryDecision.Exhausted(3, 2));
    }

    @Test
    @DisplayName("routes retries to the declared recovery node")
    void shouldRouteToRecoveryNode() {
        ErrorPolicy policy = new ErrorPolicy(graph, EngineConfig.defaults());

        RetryDecision decision = policy.decide("analyze", 1);

        assertThat(decision).isInstanceOf(RetryDecision.Retry.class);
        assertThat(((RetryDecision.Retry) decision).recoveryNode()).isEqualTo("capture");
    }

    @Test
    @DisplayName("prefers configuration override over graph declaration over default")
    void shouldResolveAllowanceInPrecedenceOrder() {
        EngineConfig config =
                EngineConfig.builder().defaultMaxRetries(4).maxRetries("analyze", 7).build();

        assertThat(new ErrorPolicy(graph, config).maxRetriesFor("analyze")).isEqualTo(7);
        assertThat(new ErrorPolicy(graph, EngineConfig.defaults()).maxRetriesFor("analyze"))
                .isEqualTo(1);
        assertThat(new ErrorPolicy(graph, config).maxRetriesFor("capture")).isEqualTo(4);
    }

    @Test
    @DisplayName("exhausts on the first failure with zero allowance")
    void shouldExhaustImmediatelyWithZeroAllowance() {
        ErrorPolicy policy =
                new ErrorPolicy(graph, EngineConfig.builder().maxRetries("capture", 0).build());

        assertThat(policy.decide("capture", 1)).isInstanceOf(RetryDecision.Exhausted.class);
    }
}
