package io.perceptflow.core.graph.edge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.perceptflow.core.graph.MalformedEdgeException;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionState;
import io.perceptflow.core.state.StateView;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EdgeRouter")
class EdgeRouterTest {

    @Test
    @DisplayName("takes the first matching route in declaration order")
    void shouldPreferFirstDeclaredRoute() {
        Edge edge =
                Edge.from("start")
                        .when("p1", s -> s.getBoolean("p1"), "A")
                        .when("p2", s -> s.getBoolean("p2"), "B")
                        .otherwise("C");
        EdgeRouter router = new EdgeRouter(List.of(edge));

        assertThat(router.route(stateAt("start", Map.of("p1", true, "p2", true))))
                .isEqualTo("A");
        assertThat(router.route(stateAt("start", Map.of("p2", true)))).isEqualTo("B");
    }

    @Test
    @DisplayName("falls back to the default target when no route matches")
    void shouldUseDefault() {
        Edge edge =
                Edge.from("start")
                        .when("p1", s -> s.getBoolean("p1"), "A")
                        .when("p2", s -> s.getBoolean("p2"), "B")
                        .otherwise("C");
        EdgeRouter router = new EdgeRouter(List.of(edge));

        assertThat(router.route(stateAt("start", Map.of()))).isEqualTo("C");
    }

    @Test
    @DisplayName("routes unconditional edges")
    void shouldRouteAlways() {
        EdgeRouter router = new EdgeRouter(List.of(Edge.always("a", "b")));

        assertThat(router.route(stateAt("a", Map.of()))).isEqualTo("b");
        assertThat(router.edgeFor("a")).isPresent();
        assertThat(router.edgeFor("b")).isEmpty();
    }

    @Test
    @DisplayName("fails for a node without outgoing edge")
    void shouldFailWithoutEdge() {
        EdgeRouter router = new EdgeRouter(List.of(Edge.always("a", "b")));

        assertThatThrownBy(() -> router.route(stateAt("b", Map.of())))
                .isInstanceOf(MalformedEdgeException.class)
                .hasMessageContaining("'b'");
    }

    private static StateView stateAt(String node, Map<String, Object> result) {
        SessionState state = SessionState.start(Session.create("s", "cmd"), node);
        state.merge(result);
        return state.snapshot();
    }
}
