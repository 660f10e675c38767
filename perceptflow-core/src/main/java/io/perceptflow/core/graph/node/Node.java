package io.perceptflow.core.graph.node;

import io.perceptflow.core.state.StateView;

/// A named step function of the graph.
///
/// Nodes read the session state through a {@link StateView} and describe their effect as a
/// {@link NodeResult}: a partial update, a completion verdict, or a failure signal. Nodes
/// never write to state directly.
///
/// ### Contracts
/// - **Precondition**: `state` is a consistent, read-only view, not null
/// - **Postcondition**: returns a non-null result; expected failures are reported through
///   {@link NodeResult#failure(String)} rather than thrown
///
/// @implNote A node that throws anyway is recorded as a node execution error. Collaborators
/// a node needs are handed to it at construction time.
///
/// @see NodeRegistry for registration
@FunctionalInterface
public interface Node {

    /// Runs the node against the current state.
    ///
    /// @param state read-only view of the session, not null
    /// @return the node's result, never null
    /// @throws Exception if the node fails unexpectedly
    NodeResult execute(StateView state) throws Exception;
}
