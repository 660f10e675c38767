package io.perceptflow.core.collaborator;

/// Delivers input actions to the operating system.
public interface ActionService {

    /// Performs an action.
    ///
    /// @param action the action to perform, not null
    /// @return success flag and observed side effect, never null
    /// @throws CollaboratorException for out-of-bounds targets, permission or execution errors
    ActionOutcome execute(ActionDescriptor action) throws CollaboratorException;
}
