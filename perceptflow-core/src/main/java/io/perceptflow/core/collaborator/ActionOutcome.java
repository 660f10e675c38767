package io.perceptflow.core.collaborator;

/// Result reported by the action service.
///
/// @param success whether the action was delivered
/// @param sideEffect observed side effect or diagnostic, may be null
public record ActionOutcome(boolean success, String sideEffect) {

    public static ActionOutcome succeeded(String sideEffect) {
        return new ActionOutcome(true, sideEffect);
    }

    public static ActionOutcome failed(String sideEffect) {
        return new ActionOutcome(false, sideEffect);
    }
}
