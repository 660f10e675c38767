package io.perceptflow.core.agent.node;

import java.util.List;
import java.util.Locale;

/// How the error handler recovers from a failed step.
public enum RecoveryStrategy {
    /// Run the same action again without looking at the screen.
    RETRY_CURRENT_STEP(List.of("click", "type", "scroll", "drag", "press", "key")),
    /// Capture and analyze the screen again before the next action.
    REANALYZE_SCREEN(List.of("screen", "element", "target", "coordinate", "screenshot", "bounds"));

    private final List<String> keywords;

    RecoveryStrategy(List<String> keywords) {
        this.keywords = keywords;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Chooses a strategy from a failure description.
    ///
    /// Screen-related keywords take precedence over action keywords. Unknown or missing
    /// descriptions re-analyze the screen.
    ///
    /// @param errorDetail the failure description, may be null
    /// @return the strategy, never null
    public static RecoveryStrategy forFailure(String errorDetail) {
        if (errorDetail == null) {
            return REANALYZE_SCREEN;
        }
        String detail = errorDetail.toLowerCase(Locale.ROOT);
        if (REANALYZE_SCREEN.mentionedIn(detail)) {
            return REANALYZE_SCREEN;
        }
        if (RETRY_CURRENT_STEP.mentionedIn(detail)) {
            return RETRY_CURRENT_STEP;
        }
        return REANALYZE_SCREEN;
    }

    private boolean mentionedIn(String detail) {
        return keywords.stream().anyMatch(detail::contains);
    }
}
