package io.perceptflow.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.perceptflow.cli.ui.AnsiStyles.Tone;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.StepStatus;
import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldReturnPlainTextWithoutColor() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.isColorEnabled()).isFalse();
        assertThat(styles.paint(Tone.HEADING, "text")).isEqualTo("text");
        assertThat(styles.arrow()).isEqualTo("->");
    }

    @Test
    void shouldWrapTextInEscapeCodesWithColor() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.paint(Tone.SUCCESS, "ok")).isEqualTo("\033[0;32mok\033[0m");
    }

    @Test
    void shouldMapStepStatusesToMarkersAndTones() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.marker(StepStatus.SUCCEEDED)).isEqualTo("✓");
        assertThat(styles.marker(StepStatus.RETRIED)).isEqualTo("↻");
        assertThat(styles.marker(StepStatus.FAILED)).isEqualTo("✗");
        assertThat(styles.failureMarker()).isEqualTo("✗");
        assertThat(AnsiStyles.toneOf(StepStatus.SUCCEEDED)).isEqualTo(Tone.SUCCESS);
        assertThat(AnsiStyles.toneOf(StepStatus.RETRIED)).isEqualTo(Tone.RETRY);
        assertThat(AnsiStyles.toneOf(StepStatus.FAILED)).isEqualTo(Tone.FAILURE);
    }

    @Test
    void shouldPaintMarkerWithTheToneOfItsStatus() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.marker(StepStatus.RETRIED))
                .isEqualTo(styles.paint(Tone.RETRY, "↻"));
    }

    @Test
    void shouldDescribeOutcomes() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.outcome(null)).isEqualTo("(session has not ended)");
        assertThat(styles.outcome(Outcome.success("done"))).isEqualTo("outcome: success");
        assertThat(styles.outcome(Outcome.failure(ErrorKind.STEP_BUDGET_EXCEEDED, "budget")))
                .isEqualTo("outcome: STEP_BUDGET_EXCEEDED");
    }
}
