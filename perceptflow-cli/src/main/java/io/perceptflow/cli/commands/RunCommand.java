package io.perceptflow.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.perceptflow.cli.execution.VerboseStepListener;
import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.execution.CancellationToken;
import io.perceptflow.core.execution.ExecutionListener;
import io.perceptflow.core.execution.GraphExecutor;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.execution.stream.StepEvent;
import io.perceptflow.core.execution.stream.StepStream;
import io.perceptflow.core.graph.FatalConfigurationException;
import io.perceptflow.core.state.Session;
import io.perceptflow.serialization.CheckpointSerializer;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command that runs a natural-language command through the vision agent graph.
///
/// ### Usage
/// ```bash
/// perceptflow run [--session-id <id>] [--checkpoint-dir <dir>] [--step-budget <n>]
///                 [--stream] [--no-color] [--config <file>] <command...>
/// ```
///
/// With `--stream` every step is printed as one JSON line while the session runs; otherwise
/// steps are printed as styled lines. Exits with 0 on success and 1 on any failure.
@Command(name = "run", description = "Run a command through the agent graph")
class RunCommand extends SessionCommand {

    private static final Logger logger = Logger.getLogger(RunCommand.class.getName());

    @Parameters(arity = "1..*", description = "Command text, e.g. \"click Submit\"")
    private List<String> command;

    @Option(
            names = {"--session-id"},
            description = "Session identifier (default: random UUID)")
    private String sessionId;

    @Option(
            names = {"--step-budget"},
            description = "Maximum node invocations for this session")
    private Integer stepBudget;

    @Option(
            names = {"--stream"},
            description = "Print step events as JSON lines")
    private boolean stream;

    @Override
    protected int execute() {
        String text = String.join(" ", command);
        Session session =
                sessionId != null ? Session.create(sessionId, text) : Session.create(text);

        EngineConfig config = engineConfig();
        if (stepBudget != null) {
            config = config.toBuilder().stepBudget(stepBudget).build();
        }

        try (GraphExecutor executor = createExecutor(config)) {
            ExecutionResult result =
                    stream
                            ? runStreaming(executor, session)
                            : executor.run(
                                    session,
                                    new VerboseStepListener(System.out, color),
                                    new CancellationToken());
            return printResult(result);
        } catch (IllegalStateException
                | IllegalArgumentException
                | FatalConfigurationException e) {
            System.err.printf("%s %s%n", styles().failureMarker(), e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private ExecutionResult runStreaming(GraphExecutor executor, Session session) {
        ObjectWriter writer =
                CheckpointSerializer.createMapper().writer()
                        .without(SerializationFeature.INDENT_OUTPUT);
        try (StepStream steps = executor.runStream(session, ExecutionListener.NOOP)) {
            while (steps.hasNext()) {
                StepEvent event = steps.next();
                try {
                    System.out.println(writer.writeValueAsString(event));
                } catch (JsonProcessingException e) {
                    logger.log(Level.WARNING, "Cannot print step " + event.stepIndex(), e);
                }
            }
            return steps.result().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while streaming " + session.sessionId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }
}
