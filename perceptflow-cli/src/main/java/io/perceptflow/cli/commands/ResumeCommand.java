package io.perceptflow.cli.commands;

import io.perceptflow.cli.execution.VerboseStepListener;
import io.perceptflow.core.execution.CancellationToken;
import io.perceptflow.core.execution.GraphExecutor;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.graph.FatalConfigurationException;
import io.perceptflow.core.storage.checkpoint.SessionNotFoundException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// CLI command that continues a session from its latest checkpoint.
///
/// A session that already ended is reported as-is; no node runs.
@Command(name = "resume", description = "Resume a session from its latest checkpoint")
class ResumeCommand extends SessionCommand {

    @Parameters(index = "0", description = "Session identifier")
    private String sessionId;

    @Override
    protected int execute() {
        if (checkpointDir == null) {
            System.err.println("resume requires --checkpoint-dir");
            return EXIT_FAILURE;
        }
        try (GraphExecutor executor = createExecutor(engineConfig())) {
            ExecutionResult result =
                    executor.resume(
                            sessionId,
                            new VerboseStepListener(System.out, color),
                            new CancellationToken());
            return printResult(result);
        } catch (SessionNotFoundException
                | IllegalArgumentException
                | FatalConfigurationException e) {
            System.err.printf("%s %s%n", styles().failureMarker(), e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
