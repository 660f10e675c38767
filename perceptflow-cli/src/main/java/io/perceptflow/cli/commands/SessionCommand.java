package io.perceptflow.cli.commands;

import io.perceptflow.cli.ui.AnsiStyles;
import io.perceptflow.cli.ui.AnsiStyles.Tone;
import io.perceptflow.core.agent.VisionAgentGraph;
import io.perceptflow.core.agent.stub.StubActionService;
import io.perceptflow.core.agent.stub.StubScreenCaptureService;
import io.perceptflow.core.agent.stub.StubVisionService;
import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.config.PropertiesSettingsProvider;
import io.perceptflow.core.config.SettingsProvider;
import io.perceptflow.core.execution.GraphExecutor;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.StepStatus;
import io.perceptflow.core.storage.checkpoint.CheckpointStore;
import io.perceptflow.core.storage.checkpoint.InMemoryCheckpointStore;
import io.perceptflow.serialization.JsonFileCheckpointStore;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/// Base class for commands that execute or inspect sessions of the vision agent graph.
///
/// ### Checkpoint Store Resolution
/// - `--checkpoint-dir` given: {@link JsonFileCheckpointStore} rooted there
/// - otherwise: {@link InMemoryCheckpointStore}, lost when the command exits
///
/// ### Configuration Resolution
/// - `--config` given: properties file read through {@link PropertiesSettingsProvider}
/// - otherwise: `perceptflow.properties` from the classpath, or engine defaults
///
/// @implNote The graph runs over the deterministic stub collaborators.
abstract class SessionCommand extends PerceptflowCommand {

    static final String CLASSPATH_SETTINGS = "perceptflow.properties";

    @Option(
            names = {"--checkpoint-dir"},
            description = "Directory of the JSON checkpoint store")
    protected Path checkpointDir;

    @Option(
            names = {"--config"},
            description = "Properties file with perceptflow.* engine settings")
    protected Path configFile;

    protected CheckpointStore checkpointStore() {
        return checkpointDir != null
                ? new JsonFileCheckpointStore(checkpointDir)
                : new InMemoryCheckpointStore();
    }

    protected EngineConfig engineConfig() {
        SettingsProvider settings =
                configFile != null
                        ? PropertiesSettingsProvider.fromFile(configFile)
                        : PropertiesSettingsProvider.fromClasspath(CLASSPATH_SETTINGS);
        return settings.load();
    }

    protected static Graph agentGraph() {
        return VisionAgentGraph.create(
                new StubVisionService(), new StubScreenCaptureService(), new StubActionService());
    }

    protected GraphExecutor createExecutor(EngineConfig config) {
        return new GraphExecutor(agentGraph(), config, checkpointStore(), null);
    }

    /// Prints the terminal outcome and maps it to an exit code.
    ///
    /// @param result terminal result, not null
    /// @return {@link #EXIT_OK} on success, {@link #EXIT_FAILURE} otherwise
    protected int printResult(ExecutionResult result) {
        AnsiStyles styles = styles();
        Outcome outcome = result.outcome();
        String detail = outcome.detail() != null ? outcome.detail() : "";
        if (result.isSuccess()) {
            System.out.printf(
                    "%n%s %s%n",
                    styles.marker(StepStatus.SUCCEEDED),
                    styles.paint(Tone.HEADING, "Session completed"));
        } else {
            System.out.printf(
                    "%n%s %s %s%n",
                    styles.failureMarker(),
                    styles.paint(Tone.HEADING, "Session failed:"),
                    styles.paint(Tone.FAILURE, String.valueOf(result.errorKind())));
        }
        System.out.printf(
                "  Session: %s  Steps: %d  %s%n",
                result.sessionId(),
                result.finalState().stepCount(),
                styles.paint(Tone.DETAIL, detail));
        return result.isSuccess() ? EXIT_OK : EXIT_FAILURE;
    }
}
