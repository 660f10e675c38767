package io.perceptflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.execution.stream.StepEvent;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import io.perceptflow.serialization.mixin.CheckpointMixin;
import io.perceptflow.serialization.mixin.ExecutionStepMixin;
import io.perceptflow.serialization.mixin.OutcomeMixin;
import io.perceptflow.serialization.mixin.SessionSnapshotMixin;
import io.perceptflow.serialization.mixin.StepEventMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all perceptflow serialization configuration.
///
/// Two registration strategies:
///
/// **Custom serializer/deserializer pair** for the sealed result hierarchy, with a `"type"`
/// discriminator:
/// - `ExecutionResult`: `ExecutionResultSerializer` / `ExecutionResultDeserializer`
///
/// **Mixins** on the state records, which Jackson binds through their canonical
/// constructors. The mixins only fix property order and null handling:
/// - `SessionSnapshot`, `ExecutionStep`, `Outcome`, `Checkpoint`, `StepEvent`
///
/// @implNote All registrations are explicit; nothing is discovered by classpath scanning.
/// @see CheckpointSerializer for the convenience factory API
public class PerceptflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3170946641271058913L;

    public PerceptflowJacksonModule() {
        super("PerceptflowJacksonModule");

        addSerializer(ExecutionResult.class, new ExecutionResultSerializer());
        addDeserializer(ExecutionResult.class, new ExecutionResultDeserializer());
    }

    /// Applies mixin annotations to the state records.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(SessionSnapshot.class, SessionSnapshotMixin.class);
        context.setMixInAnnotations(ExecutionStep.class, ExecutionStepMixin.class);
        context.setMixInAnnotations(Outcome.class, OutcomeMixin.class);
        context.setMixInAnnotations(Checkpoint.class, CheckpointMixin.class);
        context.setMixInAnnotations(StepEvent.class, StepEventMixin.class);
    }
}
