package io.storyloom.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.execution.ExecutionStatus;
import io.storyloom.core.execution.record.NodeResultStatus;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;
import io.storyloom.serialization.mixin.WorkflowBuilderMixin;
import io.storyloom.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Storyloom serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs**:
/// - `WorkflowNode`: `WorkflowNodeSerializer` / `WorkflowNodeDeserializer`, discriminator
///   `"type"` holding the node type's wire name
/// - `NodeType`, `ExecutionStatus`, `NodeResultStatus`, `FailureCode`: written and read as
///   wire names (`ai_chat`, `timeout`, `loop_max_exceeded`, ...)
///
/// **Mixin/builder pairs**:
/// - `Workflow` + `Workflow.Builder`
///
/// Execution records, node results and variable snapshots are Java records and bind
/// through their canonical constructors without further registration.
///
/// @see WorkflowSerializer for the convenience factory API
public class StoryloomJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3319405517276930818L;

    public StoryloomJacksonModule() {
        super("StoryloomJacksonModule");

        addSerializer(WorkflowNode.class, new WorkflowNodeSerializer());
        addDeserializer(WorkflowNode.class, new WorkflowNodeDeserializer());

        addSerializer(NodeType.class, new WireNameSerializer<>(NodeType.class, NodeType::wireName));
        addDeserializer(
                NodeType.class, new WireNameDeserializer<>(NodeType.class, NodeType::fromWireName));

        addSerializer(
                ExecutionStatus.class,
                new WireNameSerializer<>(ExecutionStatus.class, ExecutionStatus::wireName));
        addDeserializer(
                ExecutionStatus.class,
                new WireNameDeserializer<>(ExecutionStatus.class, ExecutionStatus::fromWireName));

        addSerializer(
                NodeResultStatus.class,
                new WireNameSerializer<>(NodeResultStatus.class, NodeResultStatus::wireName));
        addDeserializer(
                NodeResultStatus.class,
                new WireNameDeserializer<>(
                        NodeResultStatus.class, NodeResultStatus::fromWireName));

        addSerializer(
                FailureCode.class,
                new WireNameSerializer<>(FailureCode.class, FailureCode::wireName));
        addDeserializer(
                FailureCode.class,
                new WireNameDeserializer<>(FailureCode.class, FailureCode::fromWireName));
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);
    }
}
