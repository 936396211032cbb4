package io.storyloom.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;

/// Jackson mixin for `Workflow.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names. The
/// single-node `node(...)` method is hidden so only the `nodes` array is read.
///
/// @see WorkflowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {

    @JsonIgnore
    abstract Workflow.Builder node(WorkflowNode node);
}
