package io.storyloom.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.storyloom.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder.
///
/// Applied to `Workflow.class` via `StoryloomJacksonModule.setupModule()`. Jackson uses
/// `Workflow.Builder` when deserializing, so the immutable workflow needs neither a no-arg
/// constructor nor field access.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered.
///
/// @see WorkflowBuilderMixin
/// @see io.storyloom.serialization.StoryloomJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
public abstract class WorkflowMixin {}
