package io.storyloom.core.execution.handler;

import io.storyloom.core.ai.AiInvoker;
import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.block.BlockTable;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.variable.ConfigResolver;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.Objects;
import java.util.function.BiConsumer;

/// Everything a node handler may need for one node execution.
///
/// Bundles per-node state (resolved config, iteration, variable scope) with the run's
/// services, so that each handler pulls only what it uses.
///
/// ### Required Fields
/// - `executionId`, `workflow`, `node`, `config`
/// - `blocks` - block table resolved before the run
/// - `scope` - variable store of the current run or item-run
/// - `blockState` - loop frames and branch outcomes of the current interpreter
/// - `services` - condition evaluator, settings injector, JSON codec
///
/// ### Optional Services
/// - `aiInvoker` - bound to the run's cancellation and timeout checks
/// - `streamSink` - receives `(accumulated, delta)` for `node_streaming` events
/// - `itemRunner` - runs nodes per item for batches
///
/// @implNote Immutable after construction. A new context is built for every node
/// execution.
public final class HandlerContext {

    private static final AiInvoker NO_AI =
            (request, onChunk) -> {
                throw new IllegalStateException("No AI invoker configured");
            };
    private static final BiConsumer<String, String> NO_STREAM = (accumulated, delta) -> {};

    private final String executionId;
    private final Workflow workflow;
    private final WorkflowNode node;
    private final int index;
    private final int iteration;
    private final NodeConfig config;
    private final BlockTable blocks;
    private final VariableStore scope;
    private final BlockState blockState;
    private final HandlerServices services;
    private final ConfigResolver configResolver;
    private final AiInvoker aiInvoker;
    private final BiConsumer<String, String> streamSink;
    private final ItemRunner itemRunner;
    private final int loopCeiling;

    private HandlerContext(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "executionId is required");
        this.workflow = Objects.requireNonNull(builder.workflow, "workflow is required");
        this.node = Objects.requireNonNull(builder.node, "node is required");
        this.index = builder.index;
        this.iteration = builder.iteration;
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.blocks = Objects.requireNonNull(builder.blocks, "blocks is required");
        this.scope = Objects.requireNonNull(builder.scope, "scope is required");
        this.blockState = Objects.requireNonNull(builder.blockState, "blockState is required");
        this.services = Objects.requireNonNull(builder.services, "services is required");
        this.configResolver =
                Objects.requireNonNull(builder.configResolver, "configResolver is required");
        this.aiInvoker = builder.aiInvoker != null ? builder.aiInvoker : NO_AI;
        this.streamSink = builder.streamSink != null ? builder.streamSink : NO_STREAM;
        this.itemRunner = builder.itemRunner;
        this.loopCeiling = builder.loopCeiling;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExecutionId() {
        return executionId;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public WorkflowNode getNode() {
        return node;
    }

    /// Position of the node in the block table.
    public int getIndex() {
        return index;
    }

    /// 1-based count of executions of this node in the run, including this one.
    public int getIteration() {
        return iteration;
    }

    /// Node config after variable substitution.
    public NodeConfig getConfig() {
        return config;
    }

    public BlockTable getBlocks() {
        return blocks;
    }

    public VariableStore getScope() {
        return scope;
    }

    public BlockState getBlockState() {
        return blockState;
    }

    public HandlerServices getServices() {
        return services;
    }

    public AiInvoker getAiInvoker() {
        return aiInvoker;
    }

    /// Reports streaming progress of the current node.
    ///
    /// @param accumulated all text received so far
    /// @param delta newest chunk
    public void streamed(String accumulated, String delta) {
        streamSink.accept(accumulated, delta);
    }

    /// Returns the runner for batch item-runs.
    ///
    /// @throws IllegalStateException if this context cannot start item-runs
    public ItemRunner getItemRunner() {
        if (itemRunner == null) {
            throw new IllegalStateException("Item-runs are not available in this context");
        }
        return itemRunner;
    }

    /// Global loop iteration ceiling of the run.
    public int getLoopCeiling() {
        return loopCeiling;
    }

    /// Resolves another node's config against the current scope. Used by closing
    /// markers that read their opening marker's settings.
    ///
    /// @param other node whose config to resolve, not null
    /// @return resolved config, never null
    public NodeConfig resolvedConfigOf(WorkflowNode other) {
        return NodeConfig.of(configResolver.resolve(other.getConfig(), scope));
    }

    /// Returns the block a marker node belongs to.
    ///
    /// @throws NodeExecutionException if the marker is not part of a resolved block
    public BlockInfo requireBlock(WorkflowNode marker) throws NodeExecutionException {
        return blocks.block(marker.getBlockId())
                .orElseThrow(
                        () ->
                                new NodeExecutionException(
                                        FailureCode.NODE_ERROR,
                                        "Node '" + marker.getId() + "' is not part of a block"));
    }

    public static final class Builder {
        private String executionId;
        private Workflow workflow;
        private WorkflowNode node;
        private int index;
        private int iteration = 1;
        private NodeConfig config;
        private BlockTable blocks;
        private VariableStore scope;
        private BlockState blockState;
        private HandlerServices services;
        private ConfigResolver configResolver;
        private AiInvoker aiInvoker;
        private BiConsumer<String, String> streamSink;
        private ItemRunner itemRunner;
        private int loopCeiling = 10;

        private Builder() {}

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflow(Workflow workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder node(WorkflowNode node) {
            this.node = node;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder iteration(int iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder config(NodeConfig config) {
            this.config = config;
            return this;
        }

        public Builder blocks(BlockTable blocks) {
            this.blocks = blocks;
            return this;
        }

        public Builder scope(VariableStore scope) {
            this.scope = scope;
            return this;
        }

        public Builder blockState(BlockState blockState) {
            this.blockState = blockState;
            return this;
        }

        public Builder services(HandlerServices services) {
            this.services = services;
            return this;
        }

        public Builder configResolver(ConfigResolver configResolver) {
            this.configResolver = configResolver;
            return this;
        }

        public Builder aiInvoker(AiInvoker aiInvoker) {
            this.aiInvoker = aiInvoker;
            return this;
        }

        public Builder streamSink(BiConsumer<String, String> streamSink) {
            this.streamSink = streamSink;
            return this;
        }

        public Builder itemRunner(ItemRunner itemRunner) {
            this.itemRunner = itemRunner;
            return this;
        }

        public Builder loopCeiling(int loopCeiling) {
            this.loopCeiling = loopCeiling;
            return this;
        }

        public HandlerContext build() {
            return new HandlerContext(this);
        }
    }
}
