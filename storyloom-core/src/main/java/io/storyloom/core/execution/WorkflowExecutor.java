package io.storyloom.core.execution;

import io.storyloom.core.StoryloomConfig;
import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.StreamingInvocation;
import io.storyloom.core.block.BlockResolver;
import io.storyloom.core.block.BlockTable;
import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.execution.handler.HandlerServices;
import io.storyloom.core.execution.handler.NodeHandlerRegistry;
import io.storyloom.core.execution.parallel.ParallelItemRunner;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.setting.SettingsProvider;
import io.storyloom.core.variable.ConfigResolver;
import io.storyloom.core.variable.DefaultTemplateResolver;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Main execution engine for Storyloom workflows.
///
/// Prepares a {@link WorkflowRun} for a workflow: resolves the block structure, checks
/// that every node type has a handler, and fixes the run limits. Nothing is executed
/// and no event is emitted while preparing, so a structurally broken workflow never
/// reaches `running`.
///
/// ### Run limits
/// - loop ceiling: workflow `loop_max_count`, else the configured default, clamped to 1-50
/// - timeout: the per-run override, else workflow `timeout_seconds`, else the configured
///   default; zero or negative means no timeout
///
/// @implNote Thread-safe. The executor holds only shared, stateless collaborators; all
/// run state lives in the {@link WorkflowRun}. Concurrent runs share the worker pool and
/// nothing else.
///
/// @see NodeHandlerRegistry for node type dispatch
/// @see WorkflowRun for pause, resume, cancel and output edits
public class WorkflowExecutor {

    private static final Logger logger = Logger.getLogger(WorkflowExecutor.class.getName());

    private final NodeHandlerRegistry handlerRegistry;
    private final AiClient aiClient;
    private final SettingsProvider settingsProvider;
    private final JsonCodec jsonCodec;
    private final ExecutorService executorService;
    private final StoryloomConfig config;
    private final BlockResolver blockResolver = new BlockResolver();
    private final ConfigResolver configResolver = new ConfigResolver(new DefaultTemplateResolver());

    /// Creates a workflow executor with all dependencies.
    ///
    /// @param handlerRegistry handlers for each node type, not null
    /// @param aiClient provider boundary for `ai_chat` and AI conditions, not null
    /// @param settingsProvider default settings library, not null
    /// @param jsonCodec codec for JSON splitting, merging and `json_path` extraction, not null
    /// @param executorService worker pool for parallel item-runs, not null
    /// @param config engine defaults, not null
    public WorkflowExecutor(
            NodeHandlerRegistry handlerRegistry,
            AiClient aiClient,
            SettingsProvider settingsProvider,
            JsonCodec jsonCodec,
            ExecutorService executorService,
            StoryloomConfig config) {
        this.handlerRegistry =
                Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.aiClient = Objects.requireNonNull(aiClient, "aiClient must not be null");
        this.settingsProvider =
                Objects.requireNonNull(settingsProvider, "settingsProvider must not be null");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Prepares a run without starting it.
    ///
    /// @param workflow workflow to run, not null
    /// @param options run input, initial variables and overrides, not null
    /// @param listener receives the run's events, not null
    /// @return a run in state `idle`, never null
    /// @throws WorkflowStructureException if the node list is malformed or a node type
    ///     has no handler
    public WorkflowRun prepare(
            Workflow workflow, ExecutionOptions options, ExecutionListener listener) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        BlockTable blocks = blockResolver.resolve(workflow.getNodes());
        for (WorkflowNode node : workflow.getNodes()) {
            if (!handlerRegistry.hasHandler(node.getType())) {
                throw new WorkflowStructureException(
                        "No handler registered for node type " + node.getType().wireName(),
                        node.getId());
            }
        }

        int loopCeiling = loopCeiling(workflow);
        Duration timeout = timeout(workflow, options);

        VariableStore scope = new VariableStore(options.getVariables());
        scope.setInput(options.getInput());

        HandlerServices services =
                HandlerServices.create(
                        options.getSettingsProvider().orElse(settingsProvider), jsonCodec);
        StreamingInvocation streaming =
                new StreamingInvocation(aiClient, config.getStreamPollInterval());
        String executionId = options.getExecutionId();

        logger.info(
                "Prepared execution " + executionId + " of workflow " + workflow.getId() + ": "
                        + blocks.size() + " nodes, " + blocks.blocks().size() + " blocks, "
                        + "loop ceiling " + loopCeiling);

        return new WorkflowRun(
                executionId,
                workflow,
                options.getInput(),
                timeout,
                scope,
                control ->
                        new NodeInterpreter(
                                executionId,
                                workflow,
                                blocks,
                                handlerRegistry,
                                services,
                                configResolver,
                                streaming,
                                new ParallelItemRunner(
                                        executorService, config.getStreamPollInterval()),
                                control,
                                listener,
                                loopCeiling));
    }

    /// Runs a workflow to completion on the calling thread, without a listener.
    ///
    /// @param workflow workflow to run, not null
    /// @param input run input, may be null for none
    /// @return terminal outcome, never null
    /// @throws WorkflowStructureException if the workflow is malformed
    public ExecutionResult execute(Workflow workflow, String input) {
        return execute(workflow, ExecutionOptions.withInput(input), ExecutionListener.NOOP);
    }

    /// Runs a workflow to completion on the calling thread.
    ///
    /// Node failures, cancellation and timeouts are reported in the result.
    ///
    /// @param workflow workflow to run, not null
    /// @param options run input, initial variables and overrides, not null
    /// @param listener receives the run's events, not null
    /// @return terminal outcome, never null
    /// @throws WorkflowStructureException if the workflow is malformed
    public ExecutionResult execute(
            Workflow workflow, ExecutionOptions options, ExecutionListener listener) {
        return prepare(workflow, options, listener).execute();
    }

    private int loopCeiling(Workflow workflow) {
        int requested =
                workflow.getLoopMaxCount() != null
                        ? workflow.getLoopMaxCount()
                        : config.getDefaultLoopMaxCount();
        return ConfigLimits.clamp(
                "loop_max_count", requested, ConfigLimits.MIN_ITERATIONS, ConfigLimits.MAX_ITERATIONS);
    }

    private Duration timeout(Workflow workflow, ExecutionOptions options) {
        if (options.getTimeout().isPresent()) {
            return positiveOrNull(options.getTimeout().get());
        }
        int seconds =
                workflow.getTimeoutSeconds() != null
                        ? workflow.getTimeoutSeconds()
                        : config.getDefaultTimeoutSeconds();
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    private static Duration positiveOrNull(Duration duration) {
        return duration.isZero() || duration.isNegative() ? null : duration;
    }
}
