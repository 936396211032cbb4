package io.storyloom.core;

import io.storyloom.core.ai.AiClient;
import io.storyloom.core.execution.ExecutionListener;
import io.storyloom.core.execution.WorkflowExecutor;
import io.storyloom.core.execution.handler.NodeHandlerRegistry;
import io.storyloom.core.execution.record.ExecutionRecorder;
import io.storyloom.core.execution.record.RecordingExecutionListener;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.setting.SettingsProvider;
import java.util.concurrent.ExecutorService;

/// Container holding all core Storyloom components required for workflow execution.
///
/// Implements {@link AutoCloseable} to release the worker pool used by parallel blocks
/// and batches.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link StoryloomFactory#createEnvironment()} or
/// {@link StoryloomFactory.Builder} rather than direct construction.
///
/// @see StoryloomFactory
public final class StoryloomEnvironment implements AutoCloseable {

    private final WorkflowExecutor workflowExecutor;
    private final NodeHandlerRegistry nodeHandlerRegistry;
    private final AiClient aiClient;
    private final SettingsProvider settingsProvider;
    private final JsonCodec jsonCodec;
    private final ExecutionRecorder executionRecorder;
    private final ExecutorService executorService;

    /// Creates a new environment with the specified components.
    ///
    /// @param workflowExecutor the executor for running workflows, not null
    /// @param nodeHandlerRegistry registry of node type handlers, not null
    /// @param aiClient provider boundary used by the executor, not null
    /// @param settingsProvider default settings library, not null
    /// @param jsonCodec JSON codec used by handlers, not null
    /// @param executionRecorder destination of execution rows, not null
    /// @param executorService worker pool for parallel item-runs, not null
    public StoryloomEnvironment(
            WorkflowExecutor workflowExecutor,
            NodeHandlerRegistry nodeHandlerRegistry,
            AiClient aiClient,
            SettingsProvider settingsProvider,
            JsonCodec jsonCodec,
            ExecutionRecorder executionRecorder,
            ExecutorService executorService) {
        this.workflowExecutor = workflowExecutor;
        this.nodeHandlerRegistry = nodeHandlerRegistry;
        this.aiClient = aiClient;
        this.settingsProvider = settingsProvider;
        this.jsonCodec = jsonCodec;
        this.executionRecorder = executionRecorder;
        this.executorService = executorService;
    }

    /// @return the workflow executor instance, never null
    public WorkflowExecutor getWorkflowExecutor() {
        return workflowExecutor;
    }

    /// @return the node handler registry, never null
    public NodeHandlerRegistry getNodeHandlerRegistry() {
        return nodeHandlerRegistry;
    }

    /// @return the AI client, never null
    public AiClient getAiClient() {
        return aiClient;
    }

    /// @return the default settings provider, never null
    public SettingsProvider getSettingsProvider() {
        return settingsProvider;
    }

    /// @return the JSON codec, never null
    public JsonCodec getJsonCodec() {
        return jsonCodec;
    }

    /// Returns the recorder that persists execution and node-result rows.
    ///
    /// Defaults to {@link io.storyloom.core.execution.record.InMemoryExecutionRecorder}
    /// when none is registered via {@link StoryloomFactory.Builder}.
    ///
    /// @return the execution recorder, never null
    public ExecutionRecorder getExecutionRecorder() {
        return executionRecorder;
    }

    /// Creates a listener that records a run through {@link #getExecutionRecorder()}.
    ///
    /// @return new recording listener, never null
    public ExecutionListener recordingListener() {
        return new RecordingExecutionListener(executionRecorder);
    }

    /// Shuts down the underlying executor service gracefully.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block. In-flight
    /// item-runs continue to execute.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
