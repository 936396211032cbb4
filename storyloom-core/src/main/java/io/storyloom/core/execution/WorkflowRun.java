package io.storyloom.core.execution;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.execution.event.ExecutionEvent;
import io.storyloom.core.execution.event.ExecutionEventType;
import io.storyloom.core.variable.VariableSnapshot;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// One prepared execution of a workflow.
///
/// Created by {@link WorkflowExecutor#prepare}. Structural validation has already
/// passed, so a run always reaches `running` once started. The run can be executed once,
/// either blocking with {@link #execute()} or on its own thread with {@link #start()};
/// pause, resume, cancel and output edits may be called from any thread.
///
/// ### Example
/// {@snippet :
/// WorkflowRun run = executor.prepare(workflow, ExecutionOptions.withInput("a dragon"), listener);
/// CompletableFuture<ExecutionResult> done = run.start();
/// run.pause();
/// run.editNodeOutput("draft", "A better draft");
/// run.resume();
/// ExecutionResult result = done.join();
/// }
public final class WorkflowRun {

    private static final Logger logger = Logger.getLogger(WorkflowRun.class.getName());

    private final String executionId;
    private final Workflow workflow;
    private final String input;
    private final Duration timeout;
    private final VariableStore scope;
    private final ExecutionControl control;
    private final NodeInterpreter interpreter;
    private final AtomicBoolean started = new AtomicBoolean();

    WorkflowRun(
            String executionId,
            Workflow workflow,
            String input,
            Duration timeout,
            VariableStore scope,
            InterpreterFactory interpreterFactory) {
        this.executionId = executionId;
        this.workflow = workflow;
        this.input = input;
        this.timeout = timeout;
        this.scope = scope;
        this.control =
                new ExecutionControl(
                        new ExecutionControl.Observer() {
                            @Override
                            public void onPaused() {
                                logger.info("Execution " + executionId + " paused");
                                emitStatus(
                                        ExecutionEventType.EXECUTION_PAUSED,
                                        ExecutionStatus.PAUSED,
                                        scope.snapshot());
                            }

                            @Override
                            public void onResumed() {
                                logger.info("Execution " + executionId + " resumed");
                                emitStatus(
                                        ExecutionEventType.EXECUTION_RESUMED,
                                        ExecutionStatus.RUNNING,
                                        null);
                            }
                        });
        this.interpreter = interpreterFactory.create(control);
    }

    /// Builds the interpreter once the run's control exists.
    @FunctionalInterface
    interface InterpreterFactory {
        NodeInterpreter create(ExecutionControl control);
    }

    public String getExecutionId() {
        return executionId;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    /// Runs the workflow on the calling thread until it reaches a terminal state.
    ///
    /// Node failures, cancellation and timeouts are reported in the result, never thrown.
    ///
    /// @return terminal outcome, never null
    /// @throws IllegalStateException if the run was already started
    public ExecutionResult execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Execution " + executionId + " already started");
        }
        Instant startedAt = Instant.now();
        control.start(timeout);
        logger.info(
                "Execution " + executionId + " of workflow " + workflow.getId() + " started"
                        + (timeout != null ? " (timeout " + timeout.toSeconds() + "s)" : ""));
        interpreter.emit(
                ExecutionEvent.builder(
                                ExecutionEventType.EXECUTION_STARTED, executionId, workflow.getId())
                        .status(ExecutionStatus.RUNNING)
                        .input(input)
                        .timestamp(startedAt)
                        .build());

        try {
            interpreter.runMain(scope);
            return finish(ExecutorState.COMPLETED, interpreter.finalOutput(scope), null, startedAt);
        } catch (NodeFailedException e) {
            return finish(ExecutorState.FAILED, null, e.toFailure(), startedAt);
        } catch (RunAbortedException e) {
            ExecutorState state =
                    e.getCode() == FailureCode.TIMEOUT
                            ? ExecutorState.TIMED_OUT
                            : ExecutorState.CANCELLED;
            return finish(
                    state,
                    null,
                    new ExecutionFailure(interpreter.currentNodeId(), e.getCode(), e.getMessage()),
                    startedAt);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Execution " + executionId + " crashed", e);
            return finish(
                    ExecutorState.FAILED,
                    null,
                    new ExecutionFailure(
                            interpreter.currentNodeId(), FailureCode.NODE_ERROR, e.toString()),
                    startedAt);
        }
    }

    /// Runs the workflow on a dedicated thread.
    ///
    /// @return future completed with the terminal outcome, never null
    /// @throws IllegalStateException if the run was already started
    public CompletableFuture<ExecutionResult> start() {
        if (started.get()) {
            throw new IllegalStateException("Execution " + executionId + " already started");
        }
        return CompletableFuture.supplyAsync(
                this::execute,
                task -> {
                    Thread thread = new Thread(task, "storyloom-run-" + executionId);
                    thread.setDaemon(true);
                    thread.start();
                });
    }

    /// Requests a pause at the next node boundary.
    ///
    /// @return false if the run is not running
    public boolean pause() {
        return control.requestPause();
    }

    /// Resumes a paused run.
    ///
    /// @return false if the run was neither paused nor about to pause
    public boolean resume() {
        return control.requestResume();
    }

    /// Cancels the run at the next node or chunk boundary. In-flight AI calls are aborted.
    ///
    /// @return false if the run had already finished
    public boolean cancel() {
        return control.requestCancel();
    }

    /// Replaces a node's recorded output while the run is paused.
    ///
    /// Later references to the node and, if it produced the latest output, the next
    /// node's previous output see the edited text.
    ///
    /// @param nodeId node whose output to replace, not null
    /// @param output new output, not null
    /// @throws IllegalStateException if the run is not paused
    /// @throws IllegalArgumentException if the node has produced no output yet
    public void editNodeOutput(String nodeId, String output) {
        if (control.getState() != ExecutorState.PAUSED) {
            throw new IllegalStateException(
                    "Node outputs can only be edited while paused, state is " + control.getState());
        }
        scope.replaceNodeOutput(nodeId, output);
        WorkflowNode node =
                workflow.getNode(nodeId)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown node " + nodeId));
        logger.info("Execution " + executionId + ": output of " + nodeId + " edited");
        interpreter.emit(
                ExecutionEvent.builder(
                                ExecutionEventType.NODE_OUTPUT_EDITED, executionId, workflow.getId())
                        .node(node.getId(), node.getName(), node.getType())
                        .content(output)
                        .build());
    }

    public ExecutorState getState() {
        return control.getState();
    }

    /// Persisted status, empty before the run starts.
    public Optional<ExecutionStatus> getStatus() {
        return control.getState().toStatus();
    }

    public VariableSnapshot snapshot() {
        return scope.snapshot();
    }

    private ExecutionResult finish(
            ExecutorState state, String finalOutput, ExecutionFailure failure, Instant startedAt) {
        control.finish(state);
        ExecutionStatus status = state.toStatus().orElseThrow();
        Instant finishedAt = Instant.now();
        VariableSnapshot snapshot = scope.snapshot();

        ExecutionEvent.Builder event =
                ExecutionEvent.builder(terminalEvent(state), executionId, workflow.getId())
                        .status(status)
                        .snapshot(snapshot)
                        .finalOutput(finalOutput)
                        .timestamp(finishedAt);
        if (failure != null) {
            event.node(failure.nodeId(), null, null).failure(failure.code(), failure.reason());
            logger.warning(
                    "Execution " + executionId + " ended " + status + " at node "
                            + failure.nodeId() + ": " + failure.reason());
        } else {
            logger.info(
                    "Execution " + executionId + " completed in "
                            + Duration.between(startedAt, finishedAt).toMillis() + " ms");
        }
        interpreter.emit(event.build());

        return new ExecutionResult(
                executionId,
                status,
                finalOutput,
                failure,
                interpreter.trace(),
                snapshot,
                startedAt,
                finishedAt);
    }

    private static ExecutionEventType terminalEvent(ExecutorState state) {
        return switch (state) {
            case COMPLETED -> ExecutionEventType.EXECUTION_COMPLETED;
            case FAILED -> ExecutionEventType.EXECUTION_FAILED;
            case CANCELLED -> ExecutionEventType.EXECUTION_CANCELLED;
            case TIMED_OUT -> ExecutionEventType.EXECUTION_TIMEOUT;
            default -> throw new IllegalArgumentException("Not terminal: " + state);
        };
    }

    private void emitStatus(
            ExecutionEventType type, ExecutionStatus status, VariableSnapshot snapshot) {
        interpreter.emit(
                ExecutionEvent.builder(type, executionId, workflow.getId())
                        .status(status)
                        .snapshot(snapshot)
                        .build());
    }
}
