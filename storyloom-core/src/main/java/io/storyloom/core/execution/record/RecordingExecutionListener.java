package io.storyloom.core.execution.record;

import io.storyloom.core.execution.ExecutionFailure;
import io.storyloom.core.execution.ExecutionListener;
import io.storyloom.core.execution.event.ExecutionEvent;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Translates a run's event stream into {@link ExecutionRecorder} calls.
///
/// ### Mapping
/// | Event | Recorder call |
/// |-------|---------------|
/// | `execution_started` | create execution, `running` |
/// | `execution_paused` / `execution_resumed` | update status, snapshot on pause |
/// | terminal execution events | update status, final output, snapshot, failure, end time |
/// | `node_started` | create node result, `running` |
/// | `node_completed` / `node_failed` | finish the node result of that (node, iteration) |
/// | `node_output_edited` | replace the output of the node's latest result |
///
/// Streaming and skip events are not persisted. Recorder failures are logged and
/// swallowed so they never change a run's control flow.
///
/// @implNote Thread-safe. Parallel item-runs report node events from worker threads.
public class RecordingExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(RecordingExecutionListener.class.getName());

    private final ExecutionRecorder recorder;
    private final Supplier<String> idGenerator;
    private final Map<NodeKey, String> nodeResultIds = new ConcurrentHashMap<>();
    private final Map<NodeKey, String> latestByNode = new ConcurrentHashMap<>();

    private record NodeKey(String executionId, String nodeId, int iteration) {}

    public RecordingExecutionListener(ExecutionRecorder recorder) {
        this(recorder, () -> UUID.randomUUID().toString());
    }

    /// @param recorder destination of the rows, not null
    /// @param idGenerator generates node result identifiers, not null
    public RecordingExecutionListener(ExecutionRecorder recorder, Supplier<String> idGenerator) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        try {
            dispatch(event);
        } catch (RuntimeException e) {
            logger.warning(
                    "Recorder failed on " + event.type() + " of execution "
                            + event.executionId() + ": " + e);
        }
    }

    private void dispatch(ExecutionEvent event) {
        switch (event.type()) {
            case EXECUTION_STARTED ->
                    recorder.createExecution(
                            ExecutionRecord.started(
                                    event.executionId(),
                                    event.workflowId(),
                                    event.input(),
                                    event.timestamp()));
            case EXECUTION_PAUSED, EXECUTION_RESUMED ->
                    recorder.updateExecution(
                            event.executionId(),
                            new ExecutionUpdate(event.status(), null, event.snapshot(), null, null));
            case EXECUTION_COMPLETED,
                    EXECUTION_FAILED,
                    EXECUTION_CANCELLED,
                    EXECUTION_TIMEOUT -> finishExecution(event);
            case NODE_STARTED -> startNode(event);
            case NODE_COMPLETED -> finishNode(event, NodeResultStatus.COMPLETED);
            case NODE_FAILED -> finishNode(event, NodeResultStatus.FAILED);
            case NODE_OUTPUT_EDITED -> editOutput(event);
            case NODE_STREAMING, NODE_SKIPPED -> {}
        }
    }

    private void finishExecution(ExecutionEvent event) {
        ExecutionFailure failure =
                event.code() != null
                        ? new ExecutionFailure(event.nodeId(), event.code(), event.error())
                        : null;
        recorder.updateExecution(
                event.executionId(),
                new ExecutionUpdate(
                        event.status(),
                        event.finalOutput(),
                        event.snapshot(),
                        failure,
                        event.timestamp()));
        nodeResultIds.keySet().removeIf(key -> key.executionId().equals(event.executionId()));
        latestByNode.keySet().removeIf(key -> key.executionId().equals(event.executionId()));
    }

    private void startNode(ExecutionEvent event) {
        String id = idGenerator.get();
        nodeResultIds.put(nodeKey(event), id);
        recorder.createNodeResult(
                new NodeResultRecord(
                        id,
                        event.executionId(),
                        event.nodeId(),
                        event.iteration(),
                        event.input(),
                        null,
                        event.resolvedConfig(),
                        NodeResultStatus.RUNNING,
                        null,
                        event.timestamp(),
                        null));
    }

    private void finishNode(ExecutionEvent event, NodeResultStatus status) {
        NodeKey key = nodeKey(event);
        String id = nodeResultIds.remove(key);
        if (id == null) {
            logger.warning(
                    "No node result for " + event.nodeId() + " #" + event.iteration()
                            + " of execution " + event.executionId());
            return;
        }
        latestByNode.put(new NodeKey(event.executionId(), event.nodeId(), 0), id);
        recorder.updateNodeResult(
                id,
                new NodeResultUpdate(
                        event.content(),
                        event.resolvedConfig(),
                        status,
                        event.error(),
                        event.timestamp()));
    }

    private void editOutput(ExecutionEvent event) {
        String id = latestByNode.get(new NodeKey(event.executionId(), event.nodeId(), 0));
        if (id == null) {
            logger.warning(
                    "Edited node " + event.nodeId() + " has no finished result in execution "
                            + event.executionId());
            return;
        }
        recorder.updateNodeResult(id, NodeResultUpdate.editedOutput(event.content()));
    }

    private static NodeKey nodeKey(ExecutionEvent event) {
        return new NodeKey(event.executionId(), event.nodeId(), event.iteration());
    }
}
