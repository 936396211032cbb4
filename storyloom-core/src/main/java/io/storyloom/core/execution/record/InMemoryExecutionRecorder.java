package io.storyloom.core.execution.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory execution recorder (default implementation).
///
/// Thread-safe, no external dependencies. Node results of one execution are returned in
/// creation order.
public final class InMemoryExecutionRecorder implements ExecutionRecorder {

    private final Map<String, ExecutionRecord> executions = new ConcurrentHashMap<>();
    private final Map<String, NodeResultRecord> nodeResults = new ConcurrentHashMap<>();
    private final Map<String, List<String>> nodeResultIdsByExecution = new ConcurrentHashMap<>();

    @Override
    public void createExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        executions.put(record.id(), record);
    }

    @Override
    public void updateExecution(String executionId, ExecutionUpdate update) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(update, "update must not be null");
        if (executions.computeIfPresent(executionId, (id, current) -> current.apply(update))
                == null) {
            throw new NoSuchElementException("Execution not found: " + executionId);
        }
    }

    @Override
    public void createNodeResult(NodeResultRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        nodeResults.put(record.id(), record);
        List<String> ids =
                nodeResultIdsByExecution.computeIfAbsent(
                        record.executionId(), id -> new ArrayList<>());
        synchronized (ids) {
            ids.add(record.id());
        }
    }

    @Override
    public void updateNodeResult(String nodeResultId, NodeResultUpdate update) {
        Objects.requireNonNull(nodeResultId, "nodeResultId must not be null");
        Objects.requireNonNull(update, "update must not be null");
        if (nodeResults.computeIfPresent(nodeResultId, (id, current) -> current.apply(update))
                == null) {
            throw new NoSuchElementException("Node result not found: " + nodeResultId);
        }
    }

    public Optional<ExecutionRecord> findExecution(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    public Optional<NodeResultRecord> findNodeResult(String nodeResultId) {
        return Optional.ofNullable(nodeResults.get(nodeResultId));
    }

    /// Returns the node results of an execution in creation order.
    ///
    /// @param executionId execution to look up, not null
    /// @return rows, never null (may be empty)
    public List<NodeResultRecord> findNodeResults(String executionId) {
        List<String> ids = nodeResultIdsByExecution.get(executionId);
        if (ids == null) {
            return List.of();
        }
        synchronized (ids) {
            return ids.stream().map(nodeResults::get).toList();
        }
    }

    /// Clears all data (useful for testing).
    public void clear() {
        executions.clear();
        nodeResults.clear();
        nodeResultIdsByExecution.clear();
    }
}
