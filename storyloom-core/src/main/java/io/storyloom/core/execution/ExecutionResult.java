package io.storyloom.core.execution;

import io.storyloom.core.variable.VariableSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/// Outcome of a finished run.
///
/// @param executionId run identifier, not null
/// @param status terminal status, not null
/// @param finalOutput output of the last `output` node, or the last output when the
///     workflow has none; null unless completed
/// @param failure failure details, null when completed
/// @param trace node executions in finishing order, never null
/// @param variables variable store at the end of the run, not null
/// @param startedAt run start, not null
/// @param finishedAt run end, not null
public record ExecutionResult(
        String executionId,
        ExecutionStatus status,
        String finalOutput,
        ExecutionFailure failure,
        List<NodeTrace> trace,
        VariableSnapshot variables,
        Instant startedAt,
        Instant finishedAt) {

    public ExecutionResult {
        trace = List.copyOf(trace);
    }

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }

    public Optional<ExecutionFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    /// Returns trace entries of one node, in execution order.
    public List<NodeTrace> traceOf(String nodeId) {
        return trace.stream().filter(t -> t.nodeId().equals(nodeId)).toList();
    }
}
