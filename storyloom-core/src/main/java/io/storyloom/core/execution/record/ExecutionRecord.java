package io.storyloom.core.execution.record;

import io.storyloom.core.execution.ExecutionFailure;
import io.storyloom.core.execution.ExecutionStatus;
import io.storyloom.core.variable.VariableSnapshot;
import java.time.Instant;
import java.util.Objects;

/// Persisted row for one execution.
///
/// @param id execution identifier, not null
/// @param workflowId workflow identifier, not null
/// @param status current status, not null
/// @param input run input, may be null
/// @param finalOutput final output, null until completed
/// @param variablesSnapshot variable store at the last pause or at the end, may be null
/// @param failure failure details, null unless the run did not complete
/// @param startedAt start time, not null
/// @param finishedAt end time, null while the run is live
public record ExecutionRecord(
        String id,
        String workflowId,
        ExecutionStatus status,
        String input,
        String finalOutput,
        VariableSnapshot variablesSnapshot,
        ExecutionFailure failure,
        Instant startedAt,
        Instant finishedAt) {

    public ExecutionRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    /// Creates the row written when a run starts.
    public static ExecutionRecord started(
            String id, String workflowId, String input, Instant startedAt) {
        return new ExecutionRecord(
                id, workflowId, ExecutionStatus.RUNNING, input, null, null, null, startedAt, null);
    }

    /// Applies an update, keeping fields the update leaves null.
    ///
    /// @throws IllegalStateException if the record is already terminal
    public ExecutionRecord apply(ExecutionUpdate update) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + id + " is already " + status + ", cannot move to "
                            + update.status());
        }
        return new ExecutionRecord(
                id,
                workflowId,
                update.status(),
                input,
                update.finalOutput() != null ? update.finalOutput() : finalOutput,
                update.variablesSnapshot() != null ? update.variablesSnapshot() : variablesSnapshot,
                update.failure() != null ? update.failure() : failure,
                startedAt,
                update.finishedAt() != null ? update.finishedAt() : finishedAt);
    }
}
