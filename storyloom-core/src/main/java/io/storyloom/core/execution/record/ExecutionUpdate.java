package io.storyloom.core.execution.record;

import io.storyloom.core.execution.ExecutionFailure;
import io.storyloom.core.execution.ExecutionStatus;
import io.storyloom.core.variable.VariableSnapshot;
import java.time.Instant;
import java.util.Objects;

/// Change to an {@link ExecutionRecord}. Null fields leave the stored value unchanged.
///
/// @param status new status, not null
/// @param finalOutput final output, null to keep
/// @param variablesSnapshot variable store snapshot, null to keep
/// @param failure failure details, null to keep
/// @param finishedAt end time, null to keep
public record ExecutionUpdate(
        ExecutionStatus status,
        String finalOutput,
        VariableSnapshot variablesSnapshot,
        ExecutionFailure failure,
        Instant finishedAt) {

    public ExecutionUpdate {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ExecutionUpdate status(ExecutionStatus status) {
        return new ExecutionUpdate(status, null, null, null, null);
    }
}
