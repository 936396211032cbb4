package io.storyloom.core.execution;

import java.util.Optional;

/// In-memory state machine of one run.
///
/// ```
/// IDLE -> RUNNING <-> PAUSED -> COMPLETED | FAILED | CANCELLED | TIMED_OUT
/// ```
public enum ExecutorState {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMED_OUT;
    }

    /// Maps to the persisted status.
    ///
    /// @return status, or empty for {@link #IDLE} which is never persisted
    public Optional<ExecutionStatus> toStatus() {
        return switch (this) {
            case IDLE -> Optional.empty();
            case RUNNING -> Optional.of(ExecutionStatus.RUNNING);
            case PAUSED -> Optional.of(ExecutionStatus.PAUSED);
            case COMPLETED -> Optional.of(ExecutionStatus.COMPLETED);
            case FAILED -> Optional.of(ExecutionStatus.FAILED);
            case CANCELLED -> Optional.of(ExecutionStatus.CANCELLED);
            case TIMED_OUT -> Optional.of(ExecutionStatus.TIMEOUT);
        };
    }
}
