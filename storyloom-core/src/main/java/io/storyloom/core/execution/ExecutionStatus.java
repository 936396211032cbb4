package io.storyloom.core.execution;

import java.util.Arrays;
import java.util.Optional;

/// Persisted status of an execution.
///
/// Transitions are monotonic: `running`, then any number of `paused`/`running` swaps,
/// then exactly one terminal status.
public enum ExecutionStatus {
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    TIMEOUT("timeout");

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING && this != PAUSED;
    }

    public static Optional<ExecutionStatus> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(s -> s.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
