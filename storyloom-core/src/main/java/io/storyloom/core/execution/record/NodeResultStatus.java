package io.storyloom.core.execution.record;

import java.util.Arrays;
import java.util.Optional;

/// Persisted status of one node execution.
///
/// Skipped nodes are never persisted; they only appear in the in-memory trace.
public enum NodeResultStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    NodeResultStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public static Optional<NodeResultStatus> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(s -> s.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
