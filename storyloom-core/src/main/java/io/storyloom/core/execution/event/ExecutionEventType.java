package io.storyloom.core.execution.event;

/// Event kinds emitted during a run, named as they appear on the event stream.
public enum ExecutionEventType {
    EXECUTION_STARTED("execution_started"),
    EXECUTION_PAUSED("execution_paused"),
    EXECUTION_RESUMED("execution_resumed"),
    EXECUTION_COMPLETED("execution_completed"),
    EXECUTION_FAILED("execution_failed"),
    EXECUTION_CANCELLED("execution_cancelled"),
    EXECUTION_TIMEOUT("execution_timeout"),
    NODE_STARTED("node_started"),
    NODE_STREAMING("node_streaming"),
    NODE_COMPLETED("node_completed"),
    NODE_FAILED("node_failed"),
    NODE_SKIPPED("node_skipped"),
    NODE_OUTPUT_EDITED("node_output_edited");

    private final String wireName;

    ExecutionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isNodeEvent() {
        return name().startsWith("NODE_");
    }

    /// Returns true for the events that end a run.
    public boolean isTerminal() {
        return this == EXECUTION_COMPLETED
                || this == EXECUTION_FAILED
                || this == EXECUTION_CANCELLED
                || this == EXECUTION_TIMEOUT;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
