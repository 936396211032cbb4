package io.storyloom.core.execution;

import io.storyloom.core.workflow.NodeType;
import java.time.Instant;

/// One entry of the in-memory execution trace, recorded when a node execution finishes
/// or is skipped.
///
/// @param nodeId node identifier, not null
/// @param nodeName display name, not null
/// @param nodeType node type, not null
/// @param iteration 1-based execution count of this node in the run, 0 for skipped nodes
/// @param status final state of this node execution, not null
/// @param input previous output seen by the node, may be null for skipped nodes
/// @param output produced output, null unless completed
/// @param error failure reason, null unless failed
/// @param startedAt when the node started, may be null for skipped nodes
/// @param finishedAt when the node finished or was skipped, not null
public record NodeTrace(
        String nodeId,
        String nodeName,
        NodeType nodeType,
        int iteration,
        Status status,
        String input,
        String output,
        String error,
        Instant startedAt,
        Instant finishedAt) {

    public enum Status {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        SKIPPED
    }
}
