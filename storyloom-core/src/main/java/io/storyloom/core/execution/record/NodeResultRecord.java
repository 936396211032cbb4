package io.storyloom.core.execution.record;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Persisted row for one node execution, one per (node, iteration).
///
/// @param id row identifier, not null
/// @param executionId owning execution, not null
/// @param nodeId node identifier, not null
/// @param iteration 1-based execution count of the node within the run
/// @param input previous output the node started with, never null
/// @param output node output, empty until completed
/// @param resolvedConfig config after substitution, never null
/// @param status current status, not null
/// @param error failure reason, null unless failed
/// @param startedAt start time, not null
/// @param finishedAt end time, null while running
public record NodeResultRecord(
        String id,
        String executionId,
        String nodeId,
        int iteration,
        String input,
        String output,
        Map<String, Object> resolvedConfig,
        NodeResultStatus status,
        String error,
        Instant startedAt,
        Instant finishedAt) {

    public NodeResultRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        input = input != null ? input : "";
        output = output != null ? output : "";
        resolvedConfig =
                resolvedConfig != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(resolvedConfig))
                        : Map.of();
    }

    /// Applies an update, keeping fields the update leaves null.
    ///
    /// Only the output may change once the row is finished.
    ///
    /// @throws IllegalStateException if a finished row would change anything but its output
    public NodeResultRecord apply(NodeResultUpdate update) {
        if (status.isFinished()
                && (update.status() != null
                        || update.resolvedConfig() != null
                        || update.error() != null
                        || update.finishedAt() != null)) {
            throw new IllegalStateException("Node result " + id + " is already " + status);
        }
        return new NodeResultRecord(
                id,
                executionId,
                nodeId,
                iteration,
                input,
                update.output() != null ? update.output() : output,
                update.resolvedConfig() != null ? update.resolvedConfig() : resolvedConfig,
                update.status() != null ? update.status() : status,
                update.error() != null ? update.error() : error,
                startedAt,
                update.finishedAt() != null ? update.finishedAt() : finishedAt);
    }
}
