package io.storyloom.core.execution.event;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.execution.ExecutionStatus;
import io.storyloom.core.variable.VariableSnapshot;
import io.storyloom.core.workflow.NodeType;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Structured event on a run's event stream.
///
/// Node events carry the node fields; execution events carry status, snapshot and final
/// output. Fields that do not apply to an event kind are null.
///
/// @param type event kind, not null
/// @param executionId run identifier, not null
/// @param workflowId workflow identifier, not null
/// @param timestamp emission time, not null
/// @param nodeId node identifier, null for execution events
/// @param nodeName node display name, null for execution events
/// @param nodeType node type, null for execution events
/// @param iteration 1-based node execution count, 0 when not applicable
/// @param input node input, or the run input on `execution_started`
/// @param content output for `node_completed`, the accumulated text for
///     `node_streaming`, the edited output for `node_output_edited`
/// @param delta newest chunk for `node_streaming`
/// @param resolvedConfig config after variable substitution, never null
/// @param status status entered by execution events
/// @param code failure code for failed and aborted events
/// @param error failure reason for failed and aborted events
/// @param snapshot variable store at pause or end
/// @param finalOutput final output on `execution_completed`
public record ExecutionEvent(
        ExecutionEventType type,
        String executionId,
        String workflowId,
        Instant timestamp,
        String nodeId,
        String nodeName,
        NodeType nodeType,
        int iteration,
        String input,
        String content,
        String delta,
        Map<String, Object> resolvedConfig,
        ExecutionStatus status,
        FailureCode code,
        String error,
        VariableSnapshot snapshot,
        String finalOutput) {

    public ExecutionEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        resolvedConfig = resolvedConfig != null ? resolvedConfig : Map.of();
    }

    public static Builder builder(ExecutionEventType type, String executionId, String workflowId) {
        return new Builder(type, executionId, workflowId);
    }

    public static final class Builder {
        private final ExecutionEventType type;
        private final String executionId;
        private final String workflowId;
        private Instant timestamp = Instant.now();
        private String nodeId;
        private String nodeName;
        private NodeType nodeType;
        private int iteration;
        private String input;
        private String content;
        private String delta;
        private Map<String, Object> resolvedConfig;
        private ExecutionStatus status;
        private FailureCode code;
        private String error;
        private VariableSnapshot snapshot;
        private String finalOutput;

        private Builder(ExecutionEventType type, String executionId, String workflowId) {
            this.type = type;
            this.executionId = executionId;
            this.workflowId = workflowId;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder node(String nodeId, String nodeName, NodeType nodeType) {
            this.nodeId = nodeId;
            this.nodeName = nodeName;
            this.nodeType = nodeType;
            return this;
        }

        public Builder iteration(int iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder delta(String delta) {
            this.delta = delta;
            return this;
        }

        public Builder resolvedConfig(Map<String, Object> resolvedConfig) {
            this.resolvedConfig = resolvedConfig;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder failure(FailureCode code, String error) {
            this.code = code;
            this.error = error;
            return this;
        }

        public Builder snapshot(VariableSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public Builder finalOutput(String finalOutput) {
            this.finalOutput = finalOutput;
            return this;
        }

        public ExecutionEvent build() {
            return new ExecutionEvent(
                    type,
                    executionId,
                    workflowId,
                    timestamp,
                    nodeId,
                    nodeName,
                    nodeType,
                    iteration,
                    input,
                    content,
                    delta,
                    resolvedConfig,
                    status,
                    code,
                    error,
                    snapshot,
                    finalOutput);
        }
    }
}
