package io.storyloom.core.execution;

import io.storyloom.core.exception.FailureCode;
import java.io.Serial;

/// A node failed and the run or item-run it belongs to must stop.
public class NodeFailedException extends Exception {
    @Serial private static final long serialVersionUID = -3390127745021198756L;

    private final String nodeId;
    private final FailureCode code;
    private final String reason;

    public NodeFailedException(String nodeId, FailureCode code, String reason, Throwable cause) {
        super(nodeId + ": " + reason, cause);
        this.nodeId = nodeId;
        this.code = code;
        this.reason = reason;
    }

    public String getNodeId() {
        return nodeId;
    }

    public FailureCode getCode() {
        return code;
    }

    /// Failure reason without the node prefix.
    public String getReason() {
        return reason;
    }

    public ExecutionFailure toFailure() {
        return new ExecutionFailure(nodeId, code, reason);
    }
}
