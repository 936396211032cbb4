package io.storyloom.core.exception;

import java.io.Serial;

/// Thrown before a run starts when the flat node list cannot be turned into a valid
/// block structure: broken pairing, missing block IDs, unknown jump targets.
public class WorkflowStructureException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6248173527430119825L;

    private final String nodeId;

    public WorkflowStructureException(String message) {
        this(message, null);
    }

    public WorkflowStructureException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /// Returns the offending node.
    ///
    /// @return node ID, or null when the problem is not tied to one node
    public String getNodeId() {
        return nodeId;
    }
}
