package io.storyloom.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when workflow or node settings are outside their permitted ranges.
///
/// Carries every violation found, not just the first.
public class WorkflowConfigurationException extends RuntimeException {
    @Serial private static final long serialVersionUID = -3371908815260047712L;

    private final List<String> violations;

    public WorkflowConfigurationException(List<String> violations) {
        super("Invalid workflow configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
