package io.storyloom.core.execution.record;

import java.time.Instant;
import java.util.Map;

/// Change to a {@link NodeResultRecord}. Null fields leave the stored value unchanged.
///
/// @param output node output, null to keep
/// @param resolvedConfig config after substitution, null to keep
/// @param status new status, null to keep
/// @param error failure reason, null to keep
/// @param finishedAt end time, null to keep
public record NodeResultUpdate(
        String output,
        Map<String, Object> resolvedConfig,
        NodeResultStatus status,
        String error,
        Instant finishedAt) {

    /// Update that replaces only the output, used for edits during a pause.
    public static NodeResultUpdate editedOutput(String output) {
        return new NodeResultUpdate(output, null, null, null, null);
    }
}
