package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyloom.core.execution.record.ExecutionRecord;
import io.storyloom.core.execution.record.NodeResultRecord;
import io.storyloom.core.variable.VariableSnapshot;
import java.util.List;

/// JSON export and import of execution rows, node results and variable snapshots.
///
/// Uses the same mapper configuration as {@link WorkflowSerializer}: snake_case keys,
/// wire-name statuses and ISO-8601 timestamps. A snapshot written at pause and read back
/// resolves templates exactly as the live store did.
///
/// ### Usage
/// {@snippet :
/// String json = ExecutionRecordSerializer.snapshotToJson(run.snapshot());
/// VariableStore restored = VariableStore.fromSnapshot(
///         ExecutionRecordSerializer.snapshotFromJson(json));
/// }
public final class ExecutionRecordSerializer {

    private static final ObjectMapper MAPPER = WorkflowSerializer.createMapper();
    private static final TypeReference<List<NodeResultRecord>> NODE_RESULT_LIST =
            new TypeReference<>() {};

    private ExecutionRecordSerializer() {}

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionRecord record) {
        return write(record, "execution record");
    }

    /// @throws IllegalArgumentException if the JSON is malformed
    public static ExecutionRecord executionFromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutionRecord.class);
        } catch (JsonProcessingException e) {
            throw WorkflowSerializer.unwrap(e, "Failed to deserialize execution record: ");
        }
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String nodeResultsToJson(List<NodeResultRecord> results) {
        return write(results, "node results");
    }

    /// @throws IllegalArgumentException if the JSON is malformed
    public static List<NodeResultRecord> nodeResultsFromJson(String json) {
        try {
            return MAPPER.readValue(json, NODE_RESULT_LIST);
        } catch (JsonProcessingException e) {
            throw WorkflowSerializer.unwrap(e, "Failed to deserialize node results: ");
        }
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String snapshotToJson(VariableSnapshot snapshot) {
        return write(snapshot, "variable snapshot");
    }

    /// @throws IllegalArgumentException if the JSON is malformed
    public static VariableSnapshot snapshotFromJson(String json) {
        try {
            return MAPPER.readValue(json, VariableSnapshot.class);
        } catch (JsonProcessingException e) {
            throw WorkflowSerializer.unwrap(e, "Failed to deserialize variable snapshot: ");
        }
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
