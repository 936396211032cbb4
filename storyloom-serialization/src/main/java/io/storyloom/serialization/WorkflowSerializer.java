package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.workflow.Workflow;

/// Utility class for serializing and deserializing Storyloom workflows to/from JSON.
///
/// Wire format:
/// `{id, name, loop_max_count, timeout_seconds, nodes: [{id, type, name, config,
/// order_index, block_id, parent_block_id}]}`. Unknown properties are ignored so newer
/// editors can add fields; an unknown node type is a structural error.
///
/// ### Usage
/// {@snippet :
/// String json = WorkflowSerializer.toJson(workflow);
/// Workflow restored = WorkflowSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see StoryloomJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a workflow to pretty-printed JSON.
    ///
    /// @param workflow the workflow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Workflow workflow) {
        try {
            return createMapper().writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a workflow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized workflow, never null
    /// @throws WorkflowStructureException if a node has an unknown type
    /// @throws IllegalArgumentException if the JSON is malformed
    public static Workflow fromJson(String json) {
        try {
            return createMapper().readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw unwrap(e, "Failed to deserialize workflow: ");
        }
    }

    /// Creates an ObjectMapper configured for Storyloom serialization.
    ///
    /// Registers:
    /// - `StoryloomJacksonModule` for workflow nodes and wire-name enums
    /// - `JavaTimeModule` for `Instant` fields of execution records
    /// - snake_case property names
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StoryloomJacksonModule())
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Surfaces a structural error wrapped by Jackson, otherwise wraps the failure.
    static RuntimeException unwrap(JsonProcessingException e, String prefix) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof WorkflowStructureException structure) {
                return structure;
            }
        }
        return new IllegalArgumentException(prefix + e.getOriginalMessage(), e);
    }
}
