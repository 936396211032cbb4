package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes a `WorkflowNode` using the `"type"` wire name.
///
/// Fields are extracted manually from the `JsonNode` tree; only the opaque `config` map
/// goes through the mapper. Unknown properties are ignored.
///
/// ### Errors
/// - missing `id` or `type`: `MismatchedInputException`
/// - unknown `type`: {@link WorkflowStructureException}, since the engine has no handler
///   for it
///
/// @implNote Package-private. Registered by {@link StoryloomJacksonModule}.
/// @see WorkflowNodeSerializer for the inverse operation
class WorkflowNodeDeserializer extends StdDeserializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = -2386317715093465201L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    WorkflowNodeDeserializer() {
        super(WorkflowNode.class);
    }

    @Override
    public WorkflowNode deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = textOrNull(root, "id");
        String type = textOrNull(root, "type");
        if (id == null || type == null) {
            return ctxt.reportInputMismatch(
                    WorkflowNode.class, "Node requires 'id' and 'type', got: " + root);
        }
        NodeType nodeType =
                NodeType.fromWireName(type)
                        .orElseThrow(
                                () ->
                                        new WorkflowStructureException(
                                                "Unknown node type '" + type + "'", id));

        WorkflowNode.Builder builder =
                WorkflowNode.builder()
                        .id(id)
                        .type(nodeType)
                        .name(textOrNull(root, "name"))
                        .orderIndex(root.path("order_index").asInt(0))
                        .blockId(textOrNull(root, "block_id"))
                        .parentBlockId(textOrNull(root, "parent_block_id"));
        JsonNode config = root.get("config");
        if (config != null && config.isObject()) {
            builder.config(mapper.convertValue(config, OBJECT_MAP));
        }
        return builder.build();
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
