package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.storyloom.core.workflow.WorkflowNode;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `WorkflowNode` with its wire type name and snake_case keys.
///
/// Emitted JSON shape:
/// `{"id":"...","type":"ai_chat","name":"...","config":{...},"order_index":N,
/// "block_id":"..."|null,"parent_block_id":"..."|null}`. The config map is written as-is,
/// unknown keys included.
///
/// @implNote Package-private. Registered by {@link StoryloomJacksonModule}.
/// @see WorkflowNodeDeserializer for the inverse operation
class WorkflowNodeSerializer extends StdSerializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = 4471905836201183542L;

    WorkflowNodeSerializer() {
        super(WorkflowNode.class);
    }

    @Override
    public void serialize(WorkflowNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", node.getType().wireName());
        gen.writeStringField("name", node.getName());
        gen.writeFieldName("config");
        provider.defaultSerializeValue(node.getConfig(), gen);
        gen.writeNumberField("order_index", node.getOrderIndex());
        gen.writeStringField("block_id", node.getBlockId());
        gen.writeStringField("parent_block_id", node.getParentBlockId());
        gen.writeEndObject();
    }
}
