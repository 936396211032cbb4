package io.storyloom.core.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable node definition as stored by the workflow editor.
///
/// Nodes form a flat list ordered by `orderIndex`. Nesting is encoded with
/// `blockId` (shared by the start/else/end markers of one block) and
/// `parentBlockId` (the enclosing block of any node). The {@link
/// io.storyloom.core.block.BlockResolver} turns that encoding back into a jump table.
///
/// The config map is opaque to the model. Handlers read it through {@link NodeConfig}.
///
/// @implNote Immutable and thread-safe after construction. The config map is an
/// unmodifiable copy; nested values are shared and must not be mutated.
public final class WorkflowNode {

    private final String id;
    private final NodeType type;
    private final String name;
    private final Map<String, Object> config;
    private final int orderIndex;
    private final String blockId;
    private final String parentBlockId;

    private WorkflowNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.type = Objects.requireNonNull(builder.type, "Node type required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.orderIndex = builder.orderIndex;
        this.blockId = builder.blockId;
        this.parentBlockId = builder.parentBlockId;
    }

    public String getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    /// Returns the display name shown in the editor and in execution traces.
    ///
    /// @return display name, falls back to the node ID, never null
    public String getName() {
        return name;
    }

    /// Returns the raw config map exactly as persisted, templates unresolved.
    ///
    /// @return unmodifiable config, never null (may be empty)
    public Map<String, Object> getConfig() {
        return config;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    /// Returns the block identifier shared by the markers of one block.
    ///
    /// @return block ID, or null for nodes that are not block markers
    public String getBlockId() {
        return blockId;
    }

    /// Returns the identifier of the enclosing block.
    ///
    /// @return enclosing block ID, or null at top level
    public String getParentBlockId() {
        return parentBlockId;
    }

    /// Returns a copy of this node with a different config, used by tests and editors.
    ///
    /// @param newConfig replacement config, not null
    /// @return new node, never null
    public WorkflowNode withConfig(Map<String, Object> newConfig) {
        return toBuilder().config(newConfig).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .type(type)
                .name(name)
                .config(config)
                .orderIndex(orderIndex)
                .blockId(blockId)
                .parentBlockId(parentBlockId);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowNode that)) return false;
        return orderIndex == that.orderIndex
                && id.equals(that.id)
                && type == that.type
                && name.equals(that.name)
                && config.equals(that.config)
                && Objects.equals(blockId, that.blockId)
                && Objects.equals(parentBlockId, that.parentBlockId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name, config, orderIndex, blockId, parentBlockId);
    }

    @Override
    public String toString() {
        return "WorkflowNode{id='" + id + "', type=" + type + ", orderIndex=" + orderIndex + "}";
    }

    public static final class Builder {
        private String id;
        private NodeType type;
        private String name;
        private Map<String, Object> config = Map.of();
        private int orderIndex;
        private String blockId;
        private String parentBlockId;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config != null ? config : Map.of();
            return this;
        }

        public Builder orderIndex(int orderIndex) {
            this.orderIndex = orderIndex;
            return this;
        }

        public Builder blockId(String blockId) {
            this.blockId = blockId;
            return this;
        }

        public Builder parentBlockId(String parentBlockId) {
            this.parentBlockId = parentBlockId;
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(this);
        }
    }
}
