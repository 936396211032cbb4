package io.storyloom.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Immutable workflow definition: an ordered node list plus run limits.
///
/// Nodes are kept sorted by `orderIndex` regardless of the order they were added in.
/// Structural checks (block pairing, start node, jump targets) are not performed here;
/// they run in {@link io.storyloom.core.block.BlockResolver} before every execution.
///
/// ### Limits
/// - `loopMaxCount`: global iteration ceiling for every loop, null to use the engine default
/// - `timeoutSeconds`: wall-clock budget for one run, null to use the engine default
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see WorkflowNode
/// @see io.storyloom.core.execution.WorkflowExecutor
public final class Workflow {

    private final String id;
    private final String name;
    private final List<WorkflowNode> nodes;
    private final Integer loopMaxCount;
    private final Integer timeoutSeconds;

    private Workflow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        List<WorkflowNode> sorted = new ArrayList<>(builder.nodes);
        sorted.sort(Comparator.comparingInt(WorkflowNode::getOrderIndex));
        this.nodes = Collections.unmodifiableList(sorted);
        this.loopMaxCount = builder.loopMaxCount;
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /// Returns nodes sorted by order index.
    ///
    /// @return unmodifiable node list, never null
    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    /// Returns the global loop iteration ceiling.
    ///
    /// @return ceiling, or null when the engine default applies
    public Integer getLoopMaxCount() {
        return loopMaxCount;
    }

    /// Returns the run timeout in seconds.
    ///
    /// @return timeout, or null when the engine default applies
    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .name(name)
                .nodes(nodes)
                .loopMaxCount(loopMaxCount)
                .timeoutSeconds(timeoutSeconds);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workflow that)) return false;
        return id.equals(that.id)
                && name.equals(that.name)
                && nodes.equals(that.nodes)
                && Objects.equals(loopMaxCount, that.loopMaxCount)
                && Objects.equals(timeoutSeconds, that.timeoutSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, loopMaxCount, timeoutSeconds);
    }

    public static final class Builder {
        private String id;
        private String name;
        private final List<WorkflowNode> nodes = new ArrayList<>();
        private Integer loopMaxCount;
        private Integer timeoutSeconds;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(WorkflowNode node) {
            this.nodes.add(node);
            return this;
        }

        public Builder nodes(List<WorkflowNode> nodes) {
            this.nodes.clear();
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder loopMaxCount(Integer loopMaxCount) {
            this.loopMaxCount = loopMaxCount;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Workflow build() {
            return new Workflow(this);
        }
    }
}
