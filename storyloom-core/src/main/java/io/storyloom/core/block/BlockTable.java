package io.storyloom.core.block;

import io.storyloom.core.workflow.WorkflowNode;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Jump table built once per run from the flat node list.
///
/// Maps every block marker position to its {@link BlockInfo}, every node ID to its
/// position, and records which nodes only run as legacy batch targets.
///
/// @implNote Immutable and thread-safe. Parallel item-runs share one table.
public final class BlockTable {

    private final List<WorkflowNode> nodes;
    private final Map<String, Integer> indexById;
    private final Map<String, BlockInfo> blocksById;
    private final Map<Integer, BlockInfo> blocksByMarker;
    private final Set<Integer> batchTargets;

    BlockTable(
            List<WorkflowNode> nodes,
            Map<String, Integer> indexById,
            Map<String, BlockInfo> blocksById,
            Map<Integer, BlockInfo> blocksByMarker,
            Set<Integer> batchTargets) {
        this.nodes = List.copyOf(nodes);
        this.indexById = Map.copyOf(indexById);
        this.blocksById = Collections.unmodifiableMap(blocksById);
        this.blocksByMarker = Map.copyOf(blocksByMarker);
        this.batchTargets = Set.copyOf(batchTargets);
    }

    public List<WorkflowNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public WorkflowNode nodeAt(int index) {
        return nodes.get(index);
    }

    /// Returns the position of a node.
    ///
    /// @param nodeId node identifier, not null
    /// @return position, or empty if no such node
    public Optional<Integer> indexOf(String nodeId) {
        return Optional.ofNullable(indexById.get(nodeId));
    }

    public Optional<BlockInfo> block(String blockId) {
        return blockId == null ? Optional.empty() : Optional.ofNullable(blocksById.get(blockId));
    }

    /// Returns all blocks in order of their opening markers.
    public List<BlockInfo> blocks() {
        return List.copyOf(blocksById.values());
    }

    /// Returns the block whose start, else or end marker sits at `index`.
    public Optional<BlockInfo> blockAtMarker(int index) {
        return Optional.ofNullable(blocksByMarker.get(index));
    }

    /// Returns the innermost block that strictly encloses `index`.
    public Optional<BlockInfo> enclosingBlock(int index) {
        BlockInfo innermost = null;
        for (BlockInfo block : blocksById.values()) {
            if (block.encloses(index)
                    && (innermost == null || block.startIndex() > innermost.startIndex())) {
                innermost = block;
            }
        }
        return Optional.ofNullable(innermost);
    }

    /// Returns true if the node at `index` is referenced by a legacy `batch` node and
    /// therefore only runs inside that batch's item-runs.
    public boolean isBatchTarget(int index) {
        return batchTargets.contains(index);
    }
}
