package io.storyloom.core.block;

import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Reconstructs nested block structure from the flat, order-indexed node list.
///
/// A single left-to-right scan keeps a stack of open blocks. Opening markers push,
/// `condition_else` attaches to the `condition_if` on top of the stack, and closing
/// markers pop after checking that kind and `block_id` match.
///
/// ### Structural errors
/// - empty node list, or first node not `start`
/// - duplicate node ID, `order_index` or `block_id`
/// - marker without `block_id`
/// - closing marker that does not match the top of the stack, or unterminated block
/// - `condition_else` outside its `condition_if`, or a second else in one block
/// - legacy jump, exit or batch targets that name no node
///
/// Inconsistent `parent_block_id` values are editor metadata and only logged.
public class BlockResolver {

    private static final Logger logger = Logger.getLogger(BlockResolver.class.getName());

    /// Resolves the node list into a jump table.
    ///
    /// @param nodes nodes sorted by order index, not null
    /// @return resolved table, never null
    /// @throws WorkflowStructureException if the list is malformed
    public BlockTable resolve(List<WorkflowNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (nodes.isEmpty()) {
            throw new WorkflowStructureException("Workflow has no nodes");
        }
        if (nodes.get(0).getType() != NodeType.START) {
            throw new WorkflowStructureException(
                    "First node must be a start node, was " + nodes.get(0).getType(),
                    nodes.get(0).getId());
        }

        Map<String, Integer> indexById = new HashMap<>();
        Set<Integer> orderIndexes = new HashSet<>();
        Map<String, BlockInfo> blocks = new LinkedHashMap<>();
        Map<Integer, BlockInfo> byMarker = new HashMap<>();
        Set<String> seenBlockIds = new HashSet<>();
        Deque<OpenBlock> stack = new ArrayDeque<>();

        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            if (indexById.putIfAbsent(node.getId(), i) != null) {
                throw new WorkflowStructureException(
                        "Duplicate node id '" + node.getId() + "'", node.getId());
            }
            if (!orderIndexes.add(node.getOrderIndex())) {
                throw new WorkflowStructureException(
                        "Duplicate order_index " + node.getOrderIndex(), node.getId());
            }

            NodeType type = node.getType();
            if (type.isBlockStart()) {
                String blockId = requireBlockId(node);
                if (!seenBlockIds.add(blockId)) {
                    throw new WorkflowStructureException(
                            "Duplicate block_id '" + blockId + "'", node.getId());
                }
                checkParent(node, stack);
                stack.push(new OpenBlock(blockId, type, i));
            } else if (type == NodeType.CONDITION_ELSE) {
                String blockId = requireBlockId(node);
                OpenBlock top = stack.peek();
                if (top == null
                        || top.kind != NodeType.CONDITION_IF
                        || !top.blockId.equals(blockId)) {
                    throw new WorkflowStructureException(
                            "condition_else '" + node.getId() + "' is not inside its condition_if",
                            node.getId());
                }
                if (top.elseIndex >= 0) {
                    throw new WorkflowStructureException(
                            "Block '" + blockId + "' has more than one condition_else",
                            node.getId());
                }
                top.elseIndex = i;
            } else if (type.isBlockEnd()) {
                String blockId = requireBlockId(node);
                OpenBlock top = stack.peek();
                if (top == null || !top.blockId.equals(blockId) || top.kind.closingType() != type) {
                    throw new WorkflowStructureException(
                            type
                                    + " '"
                                    + node.getId()
                                    + "' does not close the innermost open block"
                                    + (top != null ? " '" + top.blockId + "'" : ""),
                            node.getId());
                }
                stack.pop();
                OpenBlock parent = stack.peek();
                BlockInfo info =
                        new BlockInfo(
                                blockId,
                                top.kind,
                                top.startIndex,
                                top.elseIndex,
                                i,
                                parent != null ? parent.blockId : null,
                                List.of());
                blocks.put(blockId, info);
                checkParent(node, stack);
            } else {
                checkParent(node, stack);
            }
        }

        if (!stack.isEmpty()) {
            OpenBlock open = stack.peek();
            throw new WorkflowStructureException(
                    "Block '" + open.blockId + "' is never closed",
                    nodes.get(open.startIndex).getId());
        }

        Map<String, BlockInfo> ordered = withChildren(blocks);
        for (BlockInfo info : ordered.values()) {
            byMarker.put(info.startIndex(), info);
            byMarker.put(info.endIndex(), info);
            if (info.hasElse()) {
                byMarker.put(info.elseIndex(), info);
            }
        }

        Set<Integer> batchTargets = checkLegacyTargets(nodes, indexById);
        logger.fine("Resolved " + ordered.size() + " blocks over " + nodes.size() + " nodes");
        return new BlockTable(nodes, indexById, ordered, byMarker, batchTargets);
    }

    private String requireBlockId(WorkflowNode node) {
        String blockId = node.getBlockId();
        if (blockId == null || blockId.isBlank()) {
            throw new WorkflowStructureException(
                    node.getType() + " node '" + node.getId() + "' has no block_id",
                    node.getId());
        }
        return blockId;
    }

    private void checkParent(WorkflowNode node, Deque<OpenBlock> stack) {
        String declared = node.getParentBlockId();
        if (declared == null || declared.isEmpty()) {
            return;
        }
        OpenBlock enclosing = stack.peek();
        String actual = enclosing != null ? enclosing.blockId : null;
        if (!declared.equals(actual)) {
            logger.warning(
                    "Node '"
                            + node.getId()
                            + "' declares parent_block_id '"
                            + declared
                            + "' but sits in "
                            + (actual != null ? "block '" + actual + "'" : "top level"));
        }
    }

    private Map<String, BlockInfo> withChildren(Map<String, BlockInfo> closedOrder) {
        // Sort by start index so parents precede children
        List<BlockInfo> sorted = new ArrayList<>(closedOrder.values());
        sorted.sort((a, b) -> Integer.compare(a.startIndex(), b.startIndex()));

        Map<String, List<String>> children = new HashMap<>();
        for (BlockInfo info : sorted) {
            if (info.parentBlockId() != null) {
                children.computeIfAbsent(info.parentBlockId(), k -> new ArrayList<>())
                        .add(info.blockId());
            }
        }

        Map<String, BlockInfo> result = new LinkedHashMap<>();
        for (BlockInfo info : sorted) {
            result.put(
                    info.blockId(),
                    info.withChildren(children.getOrDefault(info.blockId(), List.of())));
        }
        return result;
    }

    private Set<Integer> checkLegacyTargets(
            List<WorkflowNode> nodes, Map<String, Integer> indexById) {
        Set<Integer> batchTargets = new HashSet<>();
        for (WorkflowNode node : nodes) {
            NodeConfig config = NodeConfig.of(node.getConfig());
            switch (node.getType()) {
                case CONDITION -> {
                    requireJumpTarget(node, config, "true_action", "true_target", indexById);
                    requireJumpTarget(node, config, "false_action", "false_target", indexById);
                }
                case LOOP -> {
                    String exit = config.getString("exit_target");
                    if (exit != null && !exit.isEmpty() && !indexById.containsKey(exit)) {
                        throw new WorkflowStructureException(
                                "Loop '" + node.getId() + "' exits to unknown node '" + exit + "'",
                                node.getId());
                    }
                }
                case BATCH -> {
                    for (String target : config.getStringList("target_nodes")) {
                        Integer index = indexById.get(target);
                        if (index == null) {
                            throw new WorkflowStructureException(
                                    "Batch '" + node.getId() + "' targets unknown node '"
                                            + target + "'",
                                    node.getId());
                        }
                        NodeType targetType = nodes.get(index).getType();
                        if (targetType.isMarker()
                                || targetType.isLegacy()
                                || targetType == NodeType.START) {
                            throw new WorkflowStructureException(
                                    "Batch '" + node.getId() + "' cannot target " + targetType
                                            + " node '" + target + "'",
                                    node.getId());
                        }
                        batchTargets.add(index);
                    }
                }
                default -> {}
            }
        }
        return batchTargets;
    }

    private void requireJumpTarget(
            WorkflowNode node,
            NodeConfig config,
            String actionKey,
            String targetKey,
            Map<String, Integer> indexById) {
        if (!"jump".equals(config.getString(actionKey))) {
            return;
        }
        String target = config.getString(targetKey);
        if (target == null || !indexById.containsKey(target)) {
            throw new WorkflowStructureException(
                    "Condition '" + node.getId() + "' jumps to unknown node '" + target + "'",
                    node.getId());
        }
    }

    private static final class OpenBlock {
        private final String blockId;
        private final NodeType kind;
        private final int startIndex;
        private int elseIndex = -1;

        private OpenBlock(String blockId, NodeType kind, int startIndex) {
            this.blockId = blockId;
            this.kind = kind;
            this.startIndex = startIndex;
        }
    }
}
