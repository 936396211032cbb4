package io.storyloom.core.block;

import io.storyloom.core.workflow.NodeType;
import java.util.List;

/// One resolved block: the positions of its markers in the ordered node list.
///
/// @param blockId shared identifier of the block's markers, not null
/// @param kind type of the opening marker (`loop_start`, `parallel_start`, `condition_if`)
/// @param startIndex position of the opening marker
/// @param elseIndex position of `condition_else`, or -1 when absent
/// @param endIndex position of the closing marker, always greater than `startIndex`
/// @param parentBlockId enclosing block, or null at top level
/// @param childBlockIds directly nested blocks in order of appearance, never null
public record BlockInfo(
        String blockId,
        NodeType kind,
        int startIndex,
        int elseIndex,
        int endIndex,
        String parentBlockId,
        List<String> childBlockIds) {

    public BlockInfo {
        childBlockIds = List.copyOf(childBlockIds);
    }

    public boolean hasElse() {
        return elseIndex >= 0;
    }

    /// Returns true if `index` lies strictly between the opening and closing markers.
    public boolean encloses(int index) {
        return index > startIndex && index < endIndex;
    }

    BlockInfo withChildren(List<String> children) {
        return new BlockInfo(
                blockId, kind, startIndex, elseIndex, endIndex, parentBlockId, children);
    }
}
