package io.storyloom.core.execution.handler;

import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.block.BlockTable;
import io.storyloom.core.execution.parallel.ItemResult;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Control-flow bookkeeping of one interpreter: loop frames, condition outcomes,
/// parallel join results and the armed legacy loop.
///
/// Each item-run gets its own instance, so no synchronization is needed.
public class BlockState {

    private final Deque<LoopFrame> frames = new ArrayDeque<>();
    private final Map<String, Boolean> branchOutcomes = new HashMap<>();
    private final Map<String, List<ItemResult>> joinResults = new HashMap<>();
    private final Map<String, Integer> legacyLoopVisits = new HashMap<>();
    private String legacyLoopHeader;

    /// Active loop block and its current 1-based iteration.
    public static final class LoopFrame {
        private final String blockId;
        private int iteration = 1;

        LoopFrame(String blockId) {
            this.blockId = blockId;
        }

        public String getBlockId() {
            return blockId;
        }

        public int getIteration() {
            return iteration;
        }
    }

    // === Loop frames ===

    public void pushLoop(String blockId) {
        frames.push(new LoopFrame(blockId));
    }

    /// Returns the innermost frame of a loop block, if it is active.
    public Optional<LoopFrame> loopFrame(String blockId) {
        return frames.stream().filter(f -> f.blockId.equals(blockId)).findFirst();
    }

    /// Increments the iteration of an active loop.
    ///
    /// @return the new iteration number, or 0 if the loop is not active
    public int nextIteration(String blockId) {
        return loopFrame(blockId).map(f -> ++f.iteration).orElse(0);
    }

    /// Pops the frame of `blockId` and every frame pushed after it.
    public void popLoop(String blockId) {
        if (loopFrame(blockId).isEmpty()) {
            return;
        }
        while (!frames.isEmpty()) {
            if (frames.pop().blockId.equals(blockId)) {
                return;
            }
        }
    }

    /// Drops frames of loops that do not enclose `index`. Used after a jump.
    public void dropFramesOutside(int index, BlockTable blocks) {
        Iterator<LoopFrame> it = frames.iterator();
        while (it.hasNext()) {
            LoopFrame frame = it.next();
            boolean encloses = blocks.block(frame.blockId).map(b -> b.encloses(index)).orElse(false);
            if (!encloses) {
                it.remove();
            }
        }
    }

    public int depth() {
        return frames.size();
    }

    // === Condition blocks ===

    public void recordBranch(String blockId, boolean outcome) {
        branchOutcomes.put(blockId, outcome);
    }

    public Optional<Boolean> branchOutcome(String blockId) {
        return Optional.ofNullable(branchOutcomes.get(blockId));
    }

    // === Parallel blocks ===

    public void recordJoin(BlockInfo block, List<ItemResult> results) {
        joinResults.put(block.blockId(), List.copyOf(results));
    }

    /// Removes and returns the item results waiting at a block's join.
    public Optional<List<ItemResult>> takeJoin(String blockId) {
        return Optional.ofNullable(joinResults.remove(blockId));
    }

    // === Legacy loop ===

    /// Counts a visit of a legacy loop header.
    ///
    /// @return 1-based visit number
    public int visitLegacyLoop(String nodeId) {
        return legacyLoopVisits.merge(nodeId, 1, Integer::sum);
    }

    public void armLegacyLoop(String nodeId) {
        legacyLoopHeader = nodeId;
    }

    public void disarmLegacyLoop(String nodeId) {
        legacyLoopVisits.remove(nodeId);
        if (nodeId.equals(legacyLoopHeader)) {
            legacyLoopHeader = null;
        }
    }

    /// Returns the legacy loop header the cursor wraps to at the end of the node list.
    public Optional<String> armedLegacyLoop() {
        return Optional.ofNullable(legacyLoopHeader);
    }
}
