package io.storyloom.core.execution.handler;

import java.util.List;

/// Tells the interpreter where the cursor goes after a node.
///
/// Block signals carry the block id; the interpreter looks the block up in the
/// {@link io.storyloom.core.block.BlockTable} resolved before the run.
public sealed interface ControlSignal {

    ControlSignal CONTINUE = new Continue();
    ControlSignal END = new End();

    /// Move to the next node.
    record Continue() implements ControlSignal {}

    /// Move to a node by id. Used by the legacy single-node types.
    record Jump(String nodeId) implements ControlSignal {}

    /// Finish the run as completed.
    record End() implements ControlSignal {}

    /// Push a loop frame and enter the body.
    record EnterBlock(String blockId) implements ControlSignal {}

    /// Run the loop body again with the next iteration number.
    record RepeatBlock(String blockId) implements ControlSignal {}

    /// Pop the loop frame and continue after the closing marker.
    record ExitBlock(String blockId) implements ControlSignal {}

    /// Jump forward to `index`, reporting every bypassed node as skipped.
    record SkipTo(int index) implements ControlSignal {}

    /// Run the block body once per item, then continue at the closing marker.
    ///
    /// @param concurrency maximum item-runs in flight
    /// @param retryCount extra attempts per failed item
    record FanOut(String blockId, List<String> items, int concurrency, int retryCount)
            implements ControlSignal {
        public FanOut {
            items = List.copyOf(items);
        }
    }
}
