package io.storyloom.core.execution.handler;

import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.Map;

/// Separates the branches of a condition block.
///
/// Reached after the if-branch ran: skips the else-branch. Reached by the false skip:
/// enters the else-branch. Without a recorded outcome the else-branch runs.
public class ConditionElseNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION_ELSE;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        BlockInfo block = context.requireBlock(node);
        boolean ifBranchTaken = context.getBlockState().branchOutcome(block.blockId()).orElse(false);
        if (ifBranchTaken) {
            return HandlerResult.control(
                    "else skipped", Map.of(), new ControlSignal.SkipTo(block.endIndex()));
        }
        return HandlerResult.control("else entered", Map.of(), ControlSignal.CONTINUE);
    }
}
