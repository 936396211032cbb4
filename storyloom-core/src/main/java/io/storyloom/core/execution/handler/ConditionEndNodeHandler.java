package io.storyloom.core.execution.handler;

import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.Map;

/// Closes a condition block.
public class ConditionEndNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION_END;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context) {
        return HandlerResult.control("condition closed", Map.of(), ControlSignal.CONTINUE);
    }
}
