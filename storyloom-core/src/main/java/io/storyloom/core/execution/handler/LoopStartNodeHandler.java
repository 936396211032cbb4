package io.storyloom.core.execution.handler;

import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Opens a loop block. The interpreter pushes a frame at iteration 1.
///
/// The loop itself is decided at `loop_end`; see {@link LoopEndNodeHandler}.
public class LoopStartNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.LOOP_START;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context) {
        NodeConfig config = context.getConfig();
        int maxIterations =
                ConfigLimits.clamp(
                        "max_iterations of loop '" + node.getBlockId() + "'",
                        config.getInt("max_iterations", context.getLoopCeiling()),
                        ConfigLimits.MIN_ITERATIONS,
                        ConfigLimits.MAX_ITERATIONS);

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("loopType", config.getString("loop_type", "count"));
        resolvedConfig.put("maxIterations", maxIterations);
        resolvedConfig.put("loopCeiling", context.getLoopCeiling());
        return HandlerResult.control(
                "loop started", resolvedConfig, new ControlSignal.EnterBlock(node.getBlockId()));
    }
}
