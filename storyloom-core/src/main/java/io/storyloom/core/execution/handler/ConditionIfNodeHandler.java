package io.storyloom.core.execution.handler;

import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.condition.ConditionSpec;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Evaluates a condition block.
///
/// True enters the if-branch. False skips to `condition_else` when the block has one,
/// else to `condition_end`. The outcome is kept for the else marker.
public class ConditionIfNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION_IF;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        BlockInfo block = context.requireBlock(node);
        NodeConfig config = context.getConfig();
        String input = InputSources.read(config, context.getScope());
        ConditionSpec condition = ConditionSpec.from(config);

        boolean outcome =
                context.getServices()
                        .conditionEvaluator()
                        .evaluate(condition, input, context.getAiInvoker());
        context.getBlockState().recordBranch(block.blockId(), outcome);

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("conditionInput", input);
        resolvedConfig.put(
                "conditionType", condition.type() != null ? condition.type().wireName() : null);
        resolvedConfig.put("result", outcome);

        if (outcome) {
            return HandlerResult.control("true", resolvedConfig, ControlSignal.CONTINUE);
        }
        int target = block.hasElse() ? block.elseIndex() : block.endIndex();
        return HandlerResult.control("false", resolvedConfig, new ControlSignal.SkipTo(target));
    }
}
