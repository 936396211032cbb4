package io.storyloom.core.execution.handler;

import io.storyloom.core.condition.ConditionSpec;
import io.storyloom.core.exception.LoopLimitExceededException;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Legacy loop header.
///
/// The body is every node after the header. The first visit arms the header, so the
/// interpreter returns here when the cursor runs off the end of the node list. Each
/// later visit decides whether the body runs again:
/// - `condition_type: count`: while fewer than `max_iterations` passes finished
/// - `condition_type: condition`: additionally while the nested `condition` holds
///
/// On exit the cursor jumps to `exit_target`, or the run completes when there is none.
/// Continuing past the run's loop ceiling fails with `loop_max_exceeded`.
public class LegacyLoopNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.LOOP;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        BlockState state = context.getBlockState();
        int visit = state.visitLegacyLoop(node.getId());
        int ceiling = context.getLoopCeiling();
        int maxIterations =
                Math.max(
                        ConfigLimits.MIN_ITERATIONS,
                        Math.min(
                                ConfigLimits.MAX_ITERATIONS,
                                config.getInt("max_iterations", ceiling)));
        String conditionType = config.getString("condition_type", "count");

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("conditionType", conditionType);
        resolvedConfig.put("maxIterations", maxIterations);
        resolvedConfig.put("iteration", visit);

        if (visit == 1) {
            state.armLegacyLoop(node.getId());
            return HandlerResult.control("iteration 1", resolvedConfig, ControlSignal.CONTINUE);
        }

        int finished = visit - 1;
        boolean proceed = finished < maxIterations;
        if (proceed && "condition".equals(conditionType)) {
            NodeConfig condition = config.getConfig("condition");
            String input = InputSources.read(condition, context.getScope());
            proceed =
                    context.getServices()
                            .conditionEvaluator()
                            .evaluate(ConditionSpec.from(condition), input, context.getAiInvoker());
            resolvedConfig.put("conditionResult", proceed);
        }

        if (!proceed) {
            state.disarmLegacyLoop(node.getId());
            String exit = config.getString("exit_target", "");
            return HandlerResult.control(
                    "loop finished after " + finished + " iteration(s)",
                    resolvedConfig,
                    exit.isEmpty() ? ControlSignal.END : new ControlSignal.Jump(exit));
        }
        if (finished >= ceiling) {
            throw new LoopLimitExceededException(node.getId(), ceiling);
        }
        return HandlerResult.control("iteration " + visit, resolvedConfig, ControlSignal.CONTINUE);
    }
}
