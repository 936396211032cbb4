package io.storyloom.core.execution.handler;

import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.condition.ConditionSpec;
import io.storyloom.core.exception.LoopLimitExceededException;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.execution.handler.BlockState.LoopFrame;
import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Decides whether a loop block runs again.
///
/// Reads the settings of the matching `loop_start`, resolved against the current
/// variables. Checks, in order:
/// 1. the loop's own `max_iterations` reached: exit
/// 2. `loop_type: condition` and the condition is false: exit
/// 3. the run's loop ceiling reached while the loop would continue: fail with
///    `loop_max_exceeded`
/// 4. otherwise run the body again
///
/// The condition reads the previous output, or with `condition_source: variable` the
/// node output or variable named by `condition_variable`.
public class LoopEndNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.LOOP_END;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        BlockInfo block = context.requireBlock(node);
        Optional<LoopFrame> frame = context.getBlockState().loopFrame(block.blockId());
        if (frame.isEmpty()) {
            return HandlerResult.control(
                    "no active loop", Map.of(), new ControlSignal.ExitBlock(block.blockId()));
        }

        NodeConfig config =
                context.resolvedConfigOf(context.getBlocks().nodeAt(block.startIndex()));
        int iteration = frame.get().getIteration();
        int ceiling = context.getLoopCeiling();
        int maxIterations =
                Math.max(
                        ConfigLimits.MIN_ITERATIONS,
                        Math.min(
                                ConfigLimits.MAX_ITERATIONS,
                                config.getInt("max_iterations", ceiling)));
        String loopType = config.getString("loop_type", "count");

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("loopType", loopType);
        resolvedConfig.put("iteration", iteration);
        resolvedConfig.put("maxIterations", maxIterations);

        if (iteration >= maxIterations) {
            return exit(block, iteration, resolvedConfig);
        }

        if ("condition".equals(loopType)) {
            String input =
                    "variable".equals(config.getString("condition_source"))
                            ? InputSources.named(
                                    config.getString("condition_variable", "").trim(),
                                    context.getScope())
                            : context.getScope().getLastOutput();
            boolean proceed =
                    context.getServices()
                            .conditionEvaluator()
                            .evaluate(ConditionSpec.from(config), input, context.getAiInvoker());
            resolvedConfig.put("conditionInput", input);
            resolvedConfig.put("conditionResult", proceed);
            if (!proceed) {
                return exit(block, iteration, resolvedConfig);
            }
        }

        if (iteration >= ceiling) {
            throw new LoopLimitExceededException(block.blockId(), ceiling);
        }
        return HandlerResult.control(
                "iteration " + iteration + " done",
                resolvedConfig,
                new ControlSignal.RepeatBlock(block.blockId()));
    }

    private HandlerResult exit(BlockInfo block, int iteration, Map<String, Object> resolvedConfig) {
        return HandlerResult.control(
                "loop finished after " + iteration + " iteration(s)",
                resolvedConfig,
                new ControlSignal.ExitBlock(block.blockId()));
    }
}
