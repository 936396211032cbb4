package io.storyloom.core.execution.handler;

import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.execution.parallel.ItemResult;
import io.storyloom.core.execution.parallel.OutputMode;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Joins a parallel block.
///
/// Fails with `item_failed` if any item-run failed. Otherwise merges the outputs per the
/// `output_mode` and `output_separator` of the matching `parallel_start`; the merged text
/// becomes this node's output.
public class ParallelEndNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.PARALLEL_END;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        BlockInfo block = context.requireBlock(node);
        List<ItemResult> results =
                context.getBlockState()
                        .takeJoin(block.blockId())
                        .orElseThrow(
                                () ->
                                        new NodeExecutionException(
                                                FailureCode.NODE_ERROR,
                                                "Parallel block '"
                                                        + block.blockId()
                                                        + "' joined without a fan-out"));
        ItemSupport.requireAllSucceeded(results);

        NodeConfig config =
                context.resolvedConfigOf(context.getBlocks().nodeAt(block.startIndex()));
        OutputMode mode = ItemSupport.outputMode(config);
        String separator = config.getString("output_separator");
        String merged = context.getServices().resultMerger().merge(results, mode, separator);

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("itemCount", results.size());
        resolvedConfig.put("outputMode", mode.wireName());
        resolvedConfig.put("outputSeparator", separator);
        return HandlerResult.output(merged, resolvedConfig);
    }
}
