package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.execution.parallel.ItemResult;
import io.storyloom.core.execution.parallel.OutputMode;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Legacy batch: runs `target_nodes` once per split item and merges the outputs.
///
/// Uses the same splitting, limits and merging as the parallel block. The target nodes
/// run only inside item-runs; the main cursor reports them as skipped.
public class BatchNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.BATCH;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        String input = InputSources.read(config, context.getScope());
        List<String> items = ItemSupport.split(config, input, context.getServices());
        List<String> targets = config.getStringList("target_nodes");
        int concurrency = ItemSupport.concurrency(config, node.getId());
        int retryCount = ItemSupport.retryCount(config, node.getId());

        List<ItemResult> results =
                context.getItemRunner().runNodes(targets, items, concurrency, retryCount);
        ItemSupport.requireAllSucceeded(results);

        OutputMode mode = ItemSupport.outputMode(config);
        String separator = config.getString("output_separator");
        String merged = context.getServices().resultMerger().merge(results, mode, separator);

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("splitMode", config.getString("split_mode", "line"));
        resolvedConfig.put("itemCount", items.size());
        resolvedConfig.put("targetNodes", targets);
        resolvedConfig.put("concurrency", concurrency);
        resolvedConfig.put("outputMode", mode.wireName());
        return HandlerResult.output(merged, resolvedConfig);
    }
}
