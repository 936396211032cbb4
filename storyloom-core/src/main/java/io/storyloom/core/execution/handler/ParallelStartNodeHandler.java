package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Splits the input and fans the block body out over the items.
///
/// Reads `split_mode` (`line`, `separator`, `json_array`), `separator`, `concurrency`
/// (1-10, default 3) and `retry_count` (0-5). The input comes from the previous output
/// unless `input_source`/`input_variable` say otherwise.
public class ParallelStartNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.PARALLEL_START;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        String input = InputSources.read(config, context.getScope());
        List<String> items = ItemSupport.split(config, input, context.getServices());
        int concurrency = ItemSupport.concurrency(config, node.getId());
        int retryCount = ItemSupport.retryCount(config, node.getId());

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("splitMode", config.getString("split_mode", "line"));
        resolvedConfig.put("itemCount", items.size());
        resolvedConfig.put("concurrency", concurrency);
        resolvedConfig.put("retryCount", retryCount);
        return HandlerResult.control(
                items.size() + " items",
                resolvedConfig,
                new ControlSignal.FanOut(node.getBlockId(), items, concurrency, retryCount));
    }
}
