package io.storyloom.core.execution.handler;

import io.storyloom.core.text.MarkdownStripper;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.Map;

/// Emits the previous output as the workflow result.
///
/// `format: markdown` (default) passes markdown through for rendering; `format: text`
/// strips it to plain text.
public class OutputNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.OUTPUT;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context) {
        String format = context.getConfig().getString("format", "markdown");
        String last = context.getScope().getLastOutput();
        String output = "text".equals(format) ? MarkdownStripper.strip(last) : last;
        return HandlerResult.output(output, Map.of("format", format));
    }
}
