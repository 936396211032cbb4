package io.storyloom.core.execution.handler;

import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Joins configured sources with a separator (default newline).
///
/// Each source is `{type: previous}`, `{type: variable, variable}` or
/// `{type: custom, custom}`. The editor's newer shape `{mode: variable|manual,
/// variable, manual}` is read as well.
public class TextConcatNodeHandler implements NodeHandler {

    static final String DEFAULT_SEPARATOR = "\n";

    @Override
    public NodeType getNodeType() {
        return NodeType.TEXT_CONCAT;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context) {
        NodeConfig config = context.getConfig();
        VariableStore scope = context.getScope();

        List<String> parts = new ArrayList<>();
        for (NodeConfig source : config.getConfigList("sources")) {
            parts.add(read(source, scope));
        }
        String separator =
                config.get("separator") != null
                        ? config.getString("separator").replace("\\n", "\n")
                        : DEFAULT_SEPARATOR;

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("resolvedSources", parts);
        resolvedConfig.put("separator", separator);
        return HandlerResult.output(String.join(separator, parts), resolvedConfig);
    }

    private String read(NodeConfig source, VariableStore scope) {
        String kind = source.getString("type", source.getString("mode", "custom"));
        return switch (kind) {
            case "previous" -> scope.getLastOutput();
            case "variable" -> InputSources.named(source.getString("variable", "").trim(), scope);
            case "manual" -> source.getString("manual", "");
            default -> source.getString("custom", "");
        };
    }
}
