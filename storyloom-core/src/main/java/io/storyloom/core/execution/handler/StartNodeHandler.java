package io.storyloom.core.execution.handler;

import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Declares the run input and the workflow's custom variables.
///
/// The run input, or `default_value` when the input is empty, is stored as variable
/// `input`. Each `custom_variables` entry `{name, default_value}` is declared in order;
/// defaults are resolved one by one, so a default may reference an earlier variable.
public class StartNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.START;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context) {
        VariableStore scope = context.getScope();
        String input = scope.getInput();
        String value =
                input == null || input.isEmpty()
                        ? context.getConfig().getString("default_value", "")
                        : input;
        scope.set(VariableStore.INPUT, value);

        // Raw config: defaults are resolved after the variables before them exist
        Map<String, Object> declared = new LinkedHashMap<>();
        for (NodeConfig variable : NodeConfig.of(node.getConfig()).getConfigList("custom_variables")) {
            String name = variable.getString("name", "").trim();
            if (name.isEmpty()) {
                continue;
            }
            String resolved = scope.resolve(variable.getString("default_value", ""));
            scope.set(name, resolved);
            declared.put(name, resolved);
        }

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("input", value);
        resolvedConfig.put("customVariables", declared);
        return HandlerResult.output(value, resolvedConfig);
    }
}
