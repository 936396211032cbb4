package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Sets a declared variable.
///
/// `value_source: previous` takes the previous output; any other source takes
/// `value_template`, falling back to `custom_value`. Only variables declared by the
/// start node, the run's initial variables or an earlier update may be set.
public class VarUpdateNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.VAR_UPDATE;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        String name = config.getString("variable_name", "").trim();
        if (name.isEmpty() || !context.getScope().isDeclared(name)) {
            throw new NodeExecutionException(
                    FailureCode.UNDECLARED_VARIABLE,
                    "Variable '" + name + "' is not declared");
        }

        String value =
                "previous".equals(config.getString("value_source"))
                        ? context.getScope().getLastOutput()
                        : config.getString("value_template", config.getString("custom_value", ""));
        context.getScope().set(name, value);

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("variableName", name);
        resolvedConfig.put("variableValue", value);
        return HandlerResult.output(value, resolvedConfig);
    }
}
