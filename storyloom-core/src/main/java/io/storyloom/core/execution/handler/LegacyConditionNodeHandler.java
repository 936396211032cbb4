package io.storyloom.core.execution.handler;

import io.storyloom.core.condition.ConditionSpec;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Legacy single-node condition.
///
/// Evaluates the condition and applies `true_action`/`false_action`: `next` continues,
/// `jump` moves to `true_target`/`false_target`, `end` completes the run. The outcome is
/// stored as variable `_condition_<nodeId>` (`true`/`false`).
///
/// An evaluation error other than an abort counts as false, so the false action decides
/// what happens next.
public class LegacyConditionNodeHandler implements NodeHandler {

    private static final Logger logger =
            Logger.getLogger(LegacyConditionNodeHandler.class.getName());

    public static final String RESULT_VARIABLE_PREFIX = "_condition_";

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        String input = InputSources.read(config, context.getScope());
        ConditionSpec condition = ConditionSpec.from(config);

        boolean outcome;
        try {
            outcome =
                    context.getServices()
                            .conditionEvaluator()
                            .evaluate(condition, input, context.getAiInvoker());
        } catch (NodeExecutionException e) {
            if (e.getCode() == FailureCode.CANCELLED) {
                throw e;
            }
            logger.warning(
                    "Condition '" + node.getId() + "' could not be evaluated, taking false: "
                            + e.getMessage());
            outcome = false;
        }
        context.getScope().set(RESULT_VARIABLE_PREFIX + node.getId(), String.valueOf(outcome));

        String action = config.getString(outcome ? "true_action" : "false_action", "next");
        String target = config.getString(outcome ? "true_target" : "false_target", "");
        ControlSignal signal =
                switch (action) {
                    case "jump" ->
                            target.isEmpty() ? ControlSignal.CONTINUE : new ControlSignal.Jump(target);
                    case "end" -> ControlSignal.END;
                    default -> ControlSignal.CONTINUE;
                };

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("conditionInput", input);
        resolvedConfig.put(
                "conditionType", condition.type() != null ? condition.type().wireName() : null);
        resolvedConfig.put("keywords", condition.keywords());
        resolvedConfig.put(
                "keywordMode",
                condition.keywordMode() != null ? condition.keywordMode().wireName() : null);
        resolvedConfig.put("result", outcome);
        resolvedConfig.put("action", action);
        return HandlerResult.control(String.valueOf(outcome), resolvedConfig, signal);
    }
}
