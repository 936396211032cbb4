package io.storyloom.core.execution.handler;

import io.storyloom.core.ai.AiOutcome;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.ChatMessage;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.setting.InjectionLevel;
import io.storyloom.core.setting.SettingsInjector.Injection;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Streams one chat completion and returns the accumulated text.
///
/// ### Message order
/// 1. prior turns of this node when `enable_history` is set (last `history_count`
///    messages)
/// 2. the system prompt (`system_prompt`, or the legacy `prompt`), prefixed with the
///    injected setting text
/// 3. the user prompt
///
/// Every chunk is reported through {@link HandlerContext#streamed(String, String)}. A
/// stream that ends without a terminal success fails the node, keeping the partial text
/// out of the variable store.
public class AiChatNodeHandler implements NodeHandler {

    private static final Logger logger = Logger.getLogger(AiChatNodeHandler.class.getName());

    static final int DEFAULT_HISTORY_COUNT = 10;

    @Override
    public NodeType getNodeType() {
        return NodeType.AI_CHAT;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        VariableStore scope = context.getScope();

        String systemPrompt = config.getString("system_prompt", config.getString("prompt", ""));
        Injection injection =
                context.getServices()
                        .settingsInjector()
                        .inject(
                                context.getServices().settingsProvider(),
                                config.getStringList("setting_ids"),
                                InjectionLevel.fromWireName(config.getString("injection_level", ""))
                                        .orElse(null));
        if (!injection.isEmpty()) {
            systemPrompt =
                    systemPrompt.isEmpty()
                            ? injection.text()
                            : injection.text() + "\n\n" + systemPrompt;
        }
        String userPrompt = config.getString("user_prompt", "");

        if (systemPrompt.isEmpty() && userPrompt.isEmpty()) {
            throw new NodeExecutionException(
                    FailureCode.MISSING_PROMPT,
                    "AI chat node needs a system prompt or a user prompt");
        }

        boolean history = config.getBoolean("enable_history", false);
        int historyCount = config.getInt("history_count", DEFAULT_HISTORY_COUNT);

        List<ChatMessage> messages = new ArrayList<>();
        if (history && historyCount > 0) {
            messages.addAll(scope.getChatHistory(node.getId(), historyCount));
        }
        if (!systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        if (!userPrompt.isEmpty()) {
            messages.add(ChatMessage.user(userPrompt));
        }

        AiRequest request =
                AiRequest.builder()
                        .provider(config.getString("provider", ""))
                        .model(config.getString("model", ""))
                        .messages(messages)
                        .temperature(config.getDouble("temperature"))
                        .maxTokens(config.getInteger("max_tokens"))
                        .topP(config.getDouble("top_p"))
                        .build();

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("provider", request.provider());
        resolvedConfig.put("model", request.model());
        resolvedConfig.put("systemPrompt", systemPrompt);
        resolvedConfig.put("userPrompt", userPrompt);
        resolvedConfig.put("temperature", request.temperature());
        resolvedConfig.put("maxTokens", request.maxTokens());
        resolvedConfig.put("topP", request.topP());
        resolvedConfig.put("enableHistory", history);
        resolvedConfig.put("historyCount", historyCount);
        resolvedConfig.put("settingNames", injection.settingNames());

        StringBuilder accumulated = new StringBuilder();
        AiOutcome outcome =
                context.getAiInvoker()
                        .invoke(
                                request,
                                delta -> {
                                    accumulated.append(delta);
                                    context.streamed(accumulated.toString(), delta);
                                });

        if (outcome instanceof AiOutcome.Failure failure) {
            logger.fine("AI chat node " + node.getId() + " failed: " + failure.reason());
            throw new NodeExecutionException(FailureCode.AI_ERROR, failure.reason());
        }
        if (outcome instanceof AiOutcome.Cancelled) {
            throw new NodeExecutionException(
                    FailureCode.CANCELLED, "AI call aborted after " + outcome.text().length() + " chars");
        }

        String reply = outcome.text();
        if (history) {
            scope.appendChatTurn(node.getId(), userPrompt, reply);
        }
        return HandlerResult.output(reply, resolvedConfig);
    }
}
