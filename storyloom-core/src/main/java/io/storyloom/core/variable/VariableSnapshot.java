package io.storyloom.core.variable;

import io.storyloom.core.ai.ChatMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Immutable copy of a {@link VariableStore}, persisted as the execution's
/// `variables_snapshot` at pause and at the end of a run.
///
/// @param variables named variables, never null
/// @param nodeOutputs most recent output per node ID, never null
/// @param lastOutput output of the most recent non-marker node, never null
/// @param input run input, never null
/// @param chatHistory chat turns per `ai_chat` node ID, never null
public record VariableSnapshot(
        Map<String, String> variables,
        Map<String, String> nodeOutputs,
        String lastOutput,
        String input,
        Map<String, List<ChatMessage>> chatHistory) {

    public VariableSnapshot {
        variables = copy(variables);
        nodeOutputs = copy(nodeOutputs);
        lastOutput = lastOutput != null ? lastOutput : "";
        input = input != null ? input : "";
        Map<String, List<ChatMessage>> history = new LinkedHashMap<>();
        if (chatHistory != null) {
            chatHistory.forEach((k, v) -> history.put(k, List.copyOf(v)));
        }
        chatHistory = Collections.unmodifiableMap(history);
    }

    public static VariableSnapshot empty() {
        return new VariableSnapshot(Map.of(), Map.of(), "", "", Map.of());
    }

    private static Map<String, String> copy(Map<String, String> source) {
        return source != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
                : Map.of();
    }
}
