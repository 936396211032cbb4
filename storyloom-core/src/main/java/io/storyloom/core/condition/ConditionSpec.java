package io.storyloom.core.condition;

import io.storyloom.core.workflow.NodeConfig;
import java.util.List;

/// Condition settings shared by `condition_if`, condition-based loops and the legacy
/// `condition` node.
///
/// Unknown or missing enum values stay null; the evaluator treats them as false.
///
/// @param type condition kind, null if unrecognised
/// @param keywords keywords for {@link ConditionType#KEYWORD}, never null
/// @param keywordMode keyword matching mode, null if unrecognised
/// @param lengthOperator comparison for {@link ConditionType#LENGTH}, null if unrecognised
/// @param lengthValue right-hand side of the length comparison
/// @param regexPattern pattern for {@link ConditionType#REGEX}, may be null
/// @param aiPrompt judging instructions for {@link ConditionType#AI_JUDGE}, may be null
/// @param aiProvider provider for the judge, may be null
/// @param aiModel model for the judge, may be null
public record ConditionSpec(
        ConditionType type,
        List<String> keywords,
        KeywordMode keywordMode,
        LengthOperator lengthOperator,
        int lengthValue,
        String regexPattern,
        String aiPrompt,
        String aiProvider,
        String aiModel) {

    public ConditionSpec {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /// Reads a condition from a node config, defaulting the type to keyword and the
    /// keyword mode to `any`.
    ///
    /// @param config node config, not null
    /// @return parsed condition, never null
    public static ConditionSpec from(NodeConfig config) {
        return new ConditionSpec(
                ConditionType.fromWireName(config.getString("condition_type", "keyword"))
                        .orElse(null),
                config.getStringList("keywords"),
                KeywordMode.fromWireName(config.getString("keyword_mode", "any")).orElse(null),
                LengthOperator.fromSymbol(config.getString("length_operator", "")).orElse(null),
                config.getInt("length_value", 0),
                config.getString("regex_pattern"),
                config.getString("ai_prompt"),
                config.getString("ai_provider"),
                config.getString("ai_model"));
    }
}
