package io.storyloom.core.condition;

import io.storyloom.core.ai.AiInvoker;
import io.storyloom.core.ai.AiOutcome;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.ChatMessage;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Evaluates keyword, length, regex and AI-judged conditions against an input text.
///
/// ### Rules
/// - keyword: an empty keyword list is true; matching is case-sensitive substring search
/// - length: counts UTF-16 code units of the input
/// - regex: finds the pattern anywhere in the input; an invalid pattern is false
/// - ai_judge: asks the model for `true` or `false`, temperature 0; the answer is
///   true only if it mentions `true` and not `false`
///
/// @implNote Stateless and thread-safe.
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    static final String JUDGE_INSTRUCTION =
            "Judge the following content against the requirement above. Reply only true or false:";
    static final int JUDGE_MAX_TOKENS = 10;

    /// Evaluates a condition.
    ///
    /// @param condition condition settings, not null
    /// @param input text to test, not null
    /// @param ai invoker for `ai_judge`, not null
    /// @return evaluation result
    /// @throws NodeExecutionException if an AI judge is misconfigured, fails or is aborted
    public boolean evaluate(ConditionSpec condition, String input, AiInvoker ai)
            throws NodeExecutionException {
        if (condition.type() == null) {
            return false;
        }
        return switch (condition.type()) {
            case KEYWORD -> matchKeywords(condition.keywords(), condition.keywordMode(), input);
            case LENGTH ->
                    condition.lengthOperator() != null
                            && condition.lengthOperator().test(input.length(), condition.lengthValue());
            case REGEX -> matchRegex(condition.regexPattern(), input);
            case AI_JUDGE -> judge(condition, input, ai);
        };
    }

    private boolean matchKeywords(List<String> keywords, KeywordMode mode, String input) {
        if (keywords.isEmpty()) {
            return true;
        }
        if (mode == null) {
            return false;
        }
        return switch (mode) {
            case ANY -> keywords.stream().anyMatch(input::contains);
            case ALL -> keywords.stream().allMatch(input::contains);
            case NONE -> keywords.stream().noneMatch(input::contains);
        };
    }

    private boolean matchRegex(String pattern, String input) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        try {
            return Pattern.compile(pattern).matcher(input).find();
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid condition pattern '" + pattern + "': " + e.getDescription());
            return false;
        }
    }

    private boolean judge(ConditionSpec condition, String input, AiInvoker ai)
            throws NodeExecutionException {
        if (isBlank(condition.aiProvider())
                || isBlank(condition.aiModel())
                || isBlank(condition.aiPrompt())) {
            throw new NodeExecutionException(
                    FailureCode.NODE_ERROR, "AI judge requires ai_provider, ai_model and ai_prompt");
        }

        String prompt = condition.aiPrompt() + "\n\n" + JUDGE_INSTRUCTION + "\n\n" + input;
        AiRequest request =
                AiRequest.builder()
                        .provider(condition.aiProvider())
                        .model(condition.aiModel())
                        .messages(List.of(ChatMessage.user(prompt)))
                        .temperature(0.0)
                        .maxTokens(JUDGE_MAX_TOKENS)
                        .build();

        AiOutcome outcome = ai.invoke(request, chunk -> {});
        if (outcome instanceof AiOutcome.Failure failure) {
            throw new NodeExecutionException(
                    FailureCode.AI_ERROR, "AI judge failed: " + failure.reason());
        }
        if (outcome instanceof AiOutcome.Cancelled) {
            throw new NodeExecutionException(FailureCode.CANCELLED, "AI judge was cancelled");
        }

        String answer = outcome.text().trim().toLowerCase(Locale.ROOT);
        boolean result = answer.contains("true") && !answer.contains("false");
        logger.fine("AI judge answered '" + answer + "' -> " + result);
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
