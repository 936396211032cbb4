package io.storyloom.core.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storyloom.core.ai.AiInvoker;
import io.storyloom.core.ai.AiOutcome;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConditionEvaluatorTest {

    private static final AiInvoker NO_AI =
            (request, onChunk) -> {
                throw new AssertionError("AI must not be called");
            };

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private boolean evaluate(Map<String, Object> config, String input)
            throws NodeExecutionException {
        return evaluator.evaluate(ConditionSpec.from(NodeConfig.of(config)), input, NO_AI);
    }

    @Nested
    class Keyword {

        @ParameterizedTest
        @CsvSource({
            "any, true",
            "all, false",
            "none, false"
        })
        void shouldApplyKeywordMode(String mode, boolean expected) throws Exception {
            Map<String, Object> config =
                    Map.of("keywords", List.of("storm", "calm"), "keyword_mode", mode);

            assertThat(evaluate(config, "a storm rises")).isEqualTo(expected);
        }

        @Test
        void shouldTreatEmptyKeywordListAsTrue() throws Exception {
            assertThat(evaluate(Map.of("keyword_mode", "none"), "anything")).isTrue();
        }

        @Test
        void shouldMatchCaseSensitively() throws Exception {
            assertThat(evaluate(Map.of("keywords", List.of("Storm")), "a storm rises")).isFalse();
        }

        @Test
        void shouldTreatUnknownModeAsFalse() throws Exception {
            assertThat(
                            evaluate(
                                    Map.of("keywords", List.of("storm"), "keyword_mode", "some"),
                                    "storm"))
                    .isFalse();
        }
    }

    @Nested
    class Length {

        @ParameterizedTest
        @CsvSource({
            ">, 4, true",
            ">, 5, false",
            "<, 6, true",
            "=, 5, true",
            ">=, 5, true",
            "<=, 4, false"
        })
        void shouldCompareLength(String operator, int value, boolean expected) throws Exception {
            Map<String, Object> config =
                    Map.of(
                            "condition_type", "length",
                            "length_operator", operator,
                            "length_value", value);

            assertThat(evaluate(config, "hello")).isEqualTo(expected);
        }

        @Test
        void shouldTreatUnknownOperatorAsFalse() throws Exception {
            assertThat(
                            evaluate(
                                    Map.of("condition_type", "length", "length_operator", "!="),
                                    "hello"))
                    .isFalse();
        }
    }

    @Nested
    class Regex {

        @Test
        void shouldFindPatternAnywhere() throws Exception {
            assertThat(
                            evaluate(
                                    Map.of("condition_type", "regex", "regex_pattern", "ch\\d+"),
                                    "see ch12 now"))
                    .isTrue();
        }

        @Test
        void shouldTreatInvalidPatternAsFalse() throws Exception {
            assertThat(evaluate(Map.of("condition_type", "regex", "regex_pattern", "(["), "(["))
                    .isFalse();
        }

        @Test
        void shouldTreatUnknownConditionTypeAsFalse() throws Exception {
            assertThat(evaluate(Map.of("condition_type", "sentiment"), "text")).isFalse();
        }
    }

    @Nested
    class AiJudge {

        private final Map<String, Object> config =
                Map.of(
                        "condition_type", "ai_judge",
                        "ai_prompt", "Is the chapter complete?",
                        "ai_provider", "openai",
                        "ai_model", "gpt-4o-mini");

        @Test
        void shouldSendDeterministicShortRequest() throws Exception {
            // Given
            List<AiRequest> requests = new ArrayList<>();
            AiInvoker ai =
                    (request, onChunk) -> {
                        requests.add(request);
                        return new AiOutcome.Success(" TRUE\n");
                    };

            // When
            boolean result =
                    evaluator.evaluate(ConditionSpec.from(NodeConfig.of(config)), "The end.", ai);

            // Then
            assertThat(result).isTrue();
            AiRequest request = requests.get(0);
            assertThat(request.temperature()).isEqualTo(0.0);
            assertThat(request.maxTokens()).isEqualTo(ConditionEvaluator.JUDGE_MAX_TOKENS);
            assertThat(request.messages().get(0).content())
                    .startsWith("Is the chapter complete?")
                    .endsWith("The end.");
        }

        @ParameterizedTest
        @CsvSource({"'true, not false', false", "'no', false", "'True.', true"})
        void shouldRequireTrueWithoutFalse(String answer, boolean expected) throws Exception {
            AiInvoker ai = (request, onChunk) -> new AiOutcome.Success(answer);

            assertThat(evaluator.evaluate(ConditionSpec.from(NodeConfig.of(config)), "x", ai))
                    .isEqualTo(expected);
        }

        @Test
        void shouldFailWhenJudgeIsMisconfigured() {
            ConditionSpec spec =
                    ConditionSpec.from(
                            NodeConfig.of(Map.of("condition_type", "ai_judge", "ai_prompt", "?")));

            assertThatThrownBy(() -> evaluator.evaluate(spec, "x", NO_AI))
                    .isInstanceOf(NodeExecutionException.class)
                    .extracting("code")
                    .isEqualTo(FailureCode.NODE_ERROR);
        }

        @Test
        void shouldFailWhenProviderFails() {
            AiInvoker ai = (request, onChunk) -> new AiOutcome.Failure("rate limited", "");

            assertThatThrownBy(
                            () ->
                                    evaluator.evaluate(
                                            ConditionSpec.from(NodeConfig.of(config)), "x", ai))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("rate limited")
                    .extracting("code")
                    .isEqualTo(FailureCode.AI_ERROR);
        }

        @Test
        void shouldReportCancellation() {
            AiInvoker ai = (request, onChunk) -> new AiOutcome.Cancelled("tr");

            assertThatThrownBy(
                            () ->
                                    evaluator.evaluate(
                                            ConditionSpec.from(NodeConfig.of(config)), "x", ai))
                    .isInstanceOf(NodeExecutionException.class)
                    .extracting("code")
                    .isEqualTo(FailureCode.CANCELLED);
        }
    }
}
