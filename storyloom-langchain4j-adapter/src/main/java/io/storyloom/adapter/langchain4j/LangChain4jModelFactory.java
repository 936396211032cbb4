package io.storyloom.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import io.storyloom.core.ai.AiRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Builds LangChain4j streaming chat models for the supported provider keys.
///
/// | Provider key | Model | Credentials |
/// |--------------|-------|-------------|
/// | `openai` | `OpenAiStreamingChatModel` | `OPENAI_API_KEY`, optional `OPENAI_BASE_URL` |
/// | `claude` | `AnthropicStreamingChatModel` | `ANTHROPIC_API_KEY` |
/// | `gemini` | `GoogleAiGeminiStreamingChatModel` | `GOOGLE_API_KEY` |
///
/// Models carry no sampling options; {@link LangChain4jAiClient} sends temperature, max
/// tokens and top-p with each request.
///
/// @implNote Stateless and thread-safe.
public class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    public static final String OPENAI = "openai";
    public static final String CLAUDE = "claude";
    public static final String GEMINI = "gemini";

    static final Set<String> PROVIDERS = Set.of(OPENAI, CLAUDE, GEMINI);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final Duration timeout;

    public LangChain4jModelFactory() {
        this(DEFAULT_TIMEOUT);
    }

    /// @param timeout per-call HTTP timeout, not null
    public LangChain4jModelFactory(Duration timeout) {
        this.timeout = timeout;
    }

    /// Creates a model for the request's provider and model name.
    ///
    /// @param request request whose provider and model select the model, not null
    /// @param credentials API keys, not null
    /// @return configured model, never null
    /// @throws IllegalArgumentException if the provider key is not supported
    /// @throws IllegalStateException if the provider's API key is missing
    public StreamingChatModel create(AiRequest request, Map<String, String> credentials) {
        logger.fine("Creating " + request.provider() + " model " + request.model());
        return switch (request.provider()) {
            case OPENAI -> createOpenAiModel(request, credentials);
            case CLAUDE -> createAnthropicModel(request, credentials);
            case GEMINI -> createGeminiModel(request, credentials);
            default ->
                    throw new IllegalArgumentException(
                            "Unsupported provider: " + request.provider());
        };
    }

    private StreamingChatModel createOpenAiModel(
            AiRequest request, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");

        var builder =
                OpenAiStreamingChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(request.model())
                        .timeout(timeout);

        String baseUrl = credentials.get("OPENAI_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) builder.baseUrl(baseUrl);

        return builder.build();
    }

    private StreamingChatModel createAnthropicModel(
            AiRequest request, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY");

        return AnthropicStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(request.model())
                .timeout(timeout)
                .build();
    }

    private StreamingChatModel createGeminiModel(
            AiRequest request, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY");

        return GoogleAiGeminiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(request.model())
                .timeout(timeout)
                .build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
