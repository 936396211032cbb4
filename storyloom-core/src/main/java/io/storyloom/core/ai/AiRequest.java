package io.storyloom.core.ai;

import java.util.List;
import java.util.Objects;

/// Provider-neutral chat request.
///
/// @param provider provider key such as `openai`, `claude` or `gemini`, not null
/// @param model model name, not null
/// @param messages ordered messages including any system message, not null
/// @param temperature sampling temperature, null for the provider default
/// @param maxTokens output token limit, null for the provider default
/// @param topP nucleus sampling value, null for the provider default
public record AiRequest(
        String provider,
        String model,
        List<ChatMessage> messages,
        Double temperature,
        Integer maxTokens,
        Double topP) {

    public AiRequest {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
        messages = List.copyOf(messages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String provider;
        private String model;
        private List<ChatMessage> messages = List.of();
        private Double temperature;
        private Integer maxTokens;
        private Double topP;

        private Builder() {}

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages = messages;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public AiRequest build() {
            return new AiRequest(provider, model, messages, temperature, maxTokens, topP);
        }
    }
}
