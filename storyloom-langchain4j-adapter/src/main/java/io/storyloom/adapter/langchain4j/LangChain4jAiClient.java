package io.storyloom.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.AiStreamHandle;
import io.storyloom.core.ai.AiStreamObserver;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

/// {@link AiClient} backed by LangChain4j streaming chat models.
///
/// Each call converts the request into a `ChatRequest`, starts `StreamingChatModel.chat`
/// and relays partial responses as deltas. A model is built once per provider and model
/// name; sampling options travel with each request, so the cache stays as small as the set
/// of models a workflow names.
///
/// LangChain4j streams cannot be aborted mid-flight, so {@link AiStreamHandle#cancel()}
/// closes the handle and drops every later callback; the provider call runs out in the
/// background. Without a cancel, an error arriving after completion is still relayed.
///
/// @implNote Thread-safe. Concurrent item-runs may stream through one client.
public class LangChain4jAiClient implements AiClient {

    private static final Logger logger = Logger.getLogger(LangChain4jAiClient.class.getName());

    private final Function<AiRequest, StreamingChatModel> modelSource;
    private final Map<ModelKey, StreamingChatModel> models = new ConcurrentHashMap<>();

    private record ModelKey(String provider, String model) {
        static ModelKey of(AiRequest request) {
            return new ModelKey(request.provider(), request.model());
        }
    }

    /// Creates a client building models with the default factory.
    ///
    /// @param credentials API keys, not null
    public LangChain4jAiClient(Map<String, String> credentials) {
        this(new LangChain4jModelFactory(), credentials);
    }

    public LangChain4jAiClient(LangChain4jModelFactory factory, Map<String, String> credentials) {
        this(request -> factory.create(request, Map.copyOf(credentials)));
    }

    /// @param modelSource builds the model for a request, not null
    public LangChain4jAiClient(Function<AiRequest, StreamingChatModel> modelSource) {
        this.modelSource = Objects.requireNonNull(modelSource, "modelSource must not be null");
    }

    @Override
    public AiStreamHandle stream(AiRequest request, AiStreamObserver observer) {
        StreamingChatModel model =
                models.computeIfAbsent(ModelKey.of(request), key -> modelSource.apply(request));
        RelayHandle handle = new RelayHandle(observer);

        logger.fine(
                "Streaming " + request.messages().size() + " messages to " + request.provider()
                        + "/" + request.model());
        model.chat(toChatRequest(request), handle);
        return handle;
    }

    /// Builds the LangChain4j request; sampling options left null keep the provider defaults.
    static ChatRequest toChatRequest(AiRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(toMessages(request.messages()));
        if (request.temperature() != null) builder.temperature(request.temperature());
        if (request.maxTokens() != null) builder.maxOutputTokens(request.maxTokens());
        if (request.topP() != null) builder.topP(request.topP());
        return builder.build();
    }

    static List<ChatMessage> toMessages(List<io.storyloom.core.ai.ChatMessage> messages) {
        return messages.stream().map(LangChain4jAiClient::toMessage).toList();
    }

    private static ChatMessage toMessage(io.storyloom.core.ai.ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> SystemMessage.from(message.content());
            case USER -> UserMessage.from(message.content());
            case ASSISTANT -> AiMessage.from(message.content());
        };
    }

    /// Relays LangChain4j callbacks to the engine's observer.
    ///
    /// Chunks and completion stop once the handle closes. The first error is relayed unless
    /// the handle was cancelled, even when it follows completion.
    private static final class RelayHandle implements AiStreamHandle, StreamingChatResponseHandler {

        private final AiStreamObserver observer;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicBoolean errorRelayed = new AtomicBoolean();

        RelayHandle(AiStreamObserver observer) {
            this.observer = observer;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (open.get() && partialResponse != null && !partialResponse.isEmpty()) {
                observer.onDelta(partialResponse);
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse completeResponse) {
            if (open.compareAndSet(true, false)) {
                observer.onComplete();
            }
        }

        @Override
        public void onError(Throwable error) {
            if (cancelled.get() || !errorRelayed.compareAndSet(false, true)) {
                return;
            }
            open.set(false);
            logger.severe("Streaming call failed: " + error.getMessage());
            observer.onError(error);
        }

        @Override
        public void cancel() {
            cancelled.set(true);
            open.set(false);
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}
