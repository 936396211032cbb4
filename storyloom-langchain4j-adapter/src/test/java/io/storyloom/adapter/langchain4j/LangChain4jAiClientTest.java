package io.storyloom.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.AiStreamHandle;
import io.storyloom.core.ai.AiStreamObserver;
import io.storyloom.core.ai.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jAiClientTest {

    @Mock private StreamingChatModel model;
    @Mock private AiStreamObserver observer;

    private final AtomicInteger modelsBuilt = new AtomicInteger();
    private final AtomicReference<StreamingChatResponseHandler> handlerRef =
            new AtomicReference<>();
    private final List<ChatRequest> sent = new ArrayList<>();
    private LangChain4jAiClient client;

    @BeforeEach
    void setUp() {
        client =
                new LangChain4jAiClient(
                        request -> {
                            modelsBuilt.incrementAndGet();
                            return model;
                        });
    }

    private static AiRequest request(String model, Double temperature) {
        return AiRequest.builder()
                .provider("openai")
                .model(model)
                .messages(
                        List.of(
                                ChatMessage.system("You are a novelist."),
                                ChatMessage.user("Write an opening line.")))
                .temperature(temperature)
                .build();
    }

    private void captureHandler() {
        doAnswer(
                        invocation -> {
                            sent.add(invocation.getArgument(0));
                            handlerRef.set(invocation.getArgument(1));
                            return null;
                        })
                .when(model)
                .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
    }

    @Nested
    class Streaming {

        @Test
        void shouldRelayPartialResponsesAndCompletion() {
            // Given
            captureHandler();

            // When
            AiStreamHandle handle = client.stream(request("gpt-4o", 0.7), observer);
            handlerRef.get().onPartialResponse("It was ");
            handlerRef.get().onPartialResponse("a dark night.");
            handlerRef.get().onCompleteResponse(null);

            // Then
            verify(observer).onDelta("It was ");
            verify(observer).onDelta("a dark night.");
            verify(observer).onComplete();
            assertThat(handle.isOpen()).isFalse();
        }

        @Test
        void shouldRelayErrorOnce() {
            // Given
            captureHandler();
            RuntimeException failure = new RuntimeException("rate limited");

            // When
            client.stream(request("gpt-4o", null), observer);
            handlerRef.get().onError(failure);
            handlerRef.get().onCompleteResponse(null);

            // Then
            verify(observer).onError(failure);
            verify(observer, never()).onComplete();
        }

        @Test
        void shouldRelayErrorArrivingAfterCompletion() {
            // Given
            captureHandler();
            RuntimeException failure = new RuntimeException("content filtered");

            // When
            AiStreamHandle handle = client.stream(request("gpt-4o", null), observer);
            handlerRef.get().onPartialResponse("It was ");
            handlerRef.get().onCompleteResponse(null);
            handlerRef.get().onError(failure);
            handlerRef.get().onError(new RuntimeException("second"));

            // Then
            verify(observer).onComplete();
            verify(observer, times(1)).onError(any());
            verify(observer).onError(failure);
            assertThat(handle.isOpen()).isFalse();
        }

        @Test
        void shouldDropErrorAfterCancel() {
            // Given
            captureHandler();

            // When
            AiStreamHandle handle = client.stream(request("gpt-4o", null), observer);
            handle.cancel();
            handlerRef.get().onError(new RuntimeException("connection reset"));

            // Then
            verify(observer, never()).onError(any());
        }

        @Test
        void shouldDropCallbacksAfterCancel() {
            // Given
            captureHandler();

            // When
            AiStreamHandle handle = client.stream(request("gpt-4o", null), observer);
            assertThat(handle.isOpen()).isTrue();
            handle.cancel();
            handlerRef.get().onPartialResponse("late chunk");
            handlerRef.get().onCompleteResponse(null);

            // Then
            assertThat(handle.isOpen()).isFalse();
            verify(observer, never()).onDelta(any());
            verify(observer, never()).onComplete();
        }

        @Test
        void shouldIgnoreEmptyPartialResponses() {
            // Given
            captureHandler();

            // When
            client.stream(request("gpt-4o", null), observer);
            handlerRef.get().onPartialResponse("");

            // Then
            verify(observer, never()).onDelta(any());
        }

        @Test
        void shouldPropagateSynchronousStartFailure() {
            // Given
            doThrow(new IllegalStateException("API key not found"))
                    .when(model)
                    .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

            // When / Then
            assertThatThrownBy(() -> client.stream(request("gpt-4o", null), observer))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("API key");
        }
    }

    @Nested
    class ModelCache {

        @Test
        void shouldReuseModelAcrossSamplingOptions() {
            // Given
            captureHandler();

            // When
            for (int i = 0; i < 20; i++) {
                client.stream(request("gpt-4o", i / 20.0), observer);
            }

            // Then
            assertThat(modelsBuilt).hasValue(1);
            assertThat(sent)
                    .extracting(ChatRequest::temperature)
                    .hasSize(20)
                    .doesNotHaveDuplicates();
        }

        @Test
        void shouldBuildSeparateModelPerModelName() {
            // Given
            captureHandler();

            // When
            client.stream(request("gpt-4o", 0.7), observer);
            client.stream(request("gpt-4o", 0.2), observer);
            client.stream(request("gpt-4o-mini", 0.7), observer);

            // Then
            assertThat(modelsBuilt).hasValue(2);
        }

        @Test
        void shouldSendSamplingOptionsWithEachRequest() {
            // Given
            captureHandler();
            AiRequest request =
                    AiRequest.builder()
                            .provider("openai")
                            .model("gpt-4o")
                            .messages(List.of(ChatMessage.user("Write an opening line.")))
                            .temperature(0.3)
                            .maxTokens(256)
                            .topP(0.8)
                            .build();

            // When
            client.stream(request, observer);
            client.stream(request("gpt-4o", null), observer);

            // Then
            ChatRequest tuned = sent.get(0);
            assertThat(tuned.temperature()).isEqualTo(0.3);
            assertThat(tuned.maxOutputTokens()).isEqualTo(256);
            assertThat(tuned.topP()).isEqualTo(0.8);
            assertThat(tuned.messages()).hasSize(1);
            assertThat(sent.get(1).temperature()).isNull();
        }
    }

    @Nested
    class MessageConversion {

        @Test
        void shouldMapRolesToLangChain4jMessages() {
            // When
            var converted =
                    LangChain4jAiClient.toMessages(
                            List.of(
                                    ChatMessage.system("rules"),
                                    ChatMessage.user("question"),
                                    ChatMessage.assistant("answer")));

            // Then
            assertThat(converted).hasSize(3);
            assertThat(converted.get(0)).isInstanceOf(SystemMessage.class);
            assertThat(((SystemMessage) converted.get(0)).text()).isEqualTo("rules");
            assertThat(converted.get(1)).isInstanceOf(UserMessage.class);
            assertThat(((UserMessage) converted.get(1)).singleText()).isEqualTo("question");
            assertThat(converted.get(2)).isInstanceOf(AiMessage.class);
            assertThat(((AiMessage) converted.get(2)).text()).isEqualTo("answer");
        }

        @Test
        void shouldKeepMessageOrder() {
            // Given
            List<ChatMessage> messages = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                messages.add(ChatMessage.user("m" + i));
            }

            // When
            var converted = LangChain4jAiClient.toMessages(messages);

            // Then
            assertThat(converted)
                    .extracting(message -> ((UserMessage) message).singleText())
                    .containsExactly("m0", "m1", "m2", "m3", "m4");
        }
    }
}
