package io.storyloom.core.ai;

import static org.assertj.core.api.Assertions.assertThat;

import io.storyloom.core.ai.stub.StubAiClient;
import io.storyloom.core.ai.stub.StubResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StreamingInvocationTest {

    private static final Duration POLL = Duration.ofMillis(20);

    private final StubAiClient client = new StubAiClient();
    private final StreamingInvocation invocation = new StreamingInvocation(client, POLL);
    private final List<String> chunks = new ArrayList<>();

    private static AiRequest request() {
        return AiRequest.builder()
                .provider("openai")
                .model("gpt-4o")
                .messages(List.of(ChatMessage.user("Write")))
                .build();
    }

    @Nested
    class Outcomes {

        @Test
        void shouldAccumulateChunksOnSuccess() {
            // Given
            client.enqueue(StubResponse.chunks("Once ", "upon ", "a time"));

            // When
            AiOutcome outcome = invocation.invoke(request(), chunks::add, () -> false);

            // Then
            assertThat(outcome).isEqualTo(new AiOutcome.Success("Once upon a time"));
            assertThat(chunks).containsExactly("Once ", "upon ", "a time");
        }

        @Test
        void shouldReportProviderError() {
            // Given
            client.enqueue(StubResponse.failure("rate limited"));

            // When
            AiOutcome outcome = invocation.invoke(request(), chunks::add, () -> false);

            // Then
            assertThat(outcome).isEqualTo(new AiOutcome.Failure("rate limited", ""));
        }

        @Test
        void shouldLetLateErrorOverrideCompletion() {
            // Given
            client.enqueue(StubResponse.completeThenFail("partial", "connection reset"));

            // When
            AiOutcome outcome = invocation.invoke(request(), chunks::add, () -> false);

            // Then
            assertThat(outcome).isInstanceOf(AiOutcome.Failure.class);
            assertThat(((AiOutcome.Failure) outcome).reason()).isEqualTo("connection reset");
            assertThat(outcome.text()).isEqualTo("partial");
        }

        @Test
        void shouldFailWhenStreamClosesWithoutCompletion() {
            // Given
            client.enqueue(StubResponse.silentClose("half a sen"));

            // When
            AiOutcome outcome = invocation.invoke(request(), chunks::add, () -> false);

            // Then
            assertThat(outcome).isInstanceOf(AiOutcome.Failure.class);
            assertThat(outcome.text()).isEqualTo("half a sen");
        }

        @Test
        void shouldFailWhenStreamCannotStart() {
            // Given
            AiClient broken =
                    (request, observer) -> {
                        throw new IllegalStateException("API key not found");
                    };

            // When
            AiOutcome outcome =
                    new StreamingInvocation(broken, POLL).invoke(request(), chunks::add, () -> false);

            // Then
            assertThat(outcome).isEqualTo(new AiOutcome.Failure("API key not found", ""));
        }
    }

    @Nested
    class Abort {

        @Test
        void shouldCancelHandleWhenAbortRequested() {
            // Given
            client.enqueue(StubResponse.hanging("The night "));
            AtomicBoolean abort = new AtomicBoolean();

            // When
            AiOutcome outcome =
                    invocation.invoke(
                            request(),
                            chunk -> {
                                chunks.add(chunk);
                                abort.set(true);
                            },
                            abort::get);

            // Then
            assertThat(outcome).isEqualTo(new AiOutcome.Cancelled("The night "));
        }

        @Test
        void shouldCancelBeforeFirstChunk() {
            // Given
            client.enqueue(StubResponse.chunks("never").withChunkDelay(Duration.ofSeconds(5)));

            // When
            AiOutcome outcome = invocation.invoke(request(), chunks::add, () -> true);

            // Then
            assertThat(outcome).isEqualTo(new AiOutcome.Cancelled(""));
            assertThat(chunks).isEmpty();
        }
    }
}
