package io.storyloom.core.ai.stub;

import java.time.Duration;
import java.util.List;

/// Scripted behaviour for one {@link StubAiClient} call.
///
/// @param chunks deltas emitted in order, never null
/// @param errorMessage error reported after the chunks, or null
/// @param complete whether to signal completion after the chunks
/// @param hang whether to keep the stream open until cancelled
/// @param chunkDelay pause before each chunk, never null
public record StubResponse(
        List<String> chunks,
        String errorMessage,
        boolean complete,
        boolean hang,
        Duration chunkDelay) {

    public StubResponse {
        chunks = List.copyOf(chunks);
        chunkDelay = chunkDelay != null ? chunkDelay : Duration.ZERO;
    }

    /// Streams `text` as a single chunk and completes.
    public static StubResponse text(String text) {
        return new StubResponse(List.of(text), null, true, false, Duration.ZERO);
    }

    /// Streams each chunk and completes.
    public static StubResponse chunks(String... chunks) {
        return new StubResponse(List.of(chunks), null, true, false, Duration.ZERO);
    }

    /// Reports an error without emitting text.
    public static StubResponse failure(String message) {
        return new StubResponse(List.of(), message, false, false, Duration.ZERO);
    }

    /// Completes normally, then reports an error on the side channel.
    public static StubResponse completeThenFail(String text, String message) {
        return new StubResponse(List.of(text), message, true, false, Duration.ZERO);
    }

    /// Emits the chunks, then closes without completing or failing.
    public static StubResponse silentClose(String... chunks) {
        return new StubResponse(List.of(chunks), null, false, false, Duration.ZERO);
    }

    /// Emits the chunks, then keeps the stream open until it is cancelled.
    public static StubResponse hanging(String... chunks) {
        return new StubResponse(List.of(chunks), null, false, true, Duration.ZERO);
    }

    public StubResponse withChunkDelay(Duration delay) {
        return new StubResponse(chunks, errorMessage, complete, hang, delay);
    }
}
