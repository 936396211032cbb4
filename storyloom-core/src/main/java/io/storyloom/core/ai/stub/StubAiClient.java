package io.storyloom.core.ai.stub;

import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.AiStreamHandle;
import io.storyloom.core.ai.AiStreamObserver;
import io.storyloom.core.ai.ChatMessage;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

/// Scripted {@link AiClient} that streams canned responses without calling a provider.
///
/// ### Response Resolution Order
/// 1. Responses queued with {@link #enqueue(StubResponse)}, first in first out
/// 2. The responder function set with {@link #respondWith(Function)}
/// 3. An echo of the last user message
///
/// Every call is played on its own daemon thread so hanging and slow scripts behave
/// like a real network stream.
///
/// @implNote Thread-safe. Parallel item-runs may share one stub.
public class StubAiClient implements AiClient {

    private static final Logger logger = Logger.getLogger(StubAiClient.class.getName());

    private final Queue<StubResponse> queued = new ConcurrentLinkedQueue<>();
    private final List<AiRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Function<AiRequest, StubResponse> responder = StubAiClient::echo;

    public StubAiClient enqueue(StubResponse response) {
        queued.add(response);
        return this;
    }

    public StubAiClient respondWith(Function<AiRequest, StubResponse> responder) {
        this.responder = responder;
        return this;
    }

    /// Returns every request received, in call order.
    public List<AiRequest> requests() {
        return List.copyOf(requests);
    }

    @Override
    public AiStreamHandle stream(AiRequest request, AiStreamObserver observer) {
        requests.add(request);
        StubResponse script = queued.poll();
        if (script == null) {
            script = responder.apply(request);
        }

        StubHandle handle = new StubHandle();
        StubResponse response = script;
        Thread player = new Thread(() -> play(response, observer, handle), "stub-ai-stream");
        player.setDaemon(true);
        player.start();
        return handle;
    }

    private void play(StubResponse script, AiStreamObserver observer, StubHandle handle) {
        try {
            for (String chunk : script.chunks()) {
                if (!script.chunkDelay().isZero()
                        && handle.cancelled.await(
                                script.chunkDelay().toMillis(), TimeUnit.MILLISECONDS)) {
                    return;
                }
                if (handle.isCancelled()) {
                    return;
                }
                observer.onDelta(chunk);
            }
            if (script.hang()) {
                handle.cancelled.await();
                return;
            }
            if (script.complete()) {
                observer.onComplete();
            }
            if (script.errorMessage() != null) {
                observer.onError(new IllegalStateException(script.errorMessage()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.fine("Stub stream interrupted");
        } finally {
            handle.open.set(false);
        }
    }

    private static StubResponse echo(AiRequest request) {
        List<ChatMessage> messages = request.messages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == ChatMessage.Role.USER) {
                return StubResponse.text(messages.get(i).content());
            }
        }
        return StubResponse.text("");
    }

    private static final class StubHandle implements AiStreamHandle {
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final CountDownLatch cancelled = new CountDownLatch(1);

        @Override
        public void cancel() {
            cancelled.countDown();
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        private boolean isCancelled() {
            return cancelled.getCount() == 0;
        }
    }
}
