package io.storyloom.core.ai;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// Drives one {@link AiClient} stream from the calling thread.
///
/// Observer callbacks are queued and consumed here, so chunk delivery, abort checks and
/// the terminal decision all happen on the caller's thread.
///
/// ### Outcome rules
/// - abort requested at any chunk boundary: cancel the handle, {@link AiOutcome.Cancelled}
/// - error reported, even after completion: {@link AiOutcome.Failure}
/// - completion without error: {@link AiOutcome.Success}
/// - stream no longer open and nothing left to read: {@link AiOutcome.Failure}
public class StreamingInvocation {

    private static final Logger logger = Logger.getLogger(StreamingInvocation.class.getName());

    private final AiClient client;
    private final Duration pollInterval;

    /// @param client provider boundary, not null
    /// @param pollInterval how long to wait for a chunk before re-checking abort, positive
    public StreamingInvocation(AiClient client, Duration pollInterval) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    }

    /// Streams a request until it reaches a terminal outcome.
    ///
    /// @param request request to send, not null
    /// @param onChunk receives each delta, not null
    /// @param abortRequested polled between chunks; true cancels the call, not null
    /// @return merged outcome, never null
    public AiOutcome invoke(
            AiRequest request, Consumer<String> onChunk, BooleanSupplier abortRequested) {
        BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
        AiStreamHandle handle;
        try {
            handle = client.stream(request, new QueueingObserver(signals));
        } catch (RuntimeException e) {
            logger.severe("AI call to " + request.provider() + " failed to start: " + e.getMessage());
            return new AiOutcome.Failure(describe(e), "");
        }

        StringBuilder text = new StringBuilder();
        boolean completed = false;
        boolean graceUsed = false;
        try {
            while (true) {
                if (abortRequested.getAsBoolean()) {
                    handle.cancel();
                    return new AiOutcome.Cancelled(text.toString());
                }

                Signal signal = signals.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (completed && signal == null) {
                    // A late error overrides completion; wait one interval for the close
                    if (handle.isOpen() && !graceUsed) {
                        graceUsed = true;
                        continue;
                    }
                    signal = signals.poll();
                    if (signal == null) {
                        return new AiOutcome.Success(text.toString());
                    }
                }

                if (signal == null) {
                    if (!handle.isOpen() && signals.isEmpty()) {
                        return new AiOutcome.Failure(
                                "AI stream closed without a response", text.toString());
                    }
                    continue;
                }

                if (signal instanceof Delta delta) {
                    text.append(delta.text());
                    onChunk.accept(delta.text());
                } else if (signal instanceof Failed failed) {
                    logger.severe(
                            "AI call to " + request.provider() + " failed: " + failed.reason());
                    return new AiOutcome.Failure(failed.reason(), text.toString());
                } else {
                    completed = true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            return new AiOutcome.Cancelled(text.toString());
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private sealed interface Signal permits Delta, Complete, Failed {}

    private record Delta(String text) implements Signal {}

    private record Complete() implements Signal {}

    private record Failed(String reason) implements Signal {}

    private record QueueingObserver(BlockingQueue<Signal> signals) implements AiStreamObserver {

        @Override
        public void onDelta(String text) {
            if (text != null && !text.isEmpty()) {
                signals.add(new Delta(text));
            }
        }

        @Override
        public void onComplete() {
            signals.add(new Complete());
        }

        @Override
        public void onError(Throwable error) {
            signals.add(new Failed(describe(error)));
        }
    }
}
