package io.storyloom.core.ai;

/// Callbacks delivered by an {@link AiClient} while a response streams in.
///
/// A well-behaved client calls {@link #onDelta} zero or more times, then exactly one of
/// {@link #onComplete} or {@link #onError}. Callers must tolerate clients that close the
/// stream without either, and clients that report an error after completing.
///
/// @implNote Callbacks may arrive on any thread.
public interface AiStreamObserver {

    void onDelta(String text);

    void onComplete();

    void onError(Throwable error);
}
