package io.storyloom.core.ai;

/// Boundary to the AI provider. Implementations live outside the engine core.
///
/// @see io.storyloom.core.ai.stub.StubAiClient for a scripted test implementation
public interface AiClient {

    /// Starts a streaming call and returns immediately.
    ///
    /// @param request provider, model, messages and sampling options, not null
    /// @param observer receives chunks and the terminal signal, not null
    /// @return handle for cancellation and liveness checks, never null
    AiStreamHandle stream(AiRequest request, AiStreamObserver observer);
}
