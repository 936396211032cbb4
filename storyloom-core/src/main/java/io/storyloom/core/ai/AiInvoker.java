package io.storyloom.core.ai;

import java.util.function.Consumer;

/// Run-bound entry point handlers use to call the AI provider.
///
/// Implementations apply the run's cancellation and timeout checks at every chunk.
@FunctionalInterface
public interface AiInvoker {

    /// Performs one streaming call and blocks until it reaches a terminal outcome.
    ///
    /// @param request request to send, not null
    /// @param onChunk receives every text delta in arrival order, not null
    /// @return merged outcome, never null
    AiOutcome invoke(AiRequest request, Consumer<String> onChunk);
}
