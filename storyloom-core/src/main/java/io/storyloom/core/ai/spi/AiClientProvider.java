package io.storyloom.core.ai.spi;

import io.storyloom.core.ai.AiClient;
import java.util.Map;

/// Provider interface for pluggable AI backends.
///
/// Implement this interface to route a provider key (`openai`, `claude`, `gemini`, ...)
/// to a concrete {@link AiClient}. Providers are passed to
/// {@link io.storyloom.core.StoryloomFactory.Builder#aiClientProviders(java.util.List)}, or
/// discovered from `META-INF/services/io.storyloom.core.ai.spi.AiClientProvider` when none
/// are passed explicitly.
///
/// ### Priority System
/// When multiple providers support the same provider key, the one with the highest
/// {@link #getPriority()} value is selected. The stub provider uses this to intercept
/// every call when stub mode is enabled.
///
/// @implNote Implementations should be stateless and thread-safe. A client created by a
/// provider is cached and shared by every run of the environment.
///
/// @see io.storyloom.core.ai.ProviderRoutingAiClient for provider selection
/// @see io.storyloom.core.ai.stub.StubAiClientProvider for a testing implementation
public interface AiClientProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name (e.g., "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can serve the given provider key.
    ///
    /// @param providerKey provider key of a request, e.g. `openai`, not null
    /// @return `true` if {@link #createClient(String, Map)} can serve this key
    boolean supportsProvider(String providerKey);

    /// Creates a client for one provider key.
    ///
    /// @param providerKey provider key, not null
    /// @param credentials API keys and other credentials, not null
    /// @return configured client, never null
    /// @throws IllegalStateException if required credentials are missing
    AiClient createClient(String providerKey, Map<String, String> credentials);

    /// Returns this provider's priority for provider selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
