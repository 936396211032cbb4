package io.storyloom.core.ai;

import io.storyloom.core.ai.spi.AiClientProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// {@link AiClient} that dispatches each request to a client chosen by its provider key.
///
/// For every provider key the highest-priority {@link AiClientProvider} that supports it
/// creates a client once; later requests for the same key reuse it.
///
/// ### Provider Discovery
/// Providers are either passed explicitly or loaded with {@link ServiceLoader} from
/// `META-INF/services/io.storyloom.core.ai.spi.AiClientProvider`.
///
/// @implNote Thread-safe after construction. Provider list and credentials are immutable
/// once the client is created.
public class ProviderRoutingAiClient implements AiClient {

    private static final Logger logger = Logger.getLogger(ProviderRoutingAiClient.class.getName());

    private final List<AiClientProvider> providers;
    private final Map<String, String> credentials;
    private final Map<String, AiClient> clients = new ConcurrentHashMap<>();

    /// @param credentials map of credential keys to values (e.g., `OPENAI_API_KEY`), not null
    /// @param providers providers to choose from, not null
    public ProviderRoutingAiClient(
            Map<String, String> credentials, List<AiClientProvider> providers) {
        this.credentials = Collections.unmodifiableMap(new HashMap<>(credentials));
        this.providers = List.copyOf(providers);

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " AI client providers: "
                        + this.providers.stream().map(AiClientProvider::getName).toList());
    }

    /// Loads all providers registered with {@link ServiceLoader}.
    ///
    /// @return discovered providers, may be empty, never null
    public static List<AiClientProvider> discoverProviders() {
        List<AiClientProvider> discovered = new ArrayList<>();
        for (AiClientProvider provider : ServiceLoader.load(AiClientProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered provider: " + provider.getName());
        }
        return discovered;
    }

    /// @throws IllegalStateException if no provider supports the request's provider key
    @Override
    public AiStreamHandle stream(AiRequest request, AiStreamObserver observer) {
        return clients.computeIfAbsent(request.provider(), this::createClient)
                .stream(request, observer);
    }

    /// Returns an unmodifiable view of all providers.
    ///
    /// @return list of available providers, never null
    public List<AiClientProvider> getProviders() {
        return providers;
    }

    /// Checks if any provider supports the given provider key.
    public boolean isProviderSupported(String providerKey) {
        return providers.stream().anyMatch(p -> p.supportsProvider(providerKey));
    }

    private AiClient createClient(String providerKey) {
        AiClientProvider provider =
                providers.stream()
                        .filter(p -> p.supportsProvider(providerKey))
                        .max(Comparator.comparingInt(AiClientProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No AI client provider for: "
                                                        + providerKey
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(AiClientProvider::getName)
                                                                .toList()));

        logger.info(
                "Creating AI client for '" + providerKey + "' with provider: "
                        + provider.getName());
        return provider.createClient(providerKey, credentials);
    }
}
