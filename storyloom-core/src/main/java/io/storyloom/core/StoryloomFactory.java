package io.storyloom.core;

import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.ProviderRoutingAiClient;
import io.storyloom.core.ai.spi.AiClientProvider;
import io.storyloom.core.ai.stub.StubAiClientProvider;
import io.storyloom.core.execution.WorkflowExecutor;
import io.storyloom.core.execution.handler.DefaultNodeHandlerRegistry;
import io.storyloom.core.execution.handler.NodeHandlerRegistry;
import io.storyloom.core.execution.record.ExecutionRecorder;
import io.storyloom.core.execution.record.InMemoryExecutionRecorder;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.setting.SettingsProvider;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring Storyloom execution environments.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully-configured {@link StoryloomEnvironment} instances. Handles dependency wiring,
/// credential loading, and AI provider selection.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers**:
/// {@snippet :
/// var env = StoryloomFactory.builder()
///     .config(StoryloomConfig.builder().threadPoolSize(8).build())
///     .loadCredentials(properties)
///     .aiClientProviders(List.of(new LangChain4jAiClientProvider()))
///     .jsonCodec(new JacksonJsonCodec())
///     .build();
/// }
///
/// **Quick start with environment variables**:
/// {@snippet :
/// var env = StoryloomFactory.createEnvironment();
/// }
///
/// When no providers are passed, providers registered with
/// {@link java.util.ServiceLoader} are used. The stub provider is always added and takes
/// over every call when stub mode is enabled.
///
/// @see StoryloomEnvironment
/// @see StoryloomConfig
public final class StoryloomFactory {

    private static final Logger logger = Logger.getLogger(StoryloomFactory.class.getName());

    static final String CREDENTIALS_PREFIX = "storyloom.credentials.";

    private StoryloomFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment using default configuration and credentials discovered from
    /// environment variables.
    ///
    /// @return a fully-configured environment, never null
    /// @see #loadCredentialsFromEnvironment()
    public static StoryloomEnvironment createEnvironment() {
        return createEnvironment(new StoryloomConfig());
    }

    /// Creates an environment with custom configuration and credentials discovered from
    /// environment variables.
    ///
    /// @param config engine configuration, not null
    /// @return a fully-configured environment, never null
    public static StoryloomEnvironment createEnvironment(StoryloomConfig config) {
        return builder().config(config).build();
    }

    /// Creates an environment with custom configuration and explicit credentials.
    ///
    /// @param config engine configuration, not null
    /// @param credentials map of API keys and settings, not null (may be empty)
    /// @return a fully-configured environment, never null
    public static StoryloomEnvironment createEnvironment(
            StoryloomConfig config, Map<String, String> credentials) {
        return builder().config(config).credentials(credentials).build();
    }

    /// Discovers and loads API credentials from environment variables.
    ///
    /// Picks up variables matching common naming patterns:
    /// - `*_API_KEY` (e.g., `ANTHROPIC_API_KEY`, `OPENAI_API_KEY`)
    /// - `*_KEY`, `*_SECRET`, `*_TOKEN`
    /// - `STORYLOOM_STUB_ENABLED`
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null
                                    && !value.isEmpty()
                                    && (isApiKeyPattern(key)
                                            || key.equals(StubAiClientProvider.ENABLED_KEY))) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Loads credentials from a Properties object.
    ///
    /// Supports:
    /// - Prefixed keys (e.g., `storyloom.credentials.OPENAI_API_KEY=sk-...`), prefix stripped
    /// - Direct API key names (e.g., `OPENAI_API_KEY=sk-...`)
    /// - Stub mode setting: `storyloom.stub.enabled=true`
    ///
    /// @param properties the properties to extract credentials from, not null
    /// @return map of credential keys to their values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(CREDENTIALS_PREFIX)) {
                        credentials.put(keyStr.substring(CREDENTIALS_PREFIX.length()), valueStr);
                    } else if (keyStr.equals(StubAiClientProvider.ENABLED_PROPERTY)) {
                        credentials.put(keyStr, valueStr);
                    } else if (isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });
        return credentials;
    }

    /// Loads credentials from both environment variables and properties.
    ///
    /// Properties take precedence over environment variables when the same key exists in
    /// both sources.
    ///
    /// @param properties the properties to merge with environment credentials, not null
    /// @return merged map of credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase();
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Creates the worker pool described by the configuration.
    ///
    /// @param config engine configuration, not null
    /// @return cached pool for size `0`, fixed pool otherwise, never null
    static ExecutorService createExecutorService(StoryloomConfig config) {
        return config.getThreadPoolSize() > 0
                ? Executors.newFixedThreadPool(config.getThreadPoolSize())
                : Executors.newCachedThreadPool();
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StoryloomEnvironment} instances.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration before
    /// calling {@link #build()}.
    public static class Builder {
        private StoryloomConfig config = new StoryloomConfig();
        private Map<String, String> credentials = new HashMap<>();
        private List<AiClientProvider> aiClientProviders = new ArrayList<>();
        private AiClient aiClient;
        private NodeHandlerRegistry nodeHandlerRegistry;
        private SettingsProvider settingsProvider = SettingsProvider.EMPTY;
        private JsonCodec jsonCodec = JsonCodec.UNAVAILABLE;
        private ExecutionRecorder executionRecorder;
        private ExecutorService executorService;

        private Builder() {}

        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(StoryloomConfig config) {
            this.config = config;
            return this;
        }

        /// Adds a single credential key-value pair.
        ///
        /// @param key the credential key (e.g., `OPENAI_API_KEY`), not null
        /// @param value the credential value, not null
        /// @return this builder for chaining, never null
        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        /// @param credentials map of credential keys to values, not null
        /// @return this builder for chaining, never null
        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Sets the Anthropic API key for the `claude` provider.
        public Builder anthropicApiKey(String apiKey) {
            this.credentials.put("ANTHROPIC_API_KEY", apiKey);
            return this;
        }

        /// Sets the OpenAI API key for the `openai` provider.
        public Builder openAiApiKey(String apiKey) {
            this.credentials.put("OPENAI_API_KEY", apiKey);
            return this;
        }

        /// Sets the Google API key for the `gemini` provider.
        public Builder googleApiKey(String apiKey) {
            this.credentials.put("GOOGLE_API_KEY", apiKey);
            return this;
        }

        /// Enables or disables stub mode for testing without API calls.
        ///
        /// @param enabled `true` to answer every AI call with the stub client
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.credentials.put(StubAiClientProvider.ENABLED_PROPERTY, String.valueOf(enabled));
            return this;
        }

        /// Sets the AI client providers. The stub provider is always added; do not add it
        /// explicitly.
        ///
        /// @param providers providers, not null
        /// @return this builder for chaining, never null
        public Builder aiClientProviders(List<AiClientProvider> providers) {
            this.aiClientProviders = new ArrayList<>(providers);
            return this;
        }

        /// Adds a single AI client provider.
        public Builder aiClientProvider(AiClientProvider provider) {
            this.aiClientProviders.add(provider);
            return this;
        }

        /// Uses the given client for every AI call, bypassing provider selection.
        ///
        /// @param aiClient the client, may be null for provider-based routing
        /// @return this builder for chaining, never null
        public Builder aiClient(AiClient aiClient) {
            this.aiClient = aiClient;
            return this;
        }

        /// @param nodeHandlerRegistry the registry, may be null for the built-in handlers
        /// @return this builder for chaining, never null
        public Builder nodeHandlerRegistry(NodeHandlerRegistry nodeHandlerRegistry) {
            this.nodeHandlerRegistry = nodeHandlerRegistry;
            return this;
        }

        /// @param settingsProvider default settings library, not null
        /// @return this builder for chaining, never null
        public Builder settingsProvider(SettingsProvider settingsProvider) {
            this.settingsProvider = settingsProvider;
            return this;
        }

        /// Sets the JSON codec. Without one, `json_array` splitting, `array` merging and
        /// `json_path` extraction fail with `invalid_json`.
        ///
        /// @param jsonCodec the codec, not null
        /// @return this builder for chaining, never null
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /// @param executionRecorder the recorder, may be null for in-memory storage
        /// @return this builder for chaining, never null
        public Builder executionRecorder(ExecutionRecorder executionRecorder) {
            this.executionRecorder = executionRecorder;
            return this;
        }

        /// @param executorService the worker pool, may be null for one built from the config
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Loads credentials from environment variables matching API key patterns.
        public Builder loadCredentialsFromEnvironment() {
            this.credentials.putAll(StoryloomFactory.loadCredentialsFromEnvironment());
            return this;
        }

        /// Loads credentials from a Properties object.
        public Builder loadCredentialsFromProperties(Properties properties) {
            this.credentials.putAll(StoryloomFactory.loadCredentialsFromProperties(properties));
            return this;
        }

        /// Loads credentials from environment variables and properties, properties winning.
        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(StoryloomFactory.loadCredentials(properties));
            return this;
        }

        /// Builds and returns the configured {@link StoryloomEnvironment}.
        ///
        /// @apiNote **Side effects**:
        /// - Auto-loads environment credentials if none were explicitly provided
        /// - Creates a worker pool if none was provided
        ///
        /// @return the configured environment, never null
        public StoryloomEnvironment build() {
            if (credentials.isEmpty()) {
                credentials = StoryloomFactory.loadCredentialsFromEnvironment();
            }
            if (executorService == null) {
                executorService = createExecutorService(config);
            }
            if (aiClient == null) {
                List<AiClientProvider> providers =
                        aiClientProviders.isEmpty()
                                ? ProviderRoutingAiClient.discoverProviders()
                                : new ArrayList<>(aiClientProviders);
                providers.removeIf(StubAiClientProvider.class::isInstance);
                providers.add(StubAiClientProvider.fromCredentials(credentials));
                aiClient = new ProviderRoutingAiClient(credentials, providers);
            }
            if (nodeHandlerRegistry == null) {
                nodeHandlerRegistry = new DefaultNodeHandlerRegistry();
            }
            if (executionRecorder == null) {
                executionRecorder = new InMemoryExecutionRecorder();
            }
            if (jsonCodec == JsonCodec.UNAVAILABLE) {
                logger.warning("No JSON codec configured; JSON splitting and extraction will fail");
            }

            WorkflowExecutor workflowExecutor =
                    new WorkflowExecutor(
                            nodeHandlerRegistry,
                            aiClient,
                            settingsProvider,
                            jsonCodec,
                            executorService,
                            config);
            return new StoryloomEnvironment(
                    workflowExecutor,
                    nodeHandlerRegistry,
                    aiClient,
                    settingsProvider,
                    jsonCodec,
                    executionRecorder,
                    executorService);
        }
    }
}
