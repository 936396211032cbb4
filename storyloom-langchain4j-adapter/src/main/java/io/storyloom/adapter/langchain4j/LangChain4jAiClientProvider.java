package io.storyloom.adapter.langchain4j;

import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.spi.AiClientProvider;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link AiClientProvider} for the `openai`, `claude` and
/// `gemini` provider keys.
///
/// Registered in `META-INF/services`, so an environment built without explicit providers
/// picks it up from the classpath.
///
/// @implNote Stateless and thread-safe.
/// @see LangChain4jAiClient
public class LangChain4jAiClientProvider implements AiClientProvider {

    private static final Logger logger =
            Logger.getLogger(LangChain4jAiClientProvider.class.getName());

    private final LangChain4jModelFactory modelFactory;

    public LangChain4jAiClientProvider() {
        this(new LangChain4jModelFactory());
    }

    public LangChain4jAiClientProvider(LangChain4jModelFactory modelFactory) {
        this.modelFactory = modelFactory;
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsProvider(String providerKey) {
        return providerKey != null && LangChain4jModelFactory.PROVIDERS.contains(providerKey);
    }

    @Override
    public AiClient createClient(String providerKey, Map<String, String> credentials) {
        logger.info("Creating LangChain4j client for provider: " + providerKey);
        return new LangChain4jAiClient(modelFactory, credentials);
    }

    @Override
    public int getPriority() {
        return 100;
    }
}
