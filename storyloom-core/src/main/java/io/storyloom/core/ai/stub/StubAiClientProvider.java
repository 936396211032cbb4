package io.storyloom.core.ai.stub;

import io.storyloom.core.ai.AiClient;
import io.storyloom.core.ai.spi.AiClientProvider;
import java.util.Map;
import java.util.logging.Logger;

/// AI client provider that answers every provider key with a {@link StubAiClient}.
///
/// ### Enabling Stub Mode
/// Enable via any of these, checked in order:
/// - Credentials map: `storyloom.stub.enabled=true` or `STORYLOOM_STUB_ENABLED=true`
/// - System property: `-Dstoryloom.stub.enabled=true`
/// - Environment variable: `STORYLOOM_STUB_ENABLED=true`
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all provider keys)
/// - When disabled: priority -1 (never selected)
///
/// @implNote Thread-safe. All provider keys share the one stub client.
public class StubAiClientProvider implements AiClientProvider {

    private static final Logger logger = Logger.getLogger(StubAiClientProvider.class.getName());

    public static final String ENABLED_KEY = "STORYLOOM_STUB_ENABLED";
    public static final String ENABLED_PROPERTY = "storyloom.stub.enabled";

    private final StubAiClient client;
    private final boolean enabled;

    /// Creates a provider whose enablement comes from the system property or environment.
    public StubAiClientProvider() {
        this(new StubAiClient(), isEnabledGlobally());
    }

    /// @param client stub that serves every call, not null
    /// @param enabled whether the stub intercepts provider keys
    public StubAiClientProvider(StubAiClient client, boolean enabled) {
        this.client = client;
        this.enabled = enabled;
    }

    /// Creates a provider honouring a credentials override before the global settings.
    ///
    /// @param credentials map possibly holding an enable flag, not null
    /// @return provider, never null
    public static StubAiClientProvider fromCredentials(Map<String, String> credentials) {
        String value = credentials.get(ENABLED_PROPERTY);
        if (value == null) {
            value = credentials.get(ENABLED_KEY);
        }
        boolean enabled = value != null ? "true".equalsIgnoreCase(value) : isEnabledGlobally();
        return new StubAiClientProvider(new StubAiClient(), enabled);
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsProvider(String providerKey) {
        return enabled;
    }

    @Override
    public AiClient createClient(String providerKey, Map<String, String> credentials) {
        if (!enabled) {
            throw new IllegalStateException("Stub provider called but not enabled");
        }
        logger.info("[STUB] Serving provider '" + providerKey + "' with the stub client");
        return client;
    }

    /// @return 1000 when enabled, -1 when disabled
    @Override
    public int getPriority() {
        return enabled ? 1000 : -1;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /// Stub client shared by every provider key, for scripting responses in tests.
    public StubAiClient getClient() {
        return client;
    }

    private static boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }
}
