package io.storyloom.core.execution;

import io.storyloom.core.setting.SettingsProvider;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/// Per-run inputs: run input, initial variables and overrides of environment defaults.
public final class ExecutionOptions {

    private final String executionId;
    private final String input;
    private final Map<String, String> variables;
    private final Duration timeout;
    private final SettingsProvider settingsProvider;

    private ExecutionOptions(Builder builder) {
        this.executionId =
                builder.executionId != null ? builder.executionId : UUID.randomUUID().toString();
        this.input = builder.input != null ? builder.input : "";
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.timeout = builder.timeout;
        this.settingsProvider = builder.settingsProvider;
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static ExecutionOptions withInput(String input) {
        return builder().input(input).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExecutionId() {
        return executionId;
    }

    /// Run input, empty when none was given.
    public String getInput() {
        return input;
    }

    /// Variables seeded before the start node runs.
    public Map<String, String> getVariables() {
        return variables;
    }

    /// Wall-clock budget overriding the workflow's `timeout_seconds`.
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /// Settings library overriding the environment's provider.
    public Optional<SettingsProvider> getSettingsProvider() {
        return Optional.ofNullable(settingsProvider);
    }

    public static final class Builder {
        private String executionId;
        private String input;
        private final Map<String, String> variables = new LinkedHashMap<>();
        private Duration timeout;
        private SettingsProvider settingsProvider;

        private Builder() {}

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder variable(String name, String value) {
            this.variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder settingsProvider(SettingsProvider settingsProvider) {
            this.settingsProvider = settingsProvider;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
