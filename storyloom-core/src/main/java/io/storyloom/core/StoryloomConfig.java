package io.storyloom.core;

import java.time.Duration;

/// Configuration options for the Storyloom execution environment.
///
/// Controls the worker pool used by parallel blocks and batches, and the defaults
/// applied to workflows that leave them unset.
///
/// ### Default Values
/// - `threadPoolSize`: `0` (cached pool that grows with nested parallel blocks)
/// - `defaultLoopMaxCount`: `10`
/// - `defaultTimeoutSeconds`: `300`
/// - `streamPollInterval`: `50 ms`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link StoryloomFactory}.
/// Do not modify after environment creation.
///
/// @see StoryloomFactory#createEnvironment(StoryloomConfig)
/// @see Builder
public class StoryloomConfig {
    private int threadPoolSize = 0;
    private int defaultLoopMaxCount = 10;
    private int defaultTimeoutSeconds = 300;
    private Duration streamPollInterval = Duration.ofMillis(50);

    /// Creates a configuration with default values.
    public StoryloomConfig() {}

    /// Returns the worker pool size for parallel item-runs.
    ///
    /// @return `0` for a cached pool, otherwise the fixed pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the worker pool size for parallel item-runs.
    ///
    /// A fixed pool smaller than the combined concurrency of nested parallel blocks
    /// can starve the inner blocks, so keep `0` unless the workflows are known.
    ///
    /// @param threadPoolSize `0` for a cached pool, a positive value for a fixed pool
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Returns the loop ceiling used when a workflow sets no `loop_max_count`.
    public int getDefaultLoopMaxCount() {
        return defaultLoopMaxCount;
    }

    public void setDefaultLoopMaxCount(int defaultLoopMaxCount) {
        this.defaultLoopMaxCount = defaultLoopMaxCount;
    }

    /// Returns the run timeout used when a workflow sets no `timeout_seconds`.
    ///
    /// @return timeout in seconds, `0` or less for no timeout
    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    /// Returns how long a streaming call waits for a chunk before re-checking
    /// cancellation, pause and timeout.
    ///
    /// @return the poll interval, never null
    public Duration getStreamPollInterval() {
        return streamPollInterval;
    }

    public void setStreamPollInterval(Duration streamPollInterval) {
        this.streamPollInterval = streamPollInterval;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StoryloomConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final StoryloomConfig config = new StoryloomConfig();

        /// @param threadPoolSize `0` for a cached pool, a positive value for a fixed pool
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        /// @param defaultLoopMaxCount loop ceiling for workflows without one, 1-50
        /// @return this builder for chaining, never null
        public Builder defaultLoopMaxCount(int defaultLoopMaxCount) {
            config.defaultLoopMaxCount = defaultLoopMaxCount;
            return this;
        }

        /// @param defaultTimeoutSeconds run timeout for workflows without one, `0` for none
        /// @return this builder for chaining, never null
        public Builder defaultTimeoutSeconds(int defaultTimeoutSeconds) {
            config.defaultTimeoutSeconds = defaultTimeoutSeconds;
            return this;
        }

        /// @param streamPollInterval chunk wait before abort checks, positive, not null
        /// @return this builder for chaining, never null
        public Builder streamPollInterval(Duration streamPollInterval) {
            config.streamPollInterval = streamPollInterval;
            return this;
        }

        /// Builds and returns the configured {@link StoryloomConfig} instance.
        ///
        /// @return the configured instance, never null
        public StoryloomConfig build() {
            return config;
        }
    }
}
