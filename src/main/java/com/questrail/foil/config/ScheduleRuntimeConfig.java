package com.questrail.foil.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Aggregated configuration for the scheduling runtime.
 */
public record ScheduleRuntimeConfig(
    ExecutorKind executorKind,
    int threads,
    String threadNamePrefix,
    StrategyPolicy policy,
    ZoneId defaultZone,
    Duration shutdownTimeout
) {
    public ScheduleRuntimeConfig {
        Objects.requireNonNull(executorKind, "executorKind");
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(defaultZone, "defaultZone");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix must not be blank");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    public static ScheduleRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExecutorKind executorKind = ExecutorKind.JDK_SCHEDULED_POOL;
        private int threads = 1;
        private String threadNamePrefix = "foil-scheduler";
        private StrategyPolicy policy = StrategyPolicy.defaults();
        private ZoneId defaultZone = ZoneId.systemDefault();
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withExecutorKind(ExecutorKind executorKind) {
            this.executorKind = executorKind;
            return this;
        }

        public Builder withThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder withThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        public Builder withPolicy(StrategyPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withDefaultZone(ZoneId defaultZone) {
            this.defaultZone = defaultZone;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ScheduleRuntimeConfig build() {
            return new ScheduleRuntimeConfig(executorKind, threads, threadNamePrefix, policy, defaultZone, shutdownTimeout);
        }
    }
}
