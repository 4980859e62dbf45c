package com.questrail.foil.runtime;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.config.ExecutorKind;
import com.questrail.foil.config.ScheduleRuntimeConfig;
import com.questrail.foil.core.Schedules;
import com.questrail.foil.observability.NullObservabilitySink;
import com.questrail.foil.observability.ScheduleObservabilitySink;
import com.questrail.foil.strategy.ScheduledExecutorStrategy;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * ScheduleRuntime
 * =============================================================================
 * Composition root and lifecycle owner for an executor-backed scheduling stack.
 *
 * <p>Builds the executor named by {@link ScheduleRuntimeConfig#executorKind()},
 * wraps it in a {@link ScheduledExecutorStrategy} and hands out
 * {@link Schedules} contexts for any instant representation. Worker threads are
 * daemon threads named after {@link ScheduleRuntimeConfig#threadNamePrefix()}.</p>
 *
 * <pre>
 *   try (ScheduleRuntime runtime = ScheduleRuntime.builder().build()) {
 *       Schedules&lt;Instant&gt; schedules = runtime.schedules(JavaTime.system().instants());
 *       ...
 *   }
 * </pre>
 */
public final class ScheduleRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRuntime.class);

    private final ScheduleRuntimeConfig config;
    private final ScheduledExecutorService executor;
    private final ScheduledExecutorStrategy strategy;
    private final ScheduleObservabilitySink observabilitySink;
    private final Clock wallClock;

    private ScheduleRuntime(
            ScheduleRuntimeConfig config,
            ScheduledExecutorService executor,
            ScheduledExecutorStrategy strategy,
            ScheduleObservabilitySink observabilitySink,
            Clock wallClock) {
        this.config = config;
        this.executor = executor;
        this.strategy = strategy;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
    }

    public ScheduleRuntimeConfig config() {
        return config;
    }

    public ScheduledExecutorStrategy strategy() {
        return strategy;
    }

    /**
     * A scheduling context over this runtime's strategy for the given instant
     * representation.
     */
    public <I> Schedules<I> schedules(InstantLike<I> instants) {
        return Schedules.builder(instants)
                .withScheduler(strategy)
                .withDefaultZone(config.defaultZone())
                .withObservabilitySink(observabilitySink)
                .withWallClock(wallClock)
                .build();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting work and wait up to the configured shutdown timeout for
     * running actions, then force termination.
     */
    public void stop() {
        long timeoutMillis = config.shutdownTimeout().toMillis();

        if (executor instanceof EventExecutorGroup) {
            Future<?> termination = ((EventExecutorGroup) executor)
                    .shutdownGracefully(0, timeoutMillis, TimeUnit.MILLISECONDS);
            try {
                if (!termination.await(timeoutMillis + 1000, TimeUnit.MILLISECONDS)) {
                    log.warn("Event executor group did not terminate within {} ms", timeoutMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return;
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler did not terminate within {} ms, forcing shutdown", timeoutMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ScheduleRuntimeConfig config = ScheduleRuntimeConfig.defaults();
        private ScheduleObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock wallClock = Clock.systemUTC();

        public Builder withConfig(ScheduleRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ScheduleObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(Clock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public ScheduleRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");

            ThreadFactory threadFactory = new DefaultThreadFactory(config.threadNamePrefix(), true);
            ScheduledExecutorService executor = createExecutor(threadFactory);
            ScheduledExecutorStrategy strategy =
                    new ScheduledExecutorStrategy(executor, config.policy(), observabilitySink, wallClock);

            log.debug("Started {} scheduling runtime with {} thread(s), policy {}",
                    config.executorKind(), config.threads(), config.policy());
            return new ScheduleRuntime(config, executor, strategy, observabilitySink, wallClock);
        }

        private ScheduledExecutorService createExecutor(ThreadFactory threadFactory) {
            if (config.executorKind() == ExecutorKind.NETTY_EVENT_EXECUTOR) {
                return new DefaultEventExecutorGroup(config.threads(), threadFactory);
            }
            ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(config.threads(), threadFactory);
            // Cancelled periodic jobs are dropped from the queue straight away.
            pool.setRemoveOnCancelPolicy(true);
            return pool;
        }
    }
}
