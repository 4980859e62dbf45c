package com.questrail.foil.strategy;

import com.questrail.foil.api.NanoScheduler;
import com.questrail.foil.api.Scheduler;
import com.questrail.foil.config.FailureMode;
import com.questrail.foil.config.PeriodicMode;
import com.questrail.foil.config.StrategyPolicy;
import com.questrail.foil.observability.InvocationFailureEvent;
import com.questrail.foil.observability.NullObservabilitySink;
import com.questrail.foil.observability.ScheduleObservabilitySink;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorStrategy
 * =============================================================================
 * Production {@link Scheduler} and {@link NanoScheduler} backed by a
 * {@link ScheduledExecutorService}. Any implementation works, including a Netty
 * {@code EventExecutorGroup}.
 *
 * <h2>Policy</h2>
 * <p>Periodic jobs run at fixed rate or with fixed delay according to the
 * {@link StrategyPolicy}. A run that throws is reported to the observability
 * sink; with {@link FailureMode#SUPPRESS_FURTHER} the exception is rethrown so
 * the executor stops the job, with {@link FailureMode#CONTINUE} the job keeps
 * running. Negative delays are clamped to zero.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own or manage the lifecycle of the
 * provided executor. Callers are responsible for shutdown.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe if the underlying executor is (the case for the JDK and Netty
 * implementations).</p>
 */
public final class ScheduledExecutorStrategy implements Scheduler, NanoScheduler {

    private final ScheduledExecutorService executor;
    private final StrategyPolicy policy;
    private final ScheduleObservabilitySink observabilitySink;
    private final Clock wallClock;

    public ScheduledExecutorStrategy(ScheduledExecutorService executor) {
        this(executor, StrategyPolicy.defaults(), NullObservabilitySink.INSTANCE);
    }

    public ScheduledExecutorStrategy(ScheduledExecutorService executor,
                                     StrategyPolicy policy,
                                     ScheduleObservabilitySink observabilitySink) {
        this(executor, policy, observabilitySink, Clock.systemUTC());
    }

    /**
     * @param wallClock clock stamping failure events, never used for timing
     */
    public ScheduledExecutorStrategy(ScheduledExecutorService executor,
                                     StrategyPolicy policy,
                                     ScheduleObservabilitySink observabilitySink,
                                     Clock wallClock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public StrategyPolicy policy() {
        return policy;
    }

    @Override
    public void execute(Runnable action) {
        Objects.requireNonNull(action, "action");
        executor.execute(reporting(action, false));
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable action, long delay, TimeUnit unit) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(unit, "unit");
        return executor.schedule(reporting(action, false), Math.max(0, delay), unit);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable action, long delay, long period, TimeUnit unit) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(unit, "unit");
        Runnable task = reporting(action, policy.failureMode() == FailureMode.CONTINUE);
        long initialDelay = Math.max(0, delay);

        if (policy.periodicMode() == PeriodicMode.FIXED_DELAY) {
            return executor.scheduleWithFixedDelay(task, initialDelay, period, unit);
        }
        return executor.scheduleAtFixedRate(task, initialDelay, period, unit);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable action, long delayNanos) {
        return schedule(action, delayNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable action, long delayNanos, long periodNanos) {
        return schedule(action, delayNanos, periodNanos, TimeUnit.NANOSECONDS);
    }

    private Runnable reporting(Runnable action, boolean continueOnFailure) {
        return () -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                observabilitySink.onInvocationFailed(new InvocationFailureEvent(
                        wallClock.instant(),
                        String.valueOf(e.getMessage()),
                        e,
                        continueOnFailure));
                if (!continueOnFailure) {
                    throw e;
                }
            }
        };
    }
}
