package com.questrail.foil.core;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.api.NanoScheduler;
import com.questrail.foil.observability.SubmissionKind;
import com.questrail.foil.time.Interval;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A periodic invocation waiting for its period. Obtained from a
 * {@link Schedule}; nothing is submitted until {@link #thenEvery(Interval)} or
 * {@link #thenEveryNanos(long)} is called.
 */
public final class RepeatingSchedule<I> {

    private final Schedules<I> context;
    private final Runnable action;
    private final I firstInvocation;

    RepeatingSchedule(Schedules<I> context, Runnable action, I firstInvocation) {
        this.context = context;
        this.action = action;
        this.firstInvocation = firstInvocation;
    }

    /**
     * Instant of the first invocation, empty when it happens on submission.
     */
    public Optional<I> firstInvocation() {
        return Optional.ofNullable(firstInvocation);
    }

    /**
     * Submit the periodic job. The period is handed to the strategy in
     * milliseconds, or in its own unit when that is finer.
     *
     * @throws InvalidScheduleException if the period is not positive in that unit
     */
    public LimitedScheduledFuture<I> thenEvery(Interval period) {
        Objects.requireNonNull(period, "period");
        TimeUnit unit = Schedules.submissionUnit(period.unit());
        long periodInUnit = period.as(unit).duration();
        if (periodInUnit <= 0) {
            throw new InvalidScheduleException("period must be positive: " + period);
        }

        Interval initialDelay = initialDelay(unit);
        ScheduledFuture<?> future = context.scheduler()
                .schedule(action, initialDelay.duration(), periodInUnit, unit);

        context.reportSubmitted(SubmissionKind.PERIODIC, initialDelay, Interval.of(periodInUnit, unit));
        return context.limit(future);
    }

    public LimitedScheduledFuture<I> withPeriod(Interval period) {
        return thenEvery(period);
    }

    /**
     * Submit the periodic job through the configured {@link NanoScheduler}, with
     * the initial delay computed at the capability's nanosecond precision.
     *
     * @throws InvalidScheduleException if {@code periodNanos} is not positive
     * @throws IllegalStateException    if no nanosecond strategy is available
     */
    public LimitedScheduledFuture<I> thenEveryNanos(long periodNanos) {
        if (periodNanos <= 0) {
            throw new InvalidScheduleException("period must be positive: " + periodNanos + " ns");
        }
        NanoScheduler nanoScheduler = context.nanoScheduler()
                .orElseThrow(() -> new IllegalStateException("No NanoScheduler configured"));

        Interval initialDelay = initialDelay(TimeUnit.NANOSECONDS);
        ScheduledFuture<?> future = nanoScheduler.schedule(action, initialDelay.duration(), periodNanos);

        context.reportSubmitted(SubmissionKind.PERIODIC_NANOS, initialDelay, Interval.nanos(periodNanos));
        return context.limit(future);
    }

    private Interval initialDelay(TimeUnit unit) {
        if (firstInvocation == null) {
            return Interval.of(0, unit);
        }
        InstantLike<I> instants = context.instants();
        return instants.delay(instants.now(), firstInvocation, unit).as(unit);
    }
}
