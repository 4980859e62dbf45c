package com.questrail.foil.core;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.api.TimeLike;
import com.questrail.foil.api.ZonedTimeLike;
import com.questrail.foil.observability.CancellationScheduledEvent;
import com.questrail.foil.observability.ScheduleCancelledEvent;
import com.questrail.foil.observability.SubmissionKind;
import com.questrail.foil.time.Interval;

import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * LimitedScheduledFuture
 * =============================================================================
 * View over a submitted periodic handle which can bound it by a future instant
 * or a total duration.
 *
 * <pre>
 *   schedules.schedule(task).immediatelyThenEvery(Interval.seconds(5))
 *           .forTheNext(Interval.minutes(2));
 * </pre>
 *
 * <h2>Cancellation</h2>
 * <p>{@code until*} and {@link #forTheNext(Interval)} never cancel
 * synchronously. They submit an independent one-shot job which calls
 * {@code cancel(false)} on the wrapped handle, so an invocation already in
 * progress completes and no further invocation starts. The wrapped handle is
 * returned unchanged.</p>
 */
public final class LimitedScheduledFuture<I> {

    private final ScheduledFuture<?> future;
    private final Schedules<I> context;

    LimitedScheduledFuture(ScheduledFuture<?> future, Schedules<I> context) {
        this.future = Objects.requireNonNull(future, "future");
        this.context = Objects.requireNonNull(context, "context");
    }

    public ScheduledFuture<?> future() {
        return future;
    }

    /**
     * Instant of the first invocation, empty if it has already begun.
     */
    public Optional<I> startTime() {
        return startTime(context.instants());
    }

    /**
     * Instant of the first invocation in another instant representation.
     */
    public <X> Optional<X> startTime(InstantLike<X> instants) {
        Objects.requireNonNull(instants, "instants");
        long remaining = future.getDelay(TimeUnit.MILLISECONDS);
        if (remaining <= 0) {
            return Optional.empty();
        }
        return Optional.of(Interval.millis(remaining).after(instants.now(), instants));
    }

    /**
     * Remaining delay until the first invocation, empty if it has already begun.
     */
    public Optional<Interval> delay(TimeUnit unit) {
        Objects.requireNonNull(unit, "unit");
        long remaining = future.getDelay(unit);
        if (remaining <= 0) {
            return Optional.empty();
        }
        return Optional.of(Interval.of(remaining, unit));
    }

    /**
     * Cancel the wrapped handle at {@code instant}. The delay is computed in
     * milliseconds, as for {@link Schedule#onceAt(Object)}.
     */
    public ScheduledFuture<?> until(I instant) {
        Objects.requireNonNull(instant, "instant");
        InstantLike<I> instants = context.instants();
        return cancelIn(instants.delay(instants.now(), instant, TimeUnit.MILLISECONDS));
    }

    public <T> ScheduledFuture<?> untilNext(T time, ZoneId zone, TimeLike<T, ?, I> times) {
        return until(Schedule.next(time, zone, times));
    }

    public <T> ScheduledFuture<?> untilNext(T time, TimeLike<T, ?, I> times) {
        return untilNext(time, context.defaultZone(), times);
    }

    public <Z> ScheduledFuture<?> untilNextZoned(Z time, ZonedTimeLike<Z, ?, I> times) {
        Objects.requireNonNull(times, "times");
        return untilNext(time, times.zone(time), times);
    }

    /**
     * Cancel the wrapped handle {@code interval} after its first invocation.
     * A handle that has not started yet keeps its full window. The cancellation
     * is submitted in the interval's own unit when it is finer than
     * milliseconds.
     */
    public ScheduledFuture<?> forTheNext(Interval interval) {
        Objects.requireNonNull(interval, "interval");
        TimeUnit unit = Schedules.submissionUnit(interval.unit());
        long toStart = delay(unit).map(Interval::duration).orElse(0L);
        return cancelIn(Interval.of(toStart + interval.as(unit).duration(), unit));
    }

    private ScheduledFuture<?> cancelIn(Interval delay) {
        context.scheduler().schedule(this::cancelWrapped, delay.duration(), delay.unit());
        context.reportSubmitted(SubmissionKind.ONE_SHOT, delay, null);
        context.observabilitySink().onCancellationScheduled(
                new CancellationScheduledEvent(context.observedAt(), delay));
        return future;
    }

    private void cancelWrapped() {
        boolean cancelled = future.cancel(false);
        context.observabilitySink().onCancelled(new ScheduleCancelledEvent(context.observedAt(), cancelled));
    }

    @Override
    public String toString() {
        return "LimitedScheduledFuture[" + future + "]";
    }
}
