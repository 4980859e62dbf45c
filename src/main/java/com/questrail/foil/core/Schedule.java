package com.questrail.foil.core;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.api.TimeLike;
import com.questrail.foil.api.ZonedTimeLike;
import com.questrail.foil.observability.SubmissionKind;
import com.questrail.foil.time.Interval;

import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Schedule
 * =============================================================================
 * Holder for one deferred action, the start of every DSL chain.
 *
 * <h2>Transitions</h2>
 * <ul>
 *   <li>{@link #now()}, {@code onceAt*}, {@code onceIn} and {@code dailyAt*}
 *       submit immediately and end the chain.</li>
 *   <li>{@link #immediately()} and {@code startingAt*}/{@code startingIn} return
 *       a {@link RepeatingSchedule}, which submits once given a period.</li>
 * </ul>
 *
 * <p>The action is captured once; the same {@link Runnable} instance is handed
 * to the strategy for every firing.</p>
 */
public final class Schedule<I> {

    private final Schedules<I> context;
    private final Runnable action;

    Schedule(Schedules<I> context, Runnable action) {
        this.context = context;
        this.action = action;
    }

    /**
     * Run the action as soon as possible through the strategy.
     */
    public void now() {
        context.scheduler().execute(action);
        context.reportSubmitted(SubmissionKind.IMMEDIATE, Interval.millis(0), null);
    }

    /**
     * Run the action once at {@code instant}. The delay is computed in
     * milliseconds against the capability's "now"; an instant in the past
     * yields a negative delay, which the strategy treats as zero.
     */
    public ScheduledFuture<?> onceAt(I instant) {
        Objects.requireNonNull(instant, "instant");
        InstantLike<I> instants = context.instants();
        long delayMillis = instants.delay(instants.now(), instant, TimeUnit.MILLISECONDS).toMillis();

        ScheduledFuture<?> future = context.scheduler().schedule(action, delayMillis, TimeUnit.MILLISECONDS);
        context.reportSubmitted(SubmissionKind.ONE_SHOT, Interval.millis(delayMillis), null);
        return future;
    }

    public ScheduledFuture<?> onceIn(Interval interval) {
        Objects.requireNonNull(interval, "interval");
        return onceAt(interval.inTheFuture(context.instants()));
    }

    /**
     * Run the action once at the next occurrence of {@code time} in {@code zone}.
     */
    public <T> ScheduledFuture<?> onceAtNext(T time, ZoneId zone, TimeLike<T, ?, I> times) {
        return onceAt(next(time, zone, times));
    }

    public <T> ScheduledFuture<?> onceAtNext(T time, TimeLike<T, ?, I> times) {
        return onceAtNext(time, context.defaultZone(), times);
    }

    public <Z> ScheduledFuture<?> onceAtNextZoned(Z time, ZonedTimeLike<Z, ?, I> times) {
        Objects.requireNonNull(times, "times");
        return onceAtNext(time, times.zone(time), times);
    }

    /**
     * A repeating schedule whose first invocation happens on submission.
     */
    public RepeatingSchedule<I> immediately() {
        return new RepeatingSchedule<>(context, action, null);
    }

    public LimitedScheduledFuture<I> immediatelyThenEvery(Interval period) {
        return immediately().thenEvery(period);
    }

    /**
     * A repeating schedule whose first invocation happens at {@code instant}.
     */
    public RepeatingSchedule<I> startingAt(I instant) {
        return new RepeatingSchedule<>(context, action, Objects.requireNonNull(instant, "instant"));
    }

    public RepeatingSchedule<I> startingIn(Interval interval) {
        Objects.requireNonNull(interval, "interval");
        return startingAt(interval.inTheFuture(context.instants()));
    }

    public <T> RepeatingSchedule<I> startingAtNext(T time, ZoneId zone, TimeLike<T, ?, I> times) {
        return startingAt(next(time, zone, times));
    }

    public <T> RepeatingSchedule<I> startingAtNext(T time, TimeLike<T, ?, I> times) {
        return startingAtNext(time, context.defaultZone(), times);
    }

    public <Z> RepeatingSchedule<I> startingAtNextZoned(Z time, ZonedTimeLike<Z, ?, I> times) {
        Objects.requireNonNull(times, "times");
        return startingAtNext(time, times.zone(time), times);
    }

    /**
     * Run the action every day at {@code time} in {@code zone}, starting with the
     * next occurrence. When {@code runNowIfPast} is set and {@code time} has
     * already passed today, the action is also executed right away.
     */
    public <T> LimitedScheduledFuture<I> dailyAt(T time, ZoneId zone, boolean runNowIfPast, TimeLike<T, ?, I> times) {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(times, "times");

        if (runNowIfPast && times.compare(times.now(zone), time) > 0) {
            now();
        }
        return startingAtNext(time, zone, times).thenEvery(Interval.days(1));
    }

    public <T> LimitedScheduledFuture<I> dailyAt(T time, TimeLike<T, ?, I> times) {
        return dailyAt(time, context.defaultZone(), true, times);
    }

    public <Z> LimitedScheduledFuture<I> dailyAtZoned(Z time, boolean runNowIfPast, ZonedTimeLike<Z, ?, I> times) {
        Objects.requireNonNull(times, "times");
        return dailyAt(time, times.zone(time), runNowIfPast, times);
    }

    public <Z> LimitedScheduledFuture<I> dailyAtZoned(Z time, ZonedTimeLike<Z, ?, I> times) {
        return dailyAtZoned(time, true, times);
    }

    static <T, I> I next(T time, ZoneId zone, TimeLike<T, ?, I> times) {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(times, "times");
        return times.next(time, zone);
    }
}
