package com.questrail.foil.core;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.api.NanoScheduler;
import com.questrail.foil.api.Scheduler;
import com.questrail.foil.observability.NullObservabilitySink;
import com.questrail.foil.observability.ScheduleObservabilitySink;
import com.questrail.foil.observability.ScheduleSubmittedEvent;
import com.questrail.foil.observability.SubmissionKind;
import com.questrail.foil.time.Interval;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Schedules
 * =============================================================================
 * Entry point of the scheduling DSL, bound to one instant representation and
 * one execution strategy.
 *
 * <pre>
 *   JavaTime javaTime = JavaTime.system();
 *   Schedules&lt;Instant&gt; schedules = Schedules.builder(javaTime.instants())
 *           .withScheduler(strategy)
 *           .build();
 *
 *   schedules.schedule(task).onceIn(Interval.minutes(2));
 *   schedules.schedule(task)
 *           .startingIn(Interval.minutes(2))
 *           .thenEvery(Interval.seconds(5))
 *           .untilNext(LocalTime.MIDNIGHT, javaTime.times());
 * </pre>
 *
 * <h2>Capabilities</h2>
 * <p>The {@link InstantLike} capability is fixed here because every operation
 * needs it. Time-of-day capabilities vary with the time type a caller uses and
 * are passed explicitly to the operations that need them.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable and may be shared. Each {@link Schedule} returned
 * by {@link #schedule(Runnable)} belongs to the calling chain only.</p>
 */
public final class Schedules<I> {

    private final InstantLike<I> instants;
    private final Scheduler scheduler;
    private final NanoScheduler nanoScheduler;
    private final ZoneId defaultZone;
    private final ScheduleObservabilitySink observabilitySink;
    private final Clock wallClock;

    private Schedules(Builder<I> builder) {
        this.instants = builder.instants;
        this.scheduler = builder.scheduler;
        this.nanoScheduler = builder.nanoScheduler;
        this.defaultZone = builder.defaultZone;
        this.observabilitySink = builder.observabilitySink;
        this.wallClock = builder.wallClock;
    }

    /**
     * Shorthand for a context with default zone and no observability.
     */
    public static <I> Schedules<I> using(InstantLike<I> instants, Scheduler scheduler) {
        return builder(instants).withScheduler(scheduler).build();
    }

    public static <I> Builder<I> builder(InstantLike<I> instants) {
        return new Builder<>(instants);
    }

    /**
     * Capture {@code action} for deferred execution. Nothing runs until a
     * terminal operation of the returned schedule is invoked.
     */
    public Schedule<I> schedule(Runnable action) {
        return new Schedule<>(this, Objects.requireNonNull(action, "action"));
    }

    /**
     * Wrap an already submitted handle so it can be bounded in time.
     */
    public LimitedScheduledFuture<I> limit(ScheduledFuture<?> future) {
        return new LimitedScheduledFuture<>(future, this);
    }

    public InstantLike<I> instants() {
        return instants;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public Optional<NanoScheduler> nanoScheduler() {
        return Optional.ofNullable(nanoScheduler);
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }

    ScheduleObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    Instant observedAt() {
        return wallClock.instant();
    }

    void reportSubmitted(SubmissionKind kind, Interval initialDelay, Interval period) {
        observabilitySink.onSubmitted(new ScheduleSubmittedEvent(observedAt(), kind, initialDelay, period));
    }

    /**
     * Unit used to hand an interval to a unit-based strategy: milliseconds,
     * or the interval's own unit when it is finer.
     */
    static TimeUnit submissionUnit(TimeUnit unit) {
        return unit.compareTo(TimeUnit.MILLISECONDS) < 0 ? unit : TimeUnit.MILLISECONDS;
    }

    public static final class Builder<I> {
        private final InstantLike<I> instants;
        private Scheduler scheduler;
        private NanoScheduler nanoScheduler;
        private ZoneId defaultZone = ZoneId.systemDefault();
        private ScheduleObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock wallClock = Clock.systemUTC();

        private Builder(InstantLike<I> instants) {
            this.instants = Objects.requireNonNull(instants, "instants");
        }

        public Builder<I> withScheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Strategy used by {@link RepeatingSchedule#thenEveryNanos(long)}. If not
         * set, the main scheduler is used when it also implements
         * {@link NanoScheduler}.
         */
        public Builder<I> withNanoScheduler(NanoScheduler nanoScheduler) {
            this.nanoScheduler = nanoScheduler;
            return this;
        }

        public Builder<I> withDefaultZone(ZoneId defaultZone) {
            this.defaultZone = defaultZone;
            return this;
        }

        public Builder<I> withObservabilitySink(ScheduleObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Clock stamping observability events. Never used for timing.
         */
        public Builder<I> withWallClock(Clock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Schedules<I> build() {
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(defaultZone, "defaultZone");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            if (nanoScheduler == null && scheduler instanceof NanoScheduler) {
                nanoScheduler = (NanoScheduler) scheduler;
            }
            return new Schedules<>(this);
        }
    }
}
