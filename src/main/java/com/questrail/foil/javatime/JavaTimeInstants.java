package com.questrail.foil.javatime;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.time.Interval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link InstantLike} for {@link Instant}, reading "now" from a {@link Clock}.
 *
 * <p>Delays requested in nanoseconds or microseconds keep nanosecond precision
 * while the span fits in a {@code long} (about 292 years) and fall back to
 * millisecond precision beyond that.</p>
 */
public final class JavaTimeInstants implements InstantLike<Instant> {

    // Largest whole-second span whose nanosecond count fits in a long.
    private static final long MAX_NANO_SECONDS = Long.MAX_VALUE / 1_000_000_000L - 1;

    private final Clock clock;

    public JavaTimeInstants(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant plus(Instant x, Interval interval) {
        return x.plus(interval.duration(), interval.unit().toChronoUnit());
    }

    @Override
    public Interval delay(Instant x, Instant y, TimeUnit unit) {
        Duration between = Duration.between(x, y);
        boolean subMillis = unit == TimeUnit.NANOSECONDS || unit == TimeUnit.MICROSECONDS;
        if (subMillis && Math.abs(between.getSeconds()) < MAX_NANO_SECONDS) {
            return Interval.nanos(between.toNanos()).as(unit);
        }
        return Interval.millis(between.toMillis()).as(unit);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public long millisSinceEpoch(Instant x) {
        return x.toEpochMilli();
    }

    @Override
    public Instant fromEpochMillis(long millis) {
        return Instant.ofEpochMilli(millis);
    }
}
