package com.questrail.foil.joda;

import com.questrail.foil.api.InstantLike;
import com.questrail.foil.time.Interval;
import org.joda.time.Instant;

import java.util.concurrent.TimeUnit;

/**
 * {@link InstantLike} for Joda {@link Instant}. Joda keeps millisecond
 * precision, so finer intervals are truncated to whole milliseconds.
 * "Now" comes from {@link org.joda.time.DateTimeUtils#currentTimeMillis()}.
 */
public final class JodaInstants implements InstantLike<Instant> {

    @Override
    public Instant plus(Instant x, Interval interval) {
        return x.plus(interval.toMillis());
    }

    @Override
    public Interval delay(Instant x, Instant y, TimeUnit unit) {
        return Interval.millis(y.getMillis() - x.getMillis()).as(unit);
    }

    @Override
    public Instant now() {
        return new Instant();
    }

    @Override
    public long millisSinceEpoch(Instant x) {
        return x.getMillis();
    }

    @Override
    public Instant fromEpochMillis(long millis) {
        return new Instant(millis);
    }
}
