package com.questrail.foil.javatime;

import com.questrail.foil.api.ZonedTimeLike;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link ZonedTimeLike} for {@link OffsetTime}; the zone of a value is its
 * {@link java.time.ZoneOffset}. Comparison looks at the local time only.
 */
public final class JavaTimeOffsetTimes implements ZonedTimeLike<OffsetTime, LocalDate, Instant> {

    private final Clock clock;
    private final JavaTimeTimes times;

    public JavaTimeOffsetTimes(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.times = new JavaTimeTimes(clock);
    }

    @Override
    public ZoneId zone(OffsetTime z) {
        return z.getOffset();
    }

    @Override
    public int compare(OffsetTime x, OffsetTime y) {
        return times.compare(x.toLocalTime(), y.toLocalTime());
    }

    @Override
    public OffsetTime now(ZoneId zone) {
        return OffsetTime.now(clock.withZone(zone));
    }

    @Override
    public Instant next(OffsetTime t, ZoneId zone) {
        return times.next(t.toLocalTime(), zone);
    }

    @Override
    public Instant instant(OffsetTime t, LocalDate d, ZoneId zone) {
        return times.instant(t.toLocalTime(), d, zone);
    }
}
