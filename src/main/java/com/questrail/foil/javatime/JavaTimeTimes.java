package com.questrail.foil.javatime;

import com.questrail.foil.api.TimeLike;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * {@link TimeLike} for {@link LocalTime}.
 *
 * <p>A time falling in a daylight-saving gap is shifted later by the length
 * of the gap, as {@link java.time.LocalDateTime#atZone(ZoneId)} does.</p>
 */
public final class JavaTimeTimes implements TimeLike<LocalTime, LocalDate, Instant> {

    private final Clock clock;

    public JavaTimeTimes(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public int compare(LocalTime x, LocalTime y) {
        return Integer.signum(x.compareTo(y));
    }

    @Override
    public LocalTime now(ZoneId zone) {
        return LocalTime.now(clock.withZone(zone));
    }

    /**
     * Inside a fall-back overlap, today's occurrence resolves to whichever
     * offset is still ahead of the clock, so the result is never in the past.
     */
    @Override
    public Instant next(LocalTime t, ZoneId zone) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        LocalDate today = now.toLocalDate();
        if (compare(now.toLocalTime(), t) < 0) {
            ZonedDateTime candidate = today.atTime(t).atZone(zone);
            if (!candidate.isAfter(now)) {
                candidate = candidate.withLaterOffsetAtOverlap();
            }
            if (candidate.isAfter(now)) {
                return candidate.toInstant();
            }
        }
        return instant(t, today.plusDays(1), zone);
    }

    @Override
    public Instant instant(LocalTime t, LocalDate d, ZoneId zone) {
        return d.atTime(t).atZone(zone).toInstant();
    }
}
