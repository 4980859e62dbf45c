package com.questrail.foil.javatime;

import com.questrail.foil.api.DateLike;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * {@link DateLike} for {@link LocalDate}.
 */
public final class JavaTimeDates implements DateLike<LocalDate> {

    private final Clock clock;

    public JavaTimeDates(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LocalDate now(ZoneId zone) {
        return LocalDate.now(clock.withZone(zone));
    }

    @Override
    public LocalDate plus(LocalDate x, int days) {
        return x.plusDays(days);
    }
}
