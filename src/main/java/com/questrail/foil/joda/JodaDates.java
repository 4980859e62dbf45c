package com.questrail.foil.joda;

import com.questrail.foil.api.DateLike;
import org.joda.time.LocalDate;

import java.time.ZoneId;

/**
 * {@link DateLike} for Joda {@link LocalDate}.
 */
public final class JodaDates implements DateLike<LocalDate> {

    @Override
    public LocalDate now(ZoneId zone) {
        return new LocalDate(JodaZones.of(zone));
    }

    @Override
    public LocalDate plus(LocalDate x, int days) {
        return x.plusDays(days);
    }
}
