package com.questrail.foil.joda;

import org.joda.time.DateTimeZone;

import java.time.ZoneId;
import java.util.TimeZone;

final class JodaZones {

    private JodaZones() {}

    /**
     * Goes through {@link TimeZone} so offset ids such as {@code Z} and
     * {@code +01:00} map onto Joda's fixed-offset zones.
     */
    static DateTimeZone of(ZoneId zone) {
        return DateTimeZone.forTimeZone(TimeZone.getTimeZone(zone));
    }
}
