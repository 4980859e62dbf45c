package com.questrail.foil.joda;

import com.questrail.foil.api.TimeLike;
import org.joda.time.DateTime;
import org.joda.time.DateTimeConstants;
import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.joda.time.LocalDate;
import org.joda.time.LocalDateTime;
import org.joda.time.LocalTime;

import java.time.ZoneId;

/**
 * {@link TimeLike} for Joda {@link LocalTime}.
 *
 * <p>A time falling in a daylight-saving gap is shifted later by the length
 * of the gap instead of failing, matching the {@code java.time} adapter.</p>
 */
public final class JodaTimes implements TimeLike<LocalTime, LocalDate, Instant> {

    @Override
    public int compare(LocalTime x, LocalTime y) {
        return Integer.signum(x.compareTo(y));
    }

    @Override
    public LocalTime now(ZoneId zone) {
        return new LocalTime(JodaZones.of(zone));
    }

    /**
     * Inside a fall-back overlap, today's occurrence resolves to whichever
     * offset is still ahead of the clock, so the result is never in the past.
     */
    @Override
    public Instant next(LocalTime t, ZoneId zone) {
        DateTimeZone dtz = JodaZones.of(zone);
        DateTime now = new DateTime(dtz);
        LocalDate today = now.toLocalDate();
        if (compare(now.toLocalTime(), t) < 0) {
            DateTime candidate = resolve(today.toLocalDateTime(t), dtz);
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
        return resolve(d.toLocalDateTime(t), JodaZones.of(zone)).toInstant();
    }

    private static DateTime resolve(LocalDateTime local, DateTimeZone dtz) {
        if (!dtz.isLocalDateTimeGap(local)) {
            return local.toDateTime(dtz);
        }
        // Read the local fields with the offset in force before the gap.
        long localMillis = local.toDateTime(DateTimeZone.UTC).getMillis();
        long transition = dtz.nextTransition(localMillis - DateTimeConstants.MILLIS_PER_DAY);
        while (transition + dtz.getOffset(transition) <= localMillis) {
            transition = dtz.nextTransition(transition);
        }
        return new DateTime(localMillis - dtz.getOffset(transition - 1), dtz);
    }
}
