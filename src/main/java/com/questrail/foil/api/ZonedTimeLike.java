package com.questrail.foil.api;

import java.time.ZoneId;

/**
 * A {@link TimeLike} whose values carry their own zone, so callers need not
 * pass one.
 */
public interface ZonedTimeLike<Z, D, I> extends TimeLike<Z, D, I>
{
    ZoneId zone(Z z);

    default Z nowZoned(Z z) {
        return now(zone(z));
    }

    default I nextZoned(Z z) {
        return next(z, zone(z));
    }

    default I instantZoned(Z z, D d) {
        return instant(z, d, zone(z));
    }
}
