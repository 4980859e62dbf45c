package com.questrail.foil.api;

import java.time.ZoneId;

/**
 * DateLike
 * =============================================================================
 * Capability describing a year-month-day type {@code D} with no zone.
 */
public interface DateLike<D>
{
    /**
     * Today's date in {@code zone}.
     */
    D now(ZoneId zone);

    /**
     * The date {@code days} after {@code x}.
     */
    D plus(D x, int days);

    default D minus(D x, int days) {
        return plus(x, -days);
    }
}
