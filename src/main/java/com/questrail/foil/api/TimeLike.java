package com.questrail.foil.api;

import java.time.ZoneId;

/**
 * TimeLike
 * =============================================================================
 * Capability describing a zone-agnostic time-of-day type {@code T}, tied to the
 * date type {@code D} and instant type {@code I} of the same library.
 *
 * <h2>Next-occurrence policy</h2>
 * <p>
 * {@link #next(Object, ZoneId)} returns today's occurrence of {@code t} only if
 * {@code compare(now(zone), t) < 0}; otherwise (including when "now" equals
 * {@code t}) it returns tomorrow's. The returned instant is therefore never
 * in the past relative to the implementation's own clock.
 * </p>
 */
public interface TimeLike<T, D, I>
{
    /**
     * Negative if {@code x} is earlier in the day than {@code y}, zero if equal,
     * positive otherwise.
     */
    int compare(T x, T y);

    /**
     * The current time of day in {@code zone}.
     */
    T now(ZoneId zone);

    /**
     * The soonest future instant whose time of day in {@code zone} is {@code t}.
     */
    I next(T t, ZoneId zone);

    /**
     * The instant at time {@code t} on date {@code d} in {@code zone}.
     */
    I instant(T t, D d, ZoneId zone);
}
