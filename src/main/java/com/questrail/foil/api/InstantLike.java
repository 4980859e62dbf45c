package com.questrail.foil.api;

import com.questrail.foil.time.Interval;

import java.util.concurrent.TimeUnit;

/**
 * InstantLike
 * =============================================================================
 * Capability describing a zone-agnostic instant-in-time type {@code I}.
 *
 * <p>
 * Any date/time library can take part in the scheduling DSL by supplying an
 * implementation of this interface for its instant type. The DSL is written
 * against this capability only, never against a concrete instant class.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations are pure and safe to share between threads.</li>
 *   <li>{@code plus(x, delay(x, y, unit)).equals(y)} for every {@code y} a whole
 *       number of the implementation's precision units away from {@code x}
 *       (and {@code unit} no coarser than that precision).</li>
 *   <li>{@link #now()} is wall-clock correct; it is not required to be monotonic.</li>
 * </ul>
 * <p>
 * An implementation breaking this contract leaves schedule timing undefined;
 * the scheduling core cannot detect it at runtime.
 * </p>
 */
public interface InstantLike<I>
{
    /**
     * The instant {@code interval} after {@code x}.
     */
    I plus(I x, Interval interval);

    /**
     * The instant {@code interval} before {@code x}.
     */
    default I minus(I x, Interval interval) {
        return plus(x, interval.negate());
    }

    /**
     * The interval, expressed in {@code unit}, which added to {@code x} gives
     * {@code y}. Negative when {@code y} is before {@code x}.
     */
    Interval delay(I x, I y, TimeUnit unit);

    /**
     * The current instant.
     */
    I now();

    long millisSinceEpoch(I x);

    I fromEpochMillis(long millis);
}
