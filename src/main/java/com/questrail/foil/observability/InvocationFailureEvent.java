package com.questrail.foil.observability;

import java.time.Instant;

/**
 * Record representing a deferred action throwing while run by a strategy.
 *
 * @param willContinue whether the strategy keeps running a periodic job afterwards
 */
public record InvocationFailureEvent(
    Instant timestamp,
    String message,
    Throwable cause,
    boolean willContinue
) {
}
