package com.questrail.foil.observability;

import java.time.Instant;

/**
 * Record representing an armed cancellation firing.
 *
 * @param cancelled {@code false} if the handle had already completed or been cancelled
 */
public record ScheduleCancelledEvent(
    Instant timestamp,
    boolean cancelled
) {
}
