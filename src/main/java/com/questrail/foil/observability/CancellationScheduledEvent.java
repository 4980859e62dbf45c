package com.questrail.foil.observability;

import com.questrail.foil.time.Interval;

import java.time.Instant;

/**
 * Record representing a future cancellation armed against a periodic handle.
 *
 * @param delay time until the cancellation fires, as measured when it was armed
 */
public record CancellationScheduledEvent(
    Instant timestamp,
    Interval delay
) {
}
