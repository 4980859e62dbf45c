package com.questrail.foil.observability;

import com.questrail.foil.time.Interval;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record representing the submission of a deferred action to a strategy.
 * {@code period} is {@code null} for non-periodic submissions.
 */
public record ScheduleSubmittedEvent(
    Instant timestamp,
    SubmissionKind kind,
    Interval initialDelay,
    Interval period
) {
    public ScheduleSubmittedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(initialDelay, "initialDelay");
    }

    public boolean isPeriodic() {
        return period != null;
    }

    public Optional<Interval> periodIfAny() {
        return Optional.ofNullable(period);
    }
}
