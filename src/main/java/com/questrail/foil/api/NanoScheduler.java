package com.questrail.foil.api;

import java.util.concurrent.ScheduledFuture;

/**
 * Execution strategy taking raw nanosecond counts, for callers wanting
 * sub-millisecond precision without unit conversion loss.
 */
public interface NanoScheduler
{
    ScheduledFuture<?> schedule(Runnable action, long delayNanos);

    ScheduledFuture<?> schedule(Runnable action, long delayNanos, long periodNanos);
}
