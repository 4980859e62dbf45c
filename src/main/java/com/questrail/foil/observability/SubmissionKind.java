package com.questrail.foil.observability;

/**
 * How a deferred action was handed to the execution strategy.
 */
public enum SubmissionKind {
    /** Executed as soon as possible, no handle. */
    IMMEDIATE,
    /** One-shot job after a delay. */
    ONE_SHOT,
    /** Periodic job through a unit-based scheduler. */
    PERIODIC,
    /** Periodic job through a nanosecond scheduler. */
    PERIODIC_NANOS
}
