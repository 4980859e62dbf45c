package com.questrail.foil.config;

import java.util.Objects;

/**
 * StrategyPolicy
 * -----------------------------------------------------------------------------
 * Periodic spacing and failure continuation for an executor-backed strategy.
 *
 * <p>These are execution concerns only. The scheduling DSL computes delays and
 * periods; the strategy decides how runs are spaced and whether a periodic job
 * survives a failing run.</p>
 */
public record StrategyPolicy(
        PeriodicMode periodicMode,
        FailureMode failureMode
) {
    public StrategyPolicy {
        Objects.requireNonNull(periodicMode, "periodicMode");
        Objects.requireNonNull(failureMode, "failureMode");
    }

    /**
     * Fixed rate, no further runs after a failure (the JDK executor behavior).
     */
    public static StrategyPolicy defaults() {
        return new StrategyPolicy(PeriodicMode.FIXED_RATE, FailureMode.SUPPRESS_FURTHER);
    }

    public static StrategyPolicy fixedDelay() {
        return new StrategyPolicy(PeriodicMode.FIXED_DELAY, FailureMode.SUPPRESS_FURTHER);
    }
}
