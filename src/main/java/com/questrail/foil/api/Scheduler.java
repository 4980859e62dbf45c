package com.questrail.foil.api;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler
 * =============================================================================
 * Execution strategy the scheduling DSL delegates all timer and thread work to.
 *
 * <p>
 * The DSL never creates a strategy; one is supplied by the application. This
 * interface is intentionally small so it can be implemented by:
 * <ul>
 *   <li>a JVM {@code ScheduledExecutorService}</li>
 *   <li>a Netty event executor group</li>
 *   <li>a deterministic test scheduler</li>
 * </ul>
 * </p>
 *
 * <h2>Failure semantics</h2>
 * <p>
 * Exceptions thrown on submission (e.g. a rejected execution) propagate to the
 * caller unchanged. What happens when an action throws while running, and
 * whether a periodic job continues afterwards, is decided by the implementation.
 * Negative delays are treated as zero.
 * </p>
 */
public interface Scheduler
{
    /**
     * Run the action as soon as possible.
     */
    void execute(Runnable action);

    /**
     * Run the action once after {@code delay}.
     */
    ScheduledFuture<?> schedule(Runnable action, long delay, TimeUnit unit);

    /**
     * Run the action after {@code delay} and then every {@code period}. Fixed
     * rate versus fixed delay is the implementation's choice.
     */
    ScheduledFuture<?> schedule(Runnable action, long delay, long period, TimeUnit unit);
}
