package com.questrail.foil.observability;

/**
 * Main interface for receiving scheduling observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called synchronously on the submitting thread or, for
 * cancellations and failures, on the strategy's worker thread. They must be
 * thread-safe and must not throw.</p>
 */
public interface ScheduleObservabilitySink {
    /**
     * Called when a deferred action has been handed to the execution strategy.
     * @param event the submission details
     */
    void onSubmitted(ScheduleSubmittedEvent event);

    /**
     * Called when a future cancellation has been armed for a periodic handle.
     * @param event the cancellation details
     */
    void onCancellationScheduled(CancellationScheduledEvent event);

    /**
     * Called when an armed cancellation fires.
     * @param event the cancellation outcome
     */
    void onCancelled(ScheduleCancelledEvent event);

    /**
     * Called when a deferred action throws during execution.
     * @param event the failure
     */
    void onInvocationFailed(InvocationFailureEvent event);
}
