package com.questrail.foil.observability;

/**
 * No-op implementation of ScheduleObservabilitySink.
 */
public final class NullObservabilitySink implements ScheduleObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSubmitted(ScheduleSubmittedEvent event) {}

    @Override
    public void onCancellationScheduled(CancellationScheduledEvent event) {}

    @Override
    public void onCancelled(ScheduleCancelledEvent event) {}

    @Override
    public void onInvocationFailed(InvocationFailureEvent event) {}
}
