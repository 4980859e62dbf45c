package com.questrail.foil.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ScheduleObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jScheduleObservabilitySink implements ScheduleObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jScheduleObservabilitySink.class);

    @Override
    public void onSubmitted(ScheduleSubmittedEvent event) {
        if (event.isPeriodic()) {
            log.debug("Submitted {} job: initial delay {}, period {}",
                event.kind(),
                event.initialDelay(),
                event.period());
        } else {
            log.debug("Submitted {} job: delay {}", event.kind(), event.initialDelay());
        }
    }

    @Override
    public void onCancellationScheduled(CancellationScheduledEvent event) {
        log.info("Cancellation armed in {}", event.delay());
    }

    @Override
    public void onCancelled(ScheduleCancelledEvent event) {
        if (event.cancelled()) {
            log.info("Periodic job cancelled");
        } else {
            log.debug("Armed cancellation fired after the job had already finished");
        }
    }

    @Override
    public void onInvocationFailed(InvocationFailureEvent event) {
        if (event.willContinue()) {
            log.warn("Scheduled action failed, job continues: {}", event.message(), event.cause());
        } else {
            log.error("Scheduled action failed, no further runs: {}", event.message(), event.cause());
        }
    }
}
