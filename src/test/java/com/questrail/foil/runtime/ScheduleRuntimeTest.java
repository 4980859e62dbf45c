package com.questrail.foil.runtime;

import com.questrail.foil.config.ExecutorKind;
import com.questrail.foil.config.FailureMode;
import com.questrail.foil.config.PeriodicMode;
import com.questrail.foil.config.ScheduleRuntimeConfig;
import com.questrail.foil.config.StrategyPolicy;
import com.questrail.foil.core.Schedules;
import com.questrail.foil.javatime.JavaTime;
import com.questrail.foil.joda.JodaTime;
import com.questrail.foil.observability.RecordingObservabilitySink;
import com.questrail.foil.observability.ScheduleCancelledEvent;
import com.questrail.foil.observability.ScheduleSubmittedEvent;
import com.questrail.foil.observability.Slf4jScheduleObservabilitySink;
import com.questrail.foil.time.Interval;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduleRuntimeTest
 * -----------------------------------------------------------------------------
 * Smoke tests for the executor-backed runtime. Real time, short intervals.
 */
class ScheduleRuntimeTest {

    private static ScheduleRuntimeConfig config(ExecutorKind kind) {
        return ScheduleRuntimeConfig.builder()
                .withExecutorKind(kind)
                .withThreads(2)
                .withThreadNamePrefix("foil-runtime-test")
                .withDefaultZone(ZoneId.of("UTC"))
                .withShutdownTimeout(Duration.ofMillis(500))
                .build();
    }

    @ParameterizedTest
    @EnumSource(ExecutorKind.class)
    void oneShotRunsOnANamedDaemonThread(ExecutorKind kind) throws InterruptedException {
        try (ScheduleRuntime runtime = ScheduleRuntime.builder().withConfig(config(kind)).build()) {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<Thread> runner = new AtomicReference<>();

            runtime.schedules(JavaTime.system().instants())
                    .schedule(() -> {
                        runner.set(Thread.currentThread());
                        latch.countDown();
                    })
                    .onceIn(Interval.millis(20));

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            assertTrue(runner.get().getName().startsWith("foil-runtime-test"), runner.get().getName());
            assertTrue(runner.get().isDaemon());
        }
    }

    @ParameterizedTest
    @EnumSource(ExecutorKind.class)
    void boundedPeriodicJobStops(ExecutorKind kind) throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        try (ScheduleRuntime runtime = ScheduleRuntime.builder()
                .withConfig(config(kind))
                .withObservabilitySink(sink)
                .build()) {
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch started = new CountDownLatch(2);

            ScheduledFuture<?> handle = runtime.schedules(JavaTime.system().instants())
                    .schedule(() -> {
                        runs.incrementAndGet();
                        started.countDown();
                    })
                    .immediatelyThenEvery(Interval.millis(20))
                    .forTheNext(Interval.millis(150));

            assertTrue(started.await(2, TimeUnit.SECONDS));
            Thread.sleep(400);

            assertTrue(handle.isCancelled());
            int afterCancel = runs.get();
            Thread.sleep(100);
            assertEquals(afterCancel, runs.get());
            assertTrue(sink.hasEventOfType(ScheduleSubmittedEvent.class));
            assertTrue(sink.getEventsOfType(ScheduleCancelledEvent.class).get(0).cancelled());
        }
    }

    @Test
    void schedulesCarryTheConfiguredZone() {
        try (ScheduleRuntime runtime = ScheduleRuntime.builder().withConfig(config(ExecutorKind.JDK_SCHEDULED_POOL)).build()) {
            Schedules<Instant> schedules = runtime.schedules(JavaTime.system().instants());

            assertEquals(ZoneId.of("UTC"), schedules.defaultZone());
            assertSame(runtime.strategy(), schedules.scheduler());
            assertSame(runtime.strategy(), schedules.nanoScheduler().orElseThrow());
        }
    }

    @Test
    void anyInstantRepresentationSharesTheStrategy() throws InterruptedException {
        try (ScheduleRuntime runtime = ScheduleRuntime.builder().build()) {
            CountDownLatch latch = new CountDownLatch(1);

            runtime.schedules(JodaTime.INSTANCE.instants())
                    .schedule(latch::countDown)
                    .onceIn(Interval.millis(10));

            assertTrue(latch.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void slf4jSinkLogsWithoutFailing() throws InterruptedException {
        ScheduleRuntimeConfig config = ScheduleRuntimeConfig.builder()
                .withPolicy(new StrategyPolicy(PeriodicMode.FIXED_RATE, FailureMode.CONTINUE))
                .build();
        try (ScheduleRuntime runtime = ScheduleRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jScheduleObservabilitySink())
                .build()) {
            CountDownLatch attempts = new CountDownLatch(2);

            ScheduledFuture<?> handle = runtime.schedules(JavaTime.system().instants())
                    .schedule(() -> {
                        attempts.countDown();
                        throw new IllegalStateException("logged and survived");
                    })
                    .immediatelyThenEvery(Interval.millis(10))
                    .forTheNext(Interval.millis(100));

            assertTrue(attempts.await(2, TimeUnit.SECONDS));
            assertTrue(!handle.isDone() || handle.isCancelled(), "job should survive its failures");
        }
    }

    @Test
    void stopShutsTheExecutorDown() {
        ScheduleRuntime runtime = ScheduleRuntime.builder().build();
        runtime.schedules(JavaTime.system().instants())
                .schedule(() -> { })
                .startingIn(Interval.hours(1))
                .thenEvery(Interval.hours(1));

        assertFalse(runtime.isShutdown());
        runtime.stop();
        assertTrue(runtime.isShutdown());
    }

    @Test
    void stopShutsANettyGroupDown() {
        ScheduleRuntime runtime = ScheduleRuntime.builder().withConfig(config(ExecutorKind.NETTY_EVENT_EXECUTOR)).build();

        runtime.stop();

        assertTrue(runtime.isShutdown());
    }
}
