package com.questrail.foil.core;

import com.questrail.foil.javatime.JavaTime;
import com.questrail.foil.observability.RecordingObservabilitySink;
import com.questrail.foil.observability.ScheduleSubmittedEvent;
import com.questrail.foil.observability.SubmissionKind;
import com.questrail.foil.time.Interval;
import com.questrail.foil.time.ManualScheduler;
import com.questrail.foil.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduleTest
 * -----------------------------------------------------------------------------
 * One-shot and daily transitions, driven by a manual strategy at
 * 2026-03-01T10:00:00Z.
 */
class ScheduleTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private JavaTime javaTime;
    private ManualScheduler scheduler;
    private RecordingObservabilitySink sink;
    private Schedules<Instant> schedules;
    private AtomicInteger runs;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0, ZoneOffset.UTC);
        javaTime = JavaTime.withClock(clock);
        scheduler = new ManualScheduler(clock);
        sink = new RecordingObservabilitySink();
        schedules = Schedules.builder(javaTime.instants())
                .withScheduler(scheduler)
                .withDefaultZone(ZoneOffset.UTC)
                .withObservabilitySink(sink)
                .withWallClock(clock)
                .build();
        runs = new AtomicInteger();
    }

    // ---------------------------------------------------------------------
    // Immediate and one-shot
    // ---------------------------------------------------------------------

    @Test
    void nowHandsTheActionToTheStrategy() {
        schedules.schedule(runs::incrementAndGet).now();

        assertEquals(1, scheduler.executedCount());
        assertEquals(1, runs.get());
        assertTrue(scheduler.submissions().isEmpty());

        ScheduleSubmittedEvent event = sink.getEventsOfType(ScheduleSubmittedEvent.class).get(0);
        assertEquals(SubmissionKind.IMMEDIATE, event.kind());
        assertFalse(event.isPeriodic());
    }

    @Test
    void onceAtSubmitsTheDelayInMillis() {
        schedules.schedule(runs::incrementAndGet).onceAt(T0.plusSeconds(90));

        ManualScheduler.Submission submission = scheduler.lastSubmission();
        assertEquals(90_000L, submission.delay());
        assertEquals(TimeUnit.MILLISECONDS, submission.unit());
        assertFalse(submission.isPeriodic());
    }

    @Test
    void onceAtRunsExactlyOnceAtTheInstant() {
        schedules.schedule(runs::incrementAndGet).onceAt(T0.plusSeconds(90));

        scheduler.advance(Duration.ofSeconds(89));
        assertEquals(0, runs.get());

        scheduler.advance(Duration.ofSeconds(1));
        assertEquals(1, runs.get());

        scheduler.advance(Duration.ofHours(1));
        assertEquals(1, runs.get());
    }

    @Test
    void onceAtAPastInstantRunsRightAway() {
        schedules.schedule(runs::incrementAndGet).onceAt(T0.minusSeconds(5));

        assertEquals(-5_000L, scheduler.lastSubmission().delay());
        scheduler.runDueTasks();
        assertEquals(1, runs.get());
    }

    @Test
    void onceInIsRelativeToNow() {
        clock.advance(Duration.ofMinutes(7));
        schedules.schedule(runs::incrementAndGet).onceIn(Interval.minutes(2));

        assertEquals(120_000L, scheduler.lastSubmission().delay());
    }

    @Test
    void onceInAgainstTheSystemClock() {
        Schedules<Instant> system = Schedules.using(JavaTime.system().instants(), scheduler);

        system.schedule(runs::incrementAndGet).onceIn(Interval.seconds(5));

        long delay = scheduler.lastSubmission().delay();
        assertTrue(delay >= 4_900 && delay <= 5_100, "delay was " + delay);
    }

    @Test
    void oneShotHandleCanBeCancelled() {
        ScheduledFuture<?> handle = schedules.schedule(runs::incrementAndGet).onceIn(Interval.seconds(10));

        assertTrue(handle.cancel(false));
        scheduler.advance(Duration.ofMinutes(1));
        assertEquals(0, runs.get());
    }

    @Test
    void oneShotEventCarriesTheDelay() {
        schedules.schedule(runs::incrementAndGet).onceIn(Interval.minutes(2));

        ScheduleSubmittedEvent event = sink.getEventsOfType(ScheduleSubmittedEvent.class).get(0);
        assertEquals(T0, event.timestamp());
        assertEquals(SubmissionKind.ONE_SHOT, event.kind());
        assertEquals(Interval.millis(120_000), event.initialDelay());
        assertTrue(event.periodIfAny().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Next occurrence of a time of day
    // ---------------------------------------------------------------------

    @Test
    void onceAtNextLaterToday() {
        schedules.schedule(runs::incrementAndGet).onceAtNext(LocalTime.of(11, 0), ZoneOffset.UTC, javaTime.times());

        assertEquals(3_600_000L, scheduler.lastSubmission().delay());
    }

    @Test
    void onceAtNextUsesTheDefaultZone() {
        schedules.schedule(runs::incrementAndGet).onceAtNext(LocalTime.of(9, 0), javaTime.times());

        assertEquals(TimeUnit.HOURS.toMillis(23), scheduler.lastSubmission().delay());
    }

    @Test
    void onceAtNextOfTheCurrentTimeIsTomorrow() {
        schedules.schedule(runs::incrementAndGet).onceAtNext(LocalTime.of(10, 0), javaTime.times());

        assertEquals(TimeUnit.DAYS.toMillis(1), scheduler.lastSubmission().delay());
    }

    @Test
    void onceAtNextInAnotherZone() {
        // 11:00 in Paris.
        schedules.schedule(runs::incrementAndGet)
                .onceAtNext(LocalTime.of(11, 30), ZoneId.of("Europe/Paris"), javaTime.times());

        assertEquals(1_800_000L, scheduler.lastSubmission().delay());
    }

    @Test
    void onceAtNextZonedUsesTheValuesOffset() {
        schedules.schedule(runs::incrementAndGet)
                .onceAtNextZoned(OffsetTime.of(12, 30, 0, 0, ZoneOffset.ofHours(2)), javaTime.offsetTimes());

        assertEquals(1_800_000L, scheduler.lastSubmission().delay());
    }

    // ---------------------------------------------------------------------
    // Daily
    // ---------------------------------------------------------------------

    @Test
    void dailyAtAPassedTimeRunsNowAndFromTomorrow() {
        LimitedScheduledFuture<Instant> daily =
                schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(9, 0), javaTime.times());

        assertEquals(1, scheduler.executedCount());
        assertEquals(1, runs.get());

        ManualScheduler.Submission submission = scheduler.lastSubmission();
        assertTrue(submission.isPeriodic());
        assertEquals(TimeUnit.HOURS.toMillis(23), submission.delay());
        assertEquals(TimeUnit.DAYS.toMillis(1), submission.period());
        assertEquals(TimeUnit.MILLISECONDS, submission.unit());
        assertEquals(Instant.parse("2026-03-02T09:00:00Z"), daily.startTime().orElseThrow());
    }

    @Test
    void dailyAtFiresOncePerDay() {
        schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(9, 0), javaTime.times());

        scheduler.advance(Duration.ofHours(23));
        assertEquals(2, runs.get());

        scheduler.advance(Duration.ofDays(1));
        assertEquals(3, runs.get());

        scheduler.advance(Duration.ofHours(23));
        assertEquals(3, runs.get());
    }

    @Test
    void dailyAtAFutureTimeWaitsForIt() {
        schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(11, 0), javaTime.times());

        assertEquals(0, scheduler.executedCount());
        assertEquals(3_600_000L, scheduler.lastSubmission().delay());
    }

    @Test
    void dailyAtWithoutCatchUp() {
        schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(9, 0), ZoneOffset.UTC, false, javaTime.times());

        assertEquals(0, scheduler.executedCount());
        assertEquals(TimeUnit.HOURS.toMillis(23), scheduler.lastSubmission().delay());
    }

    @Test
    void dailyAtTheCurrentTimeDoesNotRunNow() {
        schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(10, 0), javaTime.times());

        assertEquals(0, scheduler.executedCount());
        assertEquals(TimeUnit.DAYS.toMillis(1), scheduler.lastSubmission().delay());
    }

    @Test
    void dailyAtZonedRunsNowWhenPassedInItsOwnOffset() {
        // 12:00 at +02:00, so 08:00 has passed there.
        schedules.schedule(runs::incrementAndGet)
                .dailyAtZoned(OffsetTime.of(8, 0, 0, 0, ZoneOffset.ofHours(2)), javaTime.offsetTimes());

        assertEquals(1, scheduler.executedCount());
        assertEquals(TimeUnit.HOURS.toMillis(20), scheduler.lastSubmission().delay());
    }

    @Test
    void dailyAtZonedWithoutCatchUp() {
        schedules.schedule(runs::incrementAndGet)
                .dailyAtZoned(OffsetTime.of(8, 0, 0, 0, ZoneOffset.ofHours(2)), false, javaTime.offsetTimes());

        assertEquals(0, scheduler.executedCount());
    }

    @Test
    void dailyAtReportsImmediateThenPeriodic() {
        schedules.schedule(runs::incrementAndGet).dailyAt(LocalTime.of(9, 0), javaTime.times());

        List<ScheduleSubmittedEvent> events = sink.getEventsOfType(ScheduleSubmittedEvent.class);
        assertEquals(2, events.size());
        assertEquals(SubmissionKind.IMMEDIATE, events.get(0).kind());
        assertEquals(SubmissionKind.PERIODIC, events.get(1).kind());
        assertEquals(Interval.millis(TimeUnit.DAYS.toMillis(1)), events.get(1).period());
    }

    // ---------------------------------------------------------------------
    // Arguments
    // ---------------------------------------------------------------------

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> schedules.schedule(null));
        assertThrows(NullPointerException.class, () -> schedules.schedule(runs::incrementAndGet).onceAt(null));
        assertThrows(NullPointerException.class,
                () -> schedules.schedule(runs::incrementAndGet).onceAtNext(LocalTime.NOON, null, javaTime.times()));
        assertTrue(scheduler.submissions().isEmpty());
    }

    @Test
    void contextRequiresAScheduler() {
        assertThrows(NullPointerException.class, () -> Schedules.builder(javaTime.instants()).build());
    }

    @Test
    void nothingRunsUntilATerminalOperation() {
        Schedule<Instant> pending = schedules.schedule(runs::incrementAndGet);
        pending.startingIn(Interval.seconds(1));
        pending.immediately();

        assertTrue(scheduler.submissions().isEmpty());
        assertEquals(0, scheduler.executedCount());
        assertFalse(sink.hasEventOfType(ScheduleSubmittedEvent.class));
    }
}
