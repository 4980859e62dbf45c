package com.questrail.foil.javatime;

import java.time.Clock;
import java.util.Objects;

/**
 * JavaTime
 * =============================================================================
 * The {@code java.time} capability set, all reading the same {@link Clock}.
 *
 * <pre>
 *   JavaTime javaTime = JavaTime.system();
 *   Schedules&lt;Instant&gt; schedules = Schedules.using(javaTime.instants(), strategy);
 *
 *   schedules.schedule(task).onceAtNext(LocalTime.NOON, javaTime.times());
 *   schedules.schedule(task).dailyAtZoned(OffsetTime.of(7, 30, 0, 0, ZoneOffset.ofHours(1)),
 *           javaTime.offsetTimes());
 * </pre>
 *
 * <p>Instances are immutable and thread-safe. Tests pass a fixed or mutable
 * clock through {@link #withClock(Clock)}.</p>
 */
public final class JavaTime {

    private final Clock clock;
    private final JavaTimeInstants instants;
    private final JavaTimeDates dates;
    private final JavaTimeTimes times;
    private final JavaTimeOffsetTimes offsetTimes;

    private JavaTime(Clock clock) {
        this.clock = clock;
        this.instants = new JavaTimeInstants(clock);
        this.dates = new JavaTimeDates(clock);
        this.times = new JavaTimeTimes(clock);
        this.offsetTimes = new JavaTimeOffsetTimes(clock);
    }

    public static JavaTime system() {
        return new JavaTime(Clock.systemUTC());
    }

    public static JavaTime withClock(Clock clock) {
        return new JavaTime(Objects.requireNonNull(clock, "clock"));
    }

    public Clock clock() {
        return clock;
    }

    public JavaTimeInstants instants() {
        return instants;
    }

    public JavaTimeDates dates() {
        return dates;
    }

    public JavaTimeTimes times() {
        return times;
    }

    public JavaTimeOffsetTimes offsetTimes() {
        return offsetTimes;
    }
}
