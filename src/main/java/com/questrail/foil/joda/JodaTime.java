package com.questrail.foil.joda;

import com.questrail.foil.time.Interval;
import org.joda.time.Duration;
import org.joda.time.ReadableDuration;

import java.util.Objects;

/**
 * JodaTime
 * =============================================================================
 * The Joda-Time capability set plus conversions between {@link Interval} and
 * Joda durations.
 *
 * <pre>
 *   JodaTime joda = JodaTime.INSTANCE;
 *   Schedules&lt;Instant&gt; schedules = Schedules.using(joda.instants(), strategy);
 *
 *   schedules.schedule(task)
 *           .startingIn(JodaTime.toInterval(Duration.standardHours(2)))
 *           .thenEvery(Interval.minutes(5))
 *           .untilNext(new LocalTime(0, 0), joda.times());
 * </pre>
 *
 * <p>The capabilities are stateless; tests control "now" through
 * {@link org.joda.time.DateTimeUtils#setCurrentMillisFixed(long)}.</p>
 */
public final class JodaTime {

    public static final JodaTime INSTANCE = new JodaTime();

    private final JodaInstants instants = new JodaInstants();
    private final JodaDates dates = new JodaDates();
    private final JodaTimes times = new JodaTimes();

    private JodaTime() {}

    public JodaInstants instants() {
        return instants;
    }

    public JodaDates dates() {
        return dates;
    }

    public JodaTimes times() {
        return times;
    }

    public static Interval toInterval(ReadableDuration duration) {
        Objects.requireNonNull(duration, "duration");
        return Interval.millis(duration.getMillis());
    }

    public static Duration toDuration(Interval interval) {
        Objects.requireNonNull(interval, "interval");
        return new Duration(interval.toMillis());
    }
}
