package com.questrail.foil.time;

import com.questrail.foil.api.InstantLike;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Interval
 * =============================================================================
 * An immutable length of time expressed as a {@code long} magnitude in a
 * {@link TimeUnit}. This is the only concrete temporal value in foil; instants,
 * dates and times of day are supplied by the caller's date/time library through
 * the capability interfaces in {@code com.questrail.foil.api}.
 *
 * <pre>
 *   Interval.minutes(25).before(instant, instants)
 *   Interval.hours(24).inTheFuture(instants)
 *   Interval.seconds(5).multiply(attempt).sleep()
 * </pre>
 *
 * <h2>Unit conversion</h2>
 * <p>All conversions go through {@link TimeUnit#convert(long, TimeUnit)}, so
 * {@code i.as(u).as(u).equals(i.as(u))} always holds. Converting to a coarser
 * unit truncates toward zero (1500 ms is 1 s). Conversions that overflow
 * saturate at {@link Long#MAX_VALUE} / {@link Long#MIN_VALUE}, as
 * {@link TimeUnit} does.</p>
 *
 * <h2>Blocking helpers</h2>
 * <p>{@link #sleep()}, {@link #waitOn(Object)} and {@link #joinTo(Thread)} block
 * only the calling thread and surface interruption as
 * {@link InterruptedException}.</p>
 */
public final class Interval {

    private final long duration;
    private final TimeUnit unit;

    private Interval(long duration, TimeUnit unit) {
        this.duration = duration;
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public static Interval of(long duration, TimeUnit unit) {
        return new Interval(duration, unit);
    }

    /**
     * Millisecond-resolution view of a {@link Duration}.
     */
    public static Interval of(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        return new Interval(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public static Interval nanos(long n) {
        return new Interval(n, TimeUnit.NANOSECONDS);
    }

    public static Interval micros(long n) {
        return new Interval(n, TimeUnit.MICROSECONDS);
    }

    public static Interval millis(long n) {
        return new Interval(n, TimeUnit.MILLISECONDS);
    }

    public static Interval seconds(long n) {
        return new Interval(n, TimeUnit.SECONDS);
    }

    public static Interval minutes(long n) {
        return new Interval(n, TimeUnit.MINUTES);
    }

    public static Interval hours(long n) {
        return new Interval(n, TimeUnit.HOURS);
    }

    public static Interval days(long n) {
        return new Interval(n, TimeUnit.DAYS);
    }

    public long duration() {
        return duration;
    }

    public TimeUnit unit() {
        return unit;
    }

    // ---------------------------------------------------------------------
    // Arithmetic
    // ---------------------------------------------------------------------

    public Interval negate() {
        return new Interval(Math.negateExact(duration), unit);
    }

    /**
     * Scale the magnitude, keeping the unit. Useful for linear or exponential
     * backoff: {@code Interval.seconds(5).multiply(attempt)}.
     *
     * @throws ArithmeticException if the magnitude overflows
     */
    public Interval multiply(long factor) {
        return new Interval(Math.multiplyExact(duration, factor), unit);
    }

    public boolean isNegative() {
        return duration < 0;
    }

    public boolean isZero() {
        return duration == 0;
    }

    public boolean isPositive() {
        return duration > 0;
    }

    // ---------------------------------------------------------------------
    // Unit conversion
    // ---------------------------------------------------------------------

    public Interval as(TimeUnit otherUnit) {
        Objects.requireNonNull(otherUnit, "otherUnit");
        return new Interval(otherUnit.convert(duration, unit), otherUnit);
    }

    public Interval asNanos() {
        return as(TimeUnit.NANOSECONDS);
    }

    public Interval asMicros() {
        return as(TimeUnit.MICROSECONDS);
    }

    public Interval asMillis() {
        return as(TimeUnit.MILLISECONDS);
    }

    public Interval asSeconds() {
        return as(TimeUnit.SECONDS);
    }

    public Interval asMinutes() {
        return as(TimeUnit.MINUTES);
    }

    public Interval asHours() {
        return as(TimeUnit.HOURS);
    }

    public Interval asDays() {
        return as(TimeUnit.DAYS);
    }

    public long toNanos() {
        return unit.toNanos(duration);
    }

    public long toMicros() {
        return unit.toMicros(duration);
    }

    public long toMillis() {
        return unit.toMillis(duration);
    }

    public long toSeconds() {
        return unit.toSeconds(duration);
    }

    public long toMinutes() {
        return unit.toMinutes(duration);
    }

    public long toHours() {
        return unit.toHours(duration);
    }

    public long toDays() {
        return unit.toDays(duration);
    }

    public Duration toDuration() {
        return Duration.of(duration, unit.toChronoUnit());
    }

    // ---------------------------------------------------------------------
    // Instant arithmetic
    // ---------------------------------------------------------------------

    /**
     * The instant this interval before {@code instant}.
     */
    public <I> I earlierThan(I instant, InstantLike<I> instants) {
        Objects.requireNonNull(instants, "instants");
        return instants.minus(instant, this);
    }

    public <I> I before(I instant, InstantLike<I> instants) {
        return earlierThan(instant, instants);
    }

    /**
     * The instant this interval before "now" as reported by {@code instants}.
     */
    public <I> I ago(InstantLike<I> instants) {
        Objects.requireNonNull(instants, "instants");
        return earlierThan(instants.now(), instants);
    }

    /**
     * The instant this interval after {@code instant}.
     */
    public <I> I laterThan(I instant, InstantLike<I> instants) {
        Objects.requireNonNull(instants, "instants");
        return instants.plus(instant, this);
    }

    public <I> I after(I instant, InstantLike<I> instants) {
        return laterThan(instant, instants);
    }

    /**
     * The instant this interval after "now" as reported by {@code instants}.
     */
    public <I> I inTheFuture(InstantLike<I> instants) {
        Objects.requireNonNull(instants, "instants");
        return laterThan(instants.now(), instants);
    }

    // ---------------------------------------------------------------------
    // Blocking helpers
    // ---------------------------------------------------------------------

    public void sleep() throws InterruptedException {
        unit.sleep(duration);
    }

    /**
     * Wait on {@code monitor} for at most this interval.
     *
     * @throws IllegalMonitorStateException if the caller does not hold the monitor
     */
    public void waitOn(Object monitor) throws InterruptedException {
        Objects.requireNonNull(monitor, "monitor");
        unit.timedWait(monitor, duration);
    }

    /**
     * Join {@code thread} for at most this interval.
     */
    public void joinTo(Thread thread) throws InterruptedException {
        Objects.requireNonNull(thread, "thread");
        unit.timedJoin(thread, duration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval other = (Interval) o;
        return duration == other.duration && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, unit);
    }

    @Override
    public String toString() {
        return duration + " " + unit;
    }
}
