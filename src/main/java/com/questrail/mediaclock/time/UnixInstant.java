package com.questrail.mediaclock.time;

import com.questrail.mediaclock.scale.CheckedLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A point in wall-clock time: nanoseconds since 1970-01-01T00:00:00Z.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Media timestamps are carried in two incompatible units: wall-clock
 * nanoseconds and 90 kHz codec ticks. Passing either around as a raw
 * {@code long} makes it trivial to add ticks to nanoseconds. This class wraps
 * the nanosecond count so that only named operations can combine it with other
 * values, and crossing into the codec clock requires an explicit conversion.
 * </p>
 *
 * <h2>Range</h2>
 * <ul>
 *   <li>Any signed 64-bit value; negative values are before the epoch</li>
 *   <li>Arithmetic that would leave the 64-bit range yields an empty result;
 *       nothing wraps</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class UnixInstant
{
    private static final Logger log = LoggerFactory.getLogger(UnixInstant.class);

    /**
     * The epoch itself.
     */
    public static final UnixInstant EPOCH = new UnixInstant(0L);

    /**
     * The largest representable instant. Used as a "never expires" deadline.
     */
    public static final UnixInstant MAX = new UnixInstant(Long.MAX_VALUE);

    private final long nanos;

    private UnixInstant(long nanos) {
        this.nanos = nanos;
    }

    /**
     * Reads the system wall clock.
     *
     * @throws WallClockCorruptedError if the system clock is before the epoch
     *         or beyond the 64-bit nanosecond range
     */
    public static UnixInstant now() {
        return now(SystemWallClock.INSTANCE);
    }

    /**
     * Reads the given wall clock.
     *
     * @throws WallClockCorruptedError if the reading is before the epoch or
     *         beyond the 64-bit nanosecond range
     */
    public static UnixInstant now(WallClock clock) {
        Objects.requireNonNull(clock, "clock");
        final Instant reading = Objects.requireNonNull(clock.now(), "clock reading");

        if (reading.isBefore(Instant.EPOCH)) {
            log.error("Wall clock went backwards past the epoch: {}", reading);
            throw new WallClockCorruptedError("time went backwards", reading);
        }
        try {
            return new UnixInstant(Math.addExact(
                    Math.multiplyExact(reading.getEpochSecond(), TimeUnits.SECOND),
                    reading.getNano()));
        } catch (ArithmeticException overflow) {
            log.error("Wall clock reading does not fit a 64-bit nanosecond count: {}", reading);
            throw new WallClockCorruptedError("timestamp does not fit in 64 bits", reading, overflow);
        }
    }

    /**
     * Creates an instant from a raw nanosecond count since the epoch.
     *
     * <p>Intended for deserialization and for values computed by lower layers.</p>
     */
    public static UnixInstant ofNanos(long nanos) {
        return new UnixInstant(nanos);
    }

    /**
     * Returns the raw nanosecond count since the epoch.
     *
     * <p>Intended for serialization. Arithmetic should go through the named
     * operations on this class.</p>
     */
    public long nanos() {
        return nanos;
    }

    public Optional<UnixInstant> add(Span span) {
        Objects.requireNonNull(span, "span");
        return wrap(CheckedLong.add(nanos, span.nanos()));
    }

    public Optional<UnixInstant> sub(Span span) {
        Objects.requireNonNull(span, "span");
        return wrap(CheckedLong.sub(nanos, span.nanos()));
    }

    /**
     * Reports whether this instant is strictly after {@code other}.
     */
    public boolean after(UnixInstant other) {
        return nanos > other.nanos;
    }

    /**
     * Reports whether this instant is strictly before {@code other}.
     */
    public boolean before(UnixInstant other) {
        return nanos < other.nanos;
    }

    /**
     * Returns the span {@code this - other}.
     *
     * @return the signed distance from {@code other} to this instant, or empty
     *         if it does not fit in 64 bits
     */
    public Optional<Span> difference(UnixInstant other) {
        Objects.requireNonNull(other, "other");
        final OptionalLong result = CheckedLong.sub(nanos, other.nanos);
        return result.isPresent() ? Optional.of(Span.ofNanos(result.getAsLong())) : Optional.empty();
    }

    /**
     * Splits this instant into epoch seconds and nanosecond-of-second.
     */
    public CalendarTime toCalendarTime() {
        return CalendarTime.ofEpochNanos(nanos);
    }

    /**
     * Converts to a UTC calendar date-time for display and logging.
     *
     * @return the calendar value, or empty if it is out of the calendar range
     */
    public Optional<LocalDateTime> toCalendar() {
        return toCalendarTime().toLocalDateTime();
    }

    /**
     * Converts to a {@link java.time.Instant}. Every value is representable.
     */
    public Instant toJavaInstant() {
        final CalendarTime split = toCalendarTime();
        return Instant.ofEpochSecond(split.epochSecond(), split.nanoOfSecond());
    }

    private static Optional<UnixInstant> wrap(OptionalLong nanos) {
        return nanos.isPresent() ? Optional.of(new UnixInstant(nanos.getAsLong())) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnixInstant that)) return false;
        return nanos == that.nanos;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nanos);
    }

    @Override
    public String toString() {
        return "UnixInstant[" + nanos + "ns]";
    }
}
