package com.questrail.mediaclock.h264;

import com.questrail.mediaclock.scale.CheckedLong;
import com.questrail.mediaclock.scale.Timescale;
import com.questrail.mediaclock.time.CalendarTime;
import com.questrail.mediaclock.time.SystemWallClock;
import com.questrail.mediaclock.time.UnixInstant;
import com.questrail.mediaclock.time.WallClock;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * CodecInstant
 * -----------------------------------------------------------------------------
 * A point in time on the 90 kHz H264 clock: ticks since the Unix epoch.
 *
 * <p>Codec samples are stamped with this type. It shares the epoch with
 * {@link UnixInstant}, so the two differ only in resolution.</p>
 */
public final class CodecInstant
{
    private final long ticks;

    private CodecInstant(long ticks) {
        this.ticks = ticks;
    }

    /**
     * Reads the system wall clock and rescales it to ticks.
     */
    public static CodecInstant now() {
        return now(SystemWallClock.INSTANCE);
    }

    /**
     * Reads the given wall clock and rescales it to ticks.
     *
     * @throws com.questrail.mediaclock.time.WallClockCorruptedError if the
     *         reading is not representable
     */
    public static CodecInstant now(WallClock clock) {
        return of(UnixInstant.now(clock));
    }

    /**
     * Converts a wall-clock instant to ticks, rounding toward zero.
     */
    public static CodecInstant of(UnixInstant instant) {
        Objects.requireNonNull(instant, "instant");
        return new CodecInstant(Timescale.nanosToTimescale(instant.nanos(), H264Timescale.TIMESCALE));
    }

    public static CodecInstant ofTicks(long ticks) {
        return new CodecInstant(ticks);
    }

    /**
     * Returns the raw tick count since the epoch.
     */
    public long ticks() {
        return ticks;
    }

    public Optional<CodecInstant> add(CodecSpan span) {
        Objects.requireNonNull(span, "span");
        return wrap(CheckedLong.add(ticks, span.ticks()));
    }

    public Optional<CodecInstant> sub(CodecSpan span) {
        Objects.requireNonNull(span, "span");
        return wrap(CheckedLong.sub(ticks, span.ticks()));
    }

    /**
     * Returns the span {@code this - other}.
     */
    public Optional<CodecSpan> difference(CodecInstant other) {
        Objects.requireNonNull(other, "other");
        final OptionalLong result = CheckedLong.sub(ticks, other.ticks);
        return result.isPresent() ? Optional.of(CodecSpan.ofTicks(result.getAsLong())) : Optional.empty();
    }

    /**
     * Reports whether this instant is strictly after {@code other}.
     */
    public boolean after(CodecInstant other) {
        return ticks > other.ticks;
    }

    /**
     * Reports whether this instant is strictly before {@code other}.
     */
    public boolean before(CodecInstant other) {
        return ticks < other.ticks;
    }

    /**
     * Converts back to wall-clock nanoseconds.
     *
     * <p>Whole seconds and the remaining ticks are scaled separately. The
     * result is exact when the tick count is a multiple of 9 (a whole number of
     * 100 µs steps) and otherwise rounds toward zero.</p>
     *
     * @return the wall-clock instant, or empty if it lies outside the 64-bit
     *         nanosecond range
     */
    public Optional<UnixInstant> asUnixInstant() {
        final OptionalLong nanos = Timescale.timescaleToNanos(ticks, H264Timescale.TIMESCALE);
        return nanos.isPresent() ? Optional.of(UnixInstant.ofNanos(nanos.getAsLong())) : Optional.empty();
    }

    /**
     * Splits into epoch seconds and nanosecond-of-second.
     *
     * @return the split, or empty if the instant has no nanosecond representation
     */
    public Optional<CalendarTime> toCalendarTime() {
        return asUnixInstant().map(UnixInstant::toCalendarTime);
    }

    /**
     * Converts to a UTC calendar date-time for display and logging.
     */
    public Optional<LocalDateTime> toCalendar() {
        return toCalendarTime().flatMap(CalendarTime::toLocalDateTime);
    }

    private static Optional<CodecInstant> wrap(OptionalLong ticks) {
        return ticks.isPresent() ? Optional.of(new CodecInstant(ticks.getAsLong())) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodecInstant that)) return false;
        return ticks == that.ticks;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(ticks);
    }

    @Override
    public String toString() {
        return "CodecInstant[" + ticks + " ticks]";
    }
}
