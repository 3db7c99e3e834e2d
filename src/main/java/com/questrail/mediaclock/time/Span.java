package com.questrail.mediaclock.time;

import com.questrail.mediaclock.h264.CodecSpan;
import com.questrail.mediaclock.h264.H264Timescale;
import com.questrail.mediaclock.scale.CheckedLong;
import com.questrail.mediaclock.scale.Timescale;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A signed wall-clock duration in nanoseconds.
 *
 * <p>
 * Unlike {@link java.time.Duration}, a {@code Span} is a single 64-bit count:
 * there is no seconds/nanos pair to normalise and no 96-bit intermediate. The
 * trade-off is range (about &plusmn;292 years), and every operation that could
 * leave that range reports an empty result instead of wrapping.
 * </p>
 *
 * <h2>Unit constructors</h2>
 * <p>
 * {@link #ofMillis}, {@link #ofSeconds}, {@link #ofMinutes} and {@link #ofHours}
 * accept an unsigned 32-bit count ({@code 0}–{@value #MAX_UNIT_COUNT}).
 * Milliseconds and seconds always fit; minutes and hours can exceed the 64-bit
 * range near the top of the input range and so return {@link Optional}.
 * </p>
 */
public final class Span
{
    /**
     * Largest count accepted by the unit constructors.
     */
    public static final long MAX_UNIT_COUNT = 0xFFFF_FFFFL;

    public static final Span ZERO = new Span(0L);

    private final long nanos;

    private Span(long nanos) {
        this.nanos = nanos;
    }

    public static Span ofNanos(long nanos) {
        return nanos == 0L ? ZERO : new Span(nanos);
    }

    public static Span ofMillis(long millis) {
        return new Span(requireUnitCount(millis, "millis") * TimeUnits.MILLISECOND);
    }

    public static Span ofSeconds(long seconds) {
        return new Span(requireUnitCount(seconds, "seconds") * TimeUnits.SECOND);
    }

    public static Optional<Span> ofMinutes(long minutes) {
        return wrap(CheckedLong.mul(requireUnitCount(minutes, "minutes"), TimeUnits.MINUTE));
    }

    public static Optional<Span> ofHours(long hours) {
        return wrap(CheckedLong.mul(requireUnitCount(hours, "hours"), TimeUnits.HOUR));
    }

    /**
     * Creates a span from a floating-point nanosecond count, truncating toward
     * zero. Values beyond the {@code long} range saturate; NaN becomes zero.
     */
    public static Span ofTruncatedNanos(double nanos) {
        return ofNanos((long) nanos);
    }

    /**
     * Returns the span from now until {@code instant}, using the system wall clock.
     *
     * @return {@code instant - now}, negative if {@code instant} has passed, or
     *         empty if the subtraction overflows
     */
    public static Optional<Span> until(UnixInstant instant) {
        return until(instant, SystemWallClock.INSTANCE);
    }

    /**
     * Returns the span from the given clock's current reading until {@code instant}.
     */
    public static Optional<Span> until(UnixInstant instant, WallClock clock) {
        Objects.requireNonNull(instant, "instant");
        return instant.difference(UnixInstant.now(clock));
    }

    /**
     * Returns the raw nanosecond count.
     */
    public long nanos() {
        return nanos;
    }

    public boolean isZero() {
        return nanos == 0L;
    }

    public boolean isNegative() {
        return nanos < 0L;
    }

    public Optional<Span> add(Span other) {
        Objects.requireNonNull(other, "other");
        return wrap(CheckedLong.add(nanos, other.nanos));
    }

    public Optional<Span> sub(Span other) {
        Objects.requireNonNull(other, "other");
        return wrap(CheckedLong.sub(nanos, other.nanos));
    }

    public Optional<Span> negate() {
        return wrap(CheckedLong.negate(nanos));
    }

    /**
     * Converts to 90 kHz codec ticks, rounding toward zero.
     *
     * <p>The tick count is always smaller in magnitude than the nanosecond
     * count, so this conversion cannot fail.</p>
     */
    public CodecSpan asCodecSpan() {
        return CodecSpan.ofTicks(Timescale.nanosToTimescale(nanos, H264Timescale.TIMESCALE));
    }

    /**
     * Converts to a {@link java.time.Duration}.
     *
     * @return the equivalent duration, or empty if this span is negative
     */
    public Optional<Duration> asJavaDuration() {
        if (nanos < 0L) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(nanos));
    }

    private static long requireUnitCount(long count, String name) {
        if (count < 0L || count > MAX_UNIT_COUNT) {
            throw new IllegalArgumentException(
                    name + " must be in range 0–" + MAX_UNIT_COUNT + " (was " + count + ")");
        }
        return count;
    }

    private static Optional<Span> wrap(OptionalLong nanos) {
        return nanos.isPresent() ? Optional.of(ofNanos(nanos.getAsLong())) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span that)) return false;
        return nanos == that.nanos;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(nanos);
    }

    @Override
    public String toString() {
        return "Span[" + nanos + "ns]";
    }
}
