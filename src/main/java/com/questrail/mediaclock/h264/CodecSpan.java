package com.questrail.mediaclock.h264;

import com.questrail.mediaclock.scale.CheckedLong;
import com.questrail.mediaclock.scale.Timescale;
import com.questrail.mediaclock.time.Span;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * CodecSpan
 * -----------------------------------------------------------------------------
 * A signed duration in 90 kHz ticks.
 *
 * <p>Frame durations, PTS/DTS offsets and sample timing are computed in this
 * unit. All arithmetic is checked: overflow, division by zero and
 * {@code Long.MIN_VALUE / -1} produce an empty result.</p>
 *
 * <p>Container fields are frequently 32 bits wide; {@link #toInt32()} and
 * {@link #toUint32()} narrow with an explicit failure when the tick count does
 * not fit.</p>
 */
public final class CodecSpan implements Comparable<CodecSpan>
{
    public static final CodecSpan ZERO = new CodecSpan(0L);

    /**
     * Largest value accepted by a 32-bit unsigned field.
     */
    static final long UINT32_MAX = 0xFFFF_FFFFL;

    private static final long MILLIS_PER_SECOND = 1_000L;

    private final long ticks;

    private CodecSpan(long ticks) {
        this.ticks = ticks;
    }

    public static CodecSpan ofTicks(long ticks) {
        return ticks == 0L ? ZERO : new CodecSpan(ticks);
    }

    /**
     * The ticks elapsed between the epoch and {@code instant}.
     */
    public static CodecSpan ofInstant(CodecInstant instant) {
        Objects.requireNonNull(instant, "instant");
        return ofTicks(instant.ticks());
    }

    /**
     * Returns the raw tick count.
     */
    public long ticks() {
        return ticks;
    }

    public boolean isZero() {
        return ticks == 0L;
    }

    public Optional<CodecSpan> add(CodecSpan rhs) {
        Objects.requireNonNull(rhs, "rhs");
        return wrap(CheckedLong.add(ticks, rhs.ticks));
    }

    public Optional<CodecSpan> sub(CodecSpan rhs) {
        Objects.requireNonNull(rhs, "rhs");
        return wrap(CheckedLong.sub(ticks, rhs.ticks));
    }

    public Optional<CodecSpan> mul(CodecSpan rhs) {
        Objects.requireNonNull(rhs, "rhs");
        return wrap(CheckedLong.mul(ticks, rhs.ticks));
    }

    public Optional<CodecSpan> div(CodecSpan rhs) {
        Objects.requireNonNull(rhs, "rhs");
        return wrap(CheckedLong.div(ticks, rhs.ticks));
    }

    public Optional<CodecSpan> rem(CodecSpan rhs) {
        Objects.requireNonNull(rhs, "rhs");
        return wrap(CheckedLong.rem(ticks, rhs.ticks));
    }

    /**
     * Seconds as a double. Lossy; for logging and metrics only.
     */
    public double asSecondsFloat() {
        final long whole = ticks / H264Timescale.SECOND;
        final long remainder = ticks % H264Timescale.SECOND;
        return (double) whole + (double) remainder / (double) H264Timescale.SECOND;
    }

    /**
     * Whole milliseconds, rounded toward zero.
     *
     * <p>A millisecond is 90 ticks, so the result is always smaller in magnitude
     * than the tick count and cannot overflow.</p>
     */
    public long asMillis() {
        return Timescale.rescale(ticks, H264Timescale.TIMESCALE, MILLIS_PER_SECOND).orElseThrow();
    }

    /**
     * Nanoseconds, rounded toward zero.
     *
     * @return the nanosecond count, or empty when it exceeds the 64-bit range
     *         (tick counts beyond roughly &plusmn;8.3&times;10^14)
     */
    public OptionalLong asNanos() {
        return Timescale.timescaleToNanos(ticks, H264Timescale.TIMESCALE);
    }

    /**
     * Converts back to a wall-clock span.
     *
     * @return the span, or empty when the nanosecond count exceeds the 64-bit range
     */
    public Optional<Span> asSpan() {
        final OptionalLong nanos = asNanos();
        return nanos.isPresent() ? Optional.of(Span.ofNanos(nanos.getAsLong())) : Optional.empty();
    }

    /**
     * Narrows to a signed 32-bit field.
     */
    public OptionalInt toInt32() {
        if (ticks < Integer.MIN_VALUE || ticks > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) ticks);
    }

    /**
     * Narrows to an unsigned 32-bit field.
     *
     * @return the tick count in {@code [0, 4294967295]}, or empty if negative or
     *         too large
     */
    public OptionalLong toUint32() {
        if (ticks < 0L || ticks > UINT32_MAX) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(ticks);
    }

    private static Optional<CodecSpan> wrap(OptionalLong ticks) {
        return ticks.isPresent() ? Optional.of(ofTicks(ticks.getAsLong())) : Optional.empty();
    }

    @Override
    public int compareTo(CodecSpan o) {
        return Long.compare(ticks, o.ticks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodecSpan that)) return false;
        return ticks == that.ticks;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(ticks);
    }

    @Override
    public String toString() {
        return "CodecSpan[" + ticks + " ticks]";
    }
}
