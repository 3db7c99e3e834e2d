package com.questrail.mediaclock.scale;

import java.util.OptionalLong;

/**
 * Timescale
 * =============================================================================
 * Overflow-safe conversion between fixed-rate clocks.
 *
 * <h2>Split-then-scale</h2>
 * <p>
 * Converting a count {@code v} at rate {@code from} into rate {@code to} by
 * computing {@code v * to / from} overflows a signed 64-bit integer long before
 * {@code v} itself is large: a nanosecond timestamp of a few months multiplied
 * by 90,000 is already out of range. Every conversion here therefore splits the
 * value into whole seconds and a sub-second remainder first:
 * </p>
 *
 * <pre>
 *   whole     = v / from          (truncating, same sign as v)
 *   remainder = v % from          (|remainder| &lt; from)
 *   result    = whole * to + (remainder * to) / from
 * </pre>
 *
 * <p>
 * Only the remainder is multiplied by the target rate, and the remainder is
 * strictly smaller than one second. The result rounds toward zero, and is exact
 * whenever {@code v} is a whole number of target units.
 * </p>
 *
 * <h2>Layering note</h2>
 * <p>This class is a dependency-free leaf. It knows nothing about instants,
 * spans or the H264 clock; those types delegate here.</p>
 */
public final class Timescale
{
    /**
     * Nanoseconds per second; the rate of the wall clock.
     */
    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Timescale() {}

    /**
     * Converts a nanosecond count into {@code timescale} ticks per second.
     *
     * <p>For any {@code nanos} and any {@code timescale} in
     * {@code (0, NANOS_PER_SECOND]} the result magnitude is no larger than the
     * input, and the intermediate {@code remainder * timescale} is below
     * {@code 10^18}, so this conversion cannot overflow.</p>
     *
     * @param nanos     nanoseconds, any sign
     * @param timescale target ticks per second
     * @return {@code nanos} expressed in the target timescale, rounded toward zero
     * @throws IllegalArgumentException if {@code timescale} is not in {@code (0, 10^9]}
     */
    public static long nanosToTimescale(long nanos, long timescale) {
        requireRate(timescale, "timescale");
        if (timescale > NANOS_PER_SECOND) {
            throw new IllegalArgumentException(
                    "timescale must not exceed " + NANOS_PER_SECOND + " (was " + timescale + ")");
        }
        final long whole = nanos / NANOS_PER_SECOND;
        final long remainder = nanos % NANOS_PER_SECOND;
        return (whole * timescale) + (remainder * timescale / NANOS_PER_SECOND);
    }

    /**
     * Converts a tick count at {@code timescale} ticks per second back into
     * nanoseconds.
     *
     * <p>This direction grows the magnitude, so the whole-second product may not
     * fit in 64 bits. That case is reported as an empty result.</p>
     *
     * @param ticks     tick count, any sign
     * @param timescale source ticks per second
     * @return nanoseconds rounded toward zero, or empty on overflow
     */
    public static OptionalLong timescaleToNanos(long ticks, long timescale) {
        return rescale(ticks, timescale, NANOS_PER_SECOND);
    }

    /**
     * Converts {@code value} from {@code fromRate} to {@code toRate} units per
     * second using the split-then-scale algorithm with every multiplication and
     * addition checked.
     *
     * @param value    the count to convert
     * @param fromRate units per second of {@code value}
     * @param toRate   units per second of the result
     * @return the converted count rounded toward zero, or empty if any step
     *         overflows a signed 64-bit integer
     * @throws IllegalArgumentException if either rate is not positive
     */
    public static OptionalLong rescale(long value, long fromRate, long toRate) {
        requireRate(fromRate, "fromRate");
        requireRate(toRate, "toRate");

        final long whole = value / fromRate;
        final long remainder = value % fromRate;
        final OptionalLong scaledWhole = CheckedLong.mul(whole, toRate);
        final OptionalLong scaledRemainder = CheckedLong.mul(remainder, toRate);
        if (scaledWhole.isEmpty() || scaledRemainder.isEmpty()) {
            return OptionalLong.empty();
        }
        return CheckedLong.add(scaledWhole.getAsLong(), scaledRemainder.getAsLong() / fromRate);
    }

    private static void requireRate(long rate, String name) {
        if (rate <= 0) {
            throw new IllegalArgumentException(name + " must be positive (was " + rate + ")");
        }
    }
}
