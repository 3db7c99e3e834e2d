package com.questrail.mediaclock.scale;

import java.util.OptionalLong;

/**
 * CheckedLong
 * -----------------------------------------------------------------------------
 * Signed 64-bit arithmetic that reports overflow and division by zero as an
 * empty result instead of wrapping or throwing.
 *
 * <p>Every time type routes its arithmetic through here, so the empty-on-overflow
 * contract is defined in exactly one place.</p>
 */
public final class CheckedLong
{
    private CheckedLong() {}

    public static OptionalLong add(long a, long b) {
        final long r = a + b;
        // Overflow iff both operands have the same sign and the result's differs.
        if (((a ^ r) & (b ^ r)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(r);
    }

    public static OptionalLong sub(long a, long b) {
        final long r = a - b;
        if (((a ^ b) & (a ^ r)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(r);
    }

    public static OptionalLong mul(long a, long b) {
        final long hi = Math.multiplyHigh(a, b);
        final long lo = a * b;
        // The 128-bit product fits iff the high word is the sign extension of the low word.
        if (hi != (lo >> 63)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(lo);
    }

    /**
     * Truncating division. Empty for {@code b == 0} and for {@code Long.MIN_VALUE / -1}.
     */
    public static OptionalLong div(long a, long b) {
        if (b == 0 || (a == Long.MIN_VALUE && b == -1)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(a / b);
    }

    /**
     * Remainder with the sign of {@code a}. Empty for {@code b == 0} and for
     * {@code Long.MIN_VALUE % -1}.
     */
    public static OptionalLong rem(long a, long b) {
        if (b == 0 || (a == Long.MIN_VALUE && b == -1)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(a % b);
    }

    public static OptionalLong negate(long a) {
        if (a == Long.MIN_VALUE) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(-a);
    }
}
