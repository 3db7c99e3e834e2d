package com.questrail.mediaclock.time;

import java.time.Instant;

/**
 * Raised when a {@link WallClock} reports a time the time types cannot
 * represent: a moment before the Unix epoch, or one too far in the future for a
 * signed 64-bit nanosecond count.
 *
 * <p>
 * This is an environment failure, not an ordinary error. It extends
 * {@link Error} so that ordinary {@code catch (Exception e)} handlers do not
 * absorb it.
 * </p>
 */
public final class WallClockCorruptedError extends Error
{
    private final Instant reading;

    public WallClockCorruptedError(String message, Instant reading) {
        super(message + " (clock reported " + reading + ")");
        this.reading = reading;
    }

    public WallClockCorruptedError(String message, Instant reading, Throwable cause) {
        super(message + " (clock reported " + reading + ")", cause);
        this.reading = reading;
    }

    /**
     * The offending clock reading.
     */
    public Instant reading() {
        return reading;
    }
}
