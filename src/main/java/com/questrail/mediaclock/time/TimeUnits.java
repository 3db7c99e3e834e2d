package com.questrail.mediaclock.time;

/**
 * Wall-clock unit sizes, expressed in nanoseconds.
 */
public final class TimeUnits
{
    public static final long NANOSECOND = 1L;
    public static final long MICROSECOND = NANOSECOND * 1_000L;
    public static final long MILLISECOND = MICROSECOND * 1_000L;
    public static final long SECOND = MILLISECOND * 1_000L;
    public static final long MINUTE = SECOND * 60L;
    public static final long HOUR = MINUTE * 60L;

    private TimeUnits() {}
}
