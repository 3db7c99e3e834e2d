package com.questrail.mediaclock.h264;

/**
 * Constants of the H264 90 kHz media clock.
 */
public final class H264Timescale
{
    /**
     * Ticks per second.
     */
    public static final long TIMESCALE = 90_000L;

    /**
     * One second, in ticks.
     */
    public static final long SECOND = TIMESCALE;

    /**
     * One millisecond, in ticks.
     */
    public static final long MILLISECOND = SECOND / 1_000L;

    private H264Timescale() {}
}
