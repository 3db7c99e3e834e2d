package com.questrail.mediaclock.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the current wall-clock time.
 *
 * <p>
 * This is the only non-deterministic input to the time types. Production code
 * reads {@link SystemWallClock}; tests supply a fixed or manually advanced
 * implementation so that {@link UnixInstant#now(WallClock)} and friends become
 * deterministic.
 * </p>
 *
 * <p>
 * The reading may jump due to NTP or manual adjustments. The time types do not
 * compensate for that; they only require the reading to lie at or after the
 * Unix epoch and to fit in a signed 64-bit nanosecond count.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
