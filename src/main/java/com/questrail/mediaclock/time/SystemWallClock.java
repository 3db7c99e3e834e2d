package com.questrail.mediaclock.time;

import java.time.Clock;
import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by the UTC system clock.
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe. {@link Clock#systemUTC()} is inherently
 * safe for concurrent access.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    private final Clock clock = Clock.systemUTC();

    @Override
    public Instant now() {
        return clock.instant();
    }
}
