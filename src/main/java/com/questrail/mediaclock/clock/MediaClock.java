package com.questrail.mediaclock.clock;

import com.questrail.mediaclock.h264.CodecInstant;
import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.UnixInstant;
import com.questrail.mediaclock.time.WallClock;

import java.util.Objects;
import java.util.Optional;

/**
 * MediaClock
 * =============================================================================
 * Single point through which a timestamping component reads "now".
 *
 * <h2>Architectural Role</h2>
 * <p>
 * The time types are pure values; the only ambient input is the wall clock.
 * Components that stamp media take a {@code MediaClock} instead of calling
 * {@link UnixInstant#now()} directly, so the clock can be replaced with a
 * deterministic one in tests and so that both units are read from the same
 * source.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>Immutable. Thread safety of {@link #now()} is that of the configured
 * {@link WallClock}.</p>
 */
public final class MediaClock
{
    private final WallClock wallClock;
    private final Span expiryGrace;

    public MediaClock(MediaClockConfig config) {
        Objects.requireNonNull(config, "config");
        this.wallClock = config.wallClock();
        this.expiryGrace = config.expiryGrace();
    }

    /**
     * A clock over the system wall clock with default settings.
     */
    public static MediaClock system() {
        return new MediaClock(MediaClockConfig.defaults());
    }

    public UnixInstant now() {
        return UnixInstant.now(wallClock);
    }

    /**
     * The current time in 90 kHz ticks, derived from the same wall clock reading
     * path as {@link #now()}.
     */
    public CodecInstant codecNow() {
        return CodecInstant.now(wallClock);
    }

    /**
     * Time remaining until {@code deadline}; negative once it has passed.
     */
    public Optional<Span> until(UnixInstant deadline) {
        return Span.until(deadline, wallClock);
    }

    /**
     * Reports whether {@code deadline} plus the configured grace period lies
     * strictly in the past. {@link UnixInstant#MAX} never expires.
     */
    public boolean isExpired(UnixInstant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        if (deadline.equals(UnixInstant.MAX)) {
            return false;
        }
        // A deadline whose grace window runs past the end of the range cannot expire.
        return deadline.add(expiryGrace)
                .map(latest -> now().after(latest))
                .orElse(false);
    }
}
