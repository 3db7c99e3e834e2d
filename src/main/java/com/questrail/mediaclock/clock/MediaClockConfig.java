package com.questrail.mediaclock.clock;

import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.SystemWallClock;
import com.questrail.mediaclock.time.WallClock;

import java.util.Objects;

/**
 * MediaClockConfig
 * -----------------------------------------------------------------------------
 * Configuration for a {@link MediaClock}.
 *
 * <ul>
 *   <li><b>wallClock</b>: where "now" comes from. Production uses
 *       {@link SystemWallClock}; tests inject a manual clock.</li>
 *   <li><b>expiryGrace</b>: how long past a deadline an instant is still
 *       considered live by {@link MediaClock#isExpired}. Absorbs small clock
 *       steps between the writer and reader of a deadline.</li>
 * </ul>
 */
public record MediaClockConfig(
        WallClock wallClock,
        Span expiryGrace
) {
    public MediaClockConfig {
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(expiryGrace, "expiryGrace");

        if (expiryGrace.isNegative()) {
            throw new IllegalArgumentException("expiryGrace must be non-negative");
        }
    }

    /**
     * System wall clock, no grace period.
     */
    public static MediaClockConfig defaults() {
        return new MediaClockConfig(SystemWallClock.INSTANCE, Span.ZERO);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Span expiryGrace = Span.ZERO;

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withExpiryGrace(Span expiryGrace) {
            this.expiryGrace = expiryGrace;
            return this;
        }

        public MediaClockConfig build() {
            return new MediaClockConfig(wallClock, expiryGrace);
        }
    }
}
