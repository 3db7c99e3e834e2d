package com.questrail.mediaclock.time;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Broken-down form of a wall-clock instant: whole seconds since the epoch and
 * the nanosecond-of-second.
 *
 * <p>{@code nanoOfSecond} is always in {@code [0, 999_999_999]}; for instants
 * before the epoch {@code epochSecond} is rounded down, so
 * {@code -1 ns} is {@code (-1, 999_999_999)}.</p>
 */
public record CalendarTime(long epochSecond, int nanoOfSecond)
{
    public CalendarTime {
        if (nanoOfSecond < 0 || nanoOfSecond >= TimeUnits.SECOND) {
            throw new IllegalArgumentException(
                    "nanoOfSecond must be in range 0–999999999 (was " + nanoOfSecond + ")");
        }
    }

    /**
     * Splits a nanosecond count since the epoch.
     */
    public static CalendarTime ofEpochNanos(long nanos) {
        return new CalendarTime(
                Math.floorDiv(nanos, TimeUnits.SECOND),
                (int) Math.floorMod(nanos, TimeUnits.SECOND));
    }

    /**
     * Converts to a UTC {@link LocalDateTime}.
     *
     * @return the calendar date-time, or empty if {@code java.time} cannot
     *         represent it
     */
    public Optional<LocalDateTime> toLocalDateTime() {
        try {
            return Optional.of(LocalDateTime.ofEpochSecond(epochSecond, nanoOfSecond, ZoneOffset.UTC));
        } catch (DateTimeException outOfRange) {
            return Optional.empty();
        }
    }
}
