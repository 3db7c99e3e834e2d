package com.questrail.mediaclock.wire;

import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.UnixInstant;

import java.util.Optional;

/**
 * TimestampDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary from wire bytes to wall-clock time values.
 *
 * <p>Each call receives exactly one encoded value. Input of any length other
 * than {@link TimestampEncoder#ENCODED_LENGTH} is rejected; the decoder does not
 * buffer partial input across calls.</p>
 */
public interface TimestampDecoder
{
    /**
     * @return the decoded instant, or {@link Optional#empty()} if {@code bytes}
     *         is null or not exactly 8 bytes long
     */
    Optional<UnixInstant> decodeInstant(byte[] bytes);

    /**
     * @return the decoded span, or {@link Optional#empty()} if {@code bytes}
     *         is null or not exactly 8 bytes long
     */
    Optional<Span> decodeSpan(byte[] bytes);
}
