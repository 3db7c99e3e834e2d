package com.questrail.mediaclock.wire;

import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.UnixInstant;

/**
 * TimestampEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary from wall-clock time values to their wire bytes.
 */
public interface TimestampEncoder
{
    /**
     * Number of bytes produced by each encode call.
     */
    int ENCODED_LENGTH = Long.BYTES;

    byte[] encode(UnixInstant instant);

    byte[] encode(Span span);
}
