package com.questrail.mediaclock.wire;

import java.util.Optional;

/**
 * SampleTimingEncoder
 * -----------------------------------------------------------------------------
 * Encodes {@link SampleTiming} into a pair of 32-bit big-endian fields:
 *
 * <pre>
 *   bytes 0..3 : sample duration           (unsigned 32-bit ticks)
 *   bytes 4..7 : sample composition offset (signed 32-bit ticks)
 * </pre>
 */
public interface SampleTimingEncoder
{
    int ENCODED_LENGTH = 2 * Integer.BYTES;

    /**
     * @return the 8 encoded bytes, or {@link Optional#empty()} if either value
     *         does not fit its 32-bit field
     */
    Optional<byte[]> encode(SampleTiming timing);
}
