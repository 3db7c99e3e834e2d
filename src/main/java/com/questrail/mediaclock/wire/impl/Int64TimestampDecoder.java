package com.questrail.mediaclock.wire.impl;

import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.UnixInstant;
import com.questrail.mediaclock.wire.TimestampDecoder;
import com.questrail.mediaclock.wire.TimestampEncoder;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Int64TimestampDecoder
 * -----------------------------------------------------------------------------
 * Reads a big-endian signed 64-bit nanosecond count written by
 * {@link Int64TimestampEncoder}.
 *
 * <p>Wrong-length input is a framing defect in the layer above; it is logged
 * at DEBUG and reported as an empty result.</p>
 */
public final class Int64TimestampDecoder implements TimestampDecoder
{
    private static final Logger log = LoggerFactory.getLogger(Int64TimestampDecoder.class);

    @Override
    public Optional<UnixInstant> decodeInstant(byte[] bytes) {
        final OptionalLong nanos = decodeLong(bytes);
        return nanos.isPresent() ? Optional.of(UnixInstant.ofNanos(nanos.getAsLong())) : Optional.empty();
    }

    @Override
    public Optional<Span> decodeSpan(byte[] bytes) {
        final OptionalLong nanos = decodeLong(bytes);
        return nanos.isPresent() ? Optional.of(Span.ofNanos(nanos.getAsLong())) : Optional.empty();
    }

    private static OptionalLong decodeLong(byte[] bytes) {
        if (bytes == null || bytes.length != TimestampEncoder.ENCODED_LENGTH) {
            log.debug("Dropping timestamp of length {}, expected {}",
                    bytes == null ? "null" : bytes.length,
                    TimestampEncoder.ENCODED_LENGTH);
            return OptionalLong.empty();
        }
        // Wrapped buffers are unpooled heap views; nothing to release.
        return OptionalLong.of(Unpooled.wrappedBuffer(bytes).readLong());
    }
}
