package com.questrail.mediaclock.wire.impl;

import com.questrail.mediaclock.time.Span;
import com.questrail.mediaclock.time.UnixInstant;
import com.questrail.mediaclock.wire.TimestampEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * Int64TimestampEncoder
 * -----------------------------------------------------------------------------
 * Writes the raw nanosecond count as a big-endian signed 64-bit integer.
 */
public final class Int64TimestampEncoder implements TimestampEncoder
{
    @Override
    public byte[] encode(UnixInstant instant) {
        Objects.requireNonNull(instant, "instant");
        return encodeLong(instant.nanos());
    }

    @Override
    public byte[] encode(Span span) {
        Objects.requireNonNull(span, "span");
        return encodeLong(span.nanos());
    }

    private static byte[] encodeLong(long value) {
        final ByteBuf buf = Unpooled.buffer(ENCODED_LENGTH, ENCODED_LENGTH);
        try {
            buf.writeLong(value);
            final byte[] out = new byte[ENCODED_LENGTH];
            buf.readBytes(out);
            return out;
        } finally {
            buf.release();
        }
    }
}
