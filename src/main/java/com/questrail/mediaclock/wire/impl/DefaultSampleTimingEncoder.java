package com.questrail.mediaclock.wire.impl;

import com.questrail.mediaclock.wire.SampleTiming;
import com.questrail.mediaclock.wire.SampleTimingEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * DefaultSampleTimingEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SampleTimingEncoder}.
 *
 * <p>Both fields are narrowed before anything is written, so a failed encode
 * never produces a partial record.</p>
 */
public final class DefaultSampleTimingEncoder implements SampleTimingEncoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultSampleTimingEncoder.class);

    @Override
    public Optional<byte[]> encode(SampleTiming timing) {
        Objects.requireNonNull(timing, "timing");

        final OptionalLong duration = timing.duration().toUint32();
        if (duration.isEmpty()) {
            log.debug("Sample duration {} does not fit an unsigned 32-bit field", timing.duration());
            return Optional.empty();
        }
        final OptionalInt offset = timing.compositionOffset().toInt32();
        if (offset.isEmpty()) {
            log.debug("Composition offset {} does not fit a signed 32-bit field", timing.compositionOffset());
            return Optional.empty();
        }

        final ByteBuf buf = Unpooled.buffer(ENCODED_LENGTH, ENCODED_LENGTH);
        try {
            buf.writeInt((int) duration.getAsLong());
            buf.writeInt(offset.getAsInt());
            final byte[] out = new byte[ENCODED_LENGTH];
            buf.readBytes(out);
            return Optional.of(out);
        } finally {
            buf.release();
        }
    }
}
