package com.questrail.mediaclock.wire;

import com.questrail.mediaclock.h264.CodecSpan;

import java.util.Objects;

/**
 * Timing of one coded sample as written to a container sample table.
 *
 * @param duration          time until the next sample; must fit an unsigned 32-bit field
 * @param compositionOffset presentation minus decode time; must fit a signed 32-bit field
 */
public record SampleTiming(CodecSpan duration, CodecSpan compositionOffset)
{
    public SampleTiming {
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(compositionOffset, "compositionOffset");
    }
}
