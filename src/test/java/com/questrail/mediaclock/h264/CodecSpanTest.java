package com.questrail.mediaclock.h264;

import com.questrail.mediaclock.time.Span;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CodecSpanTest
 * -----------------------------------------------------------------------------
 * Checked tick arithmetic, unit conversions and 32-bit narrowing.
 */
class CodecSpanTest {

    private static CodecSpan ticks(long t) {
        return CodecSpan.ofTicks(t);
    }

    @Test
    void arithmeticInRange() {
        assertEquals(Optional.of(ticks(4_500L)), ticks(3_000L).add(ticks(1_500L)));
        assertEquals(Optional.of(ticks(-1_500L)), ticks(1_500L).sub(ticks(3_000L)));
        assertEquals(Optional.of(ticks(90_000L)), ticks(3_000L).mul(ticks(30L)));
        assertEquals(Optional.of(ticks(30L)), ticks(90_000L).div(ticks(3_000L)));
        assertEquals(Optional.of(ticks(1_000L)), ticks(10_000L).rem(ticks(3_000L)));
    }

    @Test
    void arithmeticReportsOverflow() {
        assertTrue(ticks(Long.MAX_VALUE).add(ticks(1L)).isEmpty());
        assertTrue(ticks(Long.MIN_VALUE).sub(ticks(1L)).isEmpty());
        assertTrue(ticks(Long.MAX_VALUE / 2 + 1).mul(ticks(2L)).isEmpty());
        assertTrue(ticks(Long.MIN_VALUE).div(ticks(-1L)).isEmpty());
        assertTrue(ticks(Long.MIN_VALUE).rem(ticks(-1L)).isEmpty());
    }

    @Test
    void divisionByZeroIsEmpty() {
        assertTrue(ticks(3_000L).div(CodecSpan.ZERO).isEmpty());
        assertTrue(ticks(3_000L).rem(CodecSpan.ZERO).isEmpty());
    }

    @Test
    void frameDurationAccumulation() {
        // 30 fps: 3000 ticks per frame
        CodecSpan frame = ticks(3_000L);
        CodecSpan total = CodecSpan.ZERO;
        for (int i = 0; i < 30; i++) {
            total = total.add(frame).orElseThrow();
        }
        assertEquals(ticks(H264Timescale.SECOND), total);
        assertEquals(1_000L, total.asMillis());
    }

    @Test
    void isZero() {
        assertTrue(CodecSpan.ZERO.isZero());
        assertTrue(ticks(0L).isZero());
        assertFalse(ticks(-1L).isZero());
    }

    @Test
    void secondsFloat() {
        assertEquals(1.5, ticks(135_000L).asSecondsFloat(), 1e-12);
        assertEquals(-0.5, ticks(-45_000L).asSecondsFloat(), 1e-12);
        assertEquals(0.0, CodecSpan.ZERO.asSecondsFloat());
    }

    @Test
    void millis() {
        assertEquals(1L, ticks(H264Timescale.MILLISECOND).asMillis());
        assertEquals(0L, ticks(89L).asMillis());
        assertEquals(-1L, ticks(-90L).asMillis());
        assertEquals(102_481_911_520_608_620L, ticks(Long.MAX_VALUE).asMillis());
    }

    @Test
    void nanos() {
        assertEquals(OptionalLong.of(1_000_000_000L), ticks(90_000L).asNanos());
        assertEquals(OptionalLong.of(11_111L), ticks(1L).asNanos());
        assertEquals(OptionalLong.of(100_000L), ticks(9L).asNanos());
        assertTrue(ticks(Long.MAX_VALUE).asNanos().isEmpty());
    }

    @Test
    void asSpanIsExactForWholeSeconds() {
        assertEquals(Optional.of(Span.ofSeconds(300)), ticks(27_000_000L).asSpan());
        assertTrue(ticks(Long.MIN_VALUE).asSpan().isEmpty());
    }

    @Test
    void narrowingToInt32() {
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), ticks(Integer.MAX_VALUE).toInt32());
        assertEquals(OptionalInt.of(Integer.MIN_VALUE), ticks(Integer.MIN_VALUE).toInt32());
        assertEquals(OptionalInt.of(-3_000), ticks(-3_000L).toInt32());
        assertTrue(ticks(Integer.MAX_VALUE + 1L).toInt32().isEmpty());
        assertTrue(ticks(Integer.MIN_VALUE - 1L).toInt32().isEmpty());
    }

    @Test
    void narrowingToUint32() {
        assertEquals(OptionalLong.of(0L), CodecSpan.ZERO.toUint32());
        assertEquals(OptionalLong.of(4_294_967_295L), ticks(4_294_967_295L).toUint32());
        assertTrue(ticks(4_294_967_296L).toUint32().isEmpty());
        assertTrue(ticks(-1L).toUint32().isEmpty());
    }

    @Test
    void orderedByTicks() {
        assertTrue(ticks(1L).compareTo(ticks(2L)) < 0);
        assertTrue(ticks(2L).compareTo(ticks(1L)) > 0);
        assertEquals(0, ticks(5L).compareTo(ticks(5L)));
    }

    @Test
    void ofInstantCarriesTicksSinceEpoch() {
        assertEquals(ticks(123L), CodecSpan.ofInstant(CodecInstant.ofTicks(123L)));
    }
}
