package com.questrail.mediaclock.h264;

import com.questrail.mediaclock.time.ManualWallClock;
import com.questrail.mediaclock.time.UnixInstant;
import com.questrail.mediaclock.time.WallClockCorruptedError;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CodecInstantTest {

    @Test
    void nowIsTheWallClockInTicks() {
        ManualWallClock clock = new ManualWallClock(Instant.ofEpochSecond(1_700_000_000L, 500_000_000));

        assertEquals(153_000_000_045_000L, CodecInstant.now(clock).ticks());
    }

    @Test
    void nowPropagatesClockCorruption() {
        ManualWallClock clock = new ManualWallClock(Instant.EPOCH.minusSeconds(1));

        assertThrows(WallClockCorruptedError.class, () -> CodecInstant.now(clock));
    }

    @Test
    void systemNowAgreesWithWallClockUnits() {
        CodecInstant before = CodecInstant.of(UnixInstant.now());
        CodecInstant now = CodecInstant.now();
        assertFalse(now.before(before));
    }

    @Test
    void addAndSubAreChecked() {
        CodecInstant t = CodecInstant.ofTicks(90_000L);

        assertEquals(Optional.of(CodecInstant.ofTicks(93_000L)), t.add(CodecSpan.ofTicks(3_000L)));
        assertEquals(Optional.of(CodecInstant.ofTicks(87_000L)), t.sub(CodecSpan.ofTicks(3_000L)));
        assertTrue(CodecInstant.ofTicks(Long.MAX_VALUE).add(CodecSpan.ofTicks(1L)).isEmpty());
        assertTrue(CodecInstant.ofTicks(Long.MIN_VALUE).sub(CodecSpan.ofTicks(1L)).isEmpty());
    }

    @Test
    void differenceOfInstantsIsASpan() {
        CodecInstant pts = CodecInstant.ofTicks(96_000L);
        CodecInstant dts = CodecInstant.ofTicks(90_000L);

        assertEquals(Optional.of(CodecSpan.ofTicks(6_000L)), pts.difference(dts));
        assertEquals(Optional.of(CodecSpan.ofTicks(-6_000L)), dts.difference(pts));
        assertTrue(CodecInstant.ofTicks(Long.MAX_VALUE).difference(CodecInstant.ofTicks(-1L)).isEmpty());
    }

    @Test
    void ordering() {
        CodecInstant a = CodecInstant.ofTicks(1L);
        CodecInstant b = CodecInstant.ofTicks(2L);

        assertTrue(b.after(a));
        assertTrue(a.before(b));
        assertFalse(a.after(a));
        assertFalse(a.before(a));
    }

    @Test
    void convertsBackToWallClock() {
        CodecInstant t = CodecInstant.ofTicks(153_000_000_045_000L);

        assertEquals(Optional.of(UnixInstant.ofNanos(1_700_000_000_500_000_000L)), t.asUnixInstant());
    }

    @Test
    void wallClockRoundTripStaysWithinOneTick() {
        UnixInstant original = UnixInstant.ofNanos(1_700_000_000_123_456_789L);

        UnixInstant back = CodecInstant.of(original).asUnixInstant().orElseThrow();

        long drift = original.difference(back).orElseThrow().nanos();
        assertTrue(drift >= 0 && drift <= 11_111L, "drift " + drift);
    }

    @Test
    void conversionBackReportsOverflow() {
        assertTrue(CodecInstant.ofTicks(Long.MAX_VALUE).asUnixInstant().isEmpty());
        assertTrue(CodecInstant.ofTicks(Long.MAX_VALUE).toCalendar().isEmpty());
    }

    @Test
    void calendarConversion() {
        CodecInstant t = CodecInstant.ofTicks(153_000_000_045_000L);

        assertEquals(Optional.of(LocalDateTime.of(2023, 11, 14, 22, 13, 20, 500_000_000)), t.toCalendar());
    }

    @Test
    void ofUnixInstantCoversTheWholeRange() {
        assertEquals(830_103_483_316_929L, CodecInstant.of(UnixInstant.MAX).ticks());
    }
}
