/**
 * H264 Media Clock Types
 * =============================================================================
 *
 * <p>Instants and durations on the 90 kHz clock that H264 presentation and
 * decode timestamps are expressed in. One tick is 1/90000 of a second.</p>
 *
 * <h2>Crossing the unit boundary</h2>
 * <pre>
 *   Span        → asCodecSpan()     → CodecSpan       (never fails)
 *   UnixInstant → CodecInstant.of() → CodecInstant    (never fails)
 *   CodecSpan   → asNanos()         → OptionalLong    (may overflow)
 *   CodecInstant→ asUnixInstant()   → Optional        (may overflow)
 * </pre>
 *
 * <p>Nanoseconds to ticks shrinks the magnitude, so it cannot overflow. Ticks
 * to nanoseconds grows it by a factor of about 11,111 and is checked. Both
 * directions use the split-then-scale algorithm in
 * {@link com.questrail.mediaclock.scale.Timescale}.</p>
 */
package com.questrail.mediaclock.h264;
