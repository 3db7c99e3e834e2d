/**
 * Timestamp Wire Format
 * =============================================================================
 *
 * <p>Byte-level encodings of the time types, for the serialization and
 * container-writing layers that sit above this library.</p>
 *
 * <h2>Timestamps</h2>
 * <p>{@link com.questrail.mediaclock.time.UnixInstant} and
 * {@link com.questrail.mediaclock.time.Span} are encoded as their raw
 * nanosecond count: 8 bytes, big-endian, two's complement. The encoding is the
 * in-memory value, so a decode of an encode is always identical to the
 * original.</p>
 *
 * <h2>Sample timing</h2>
 * <p>Container sample tables carry per-sample durations and composition
 * offsets in 32-bit fields. {@link com.questrail.mediaclock.wire.SampleTimingEncoder}
 * narrows {@link com.questrail.mediaclock.h264.CodecSpan} values into those
 * fields and reports, rather than truncates, values that do not fit.</p>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Ports in this package exchange {@code byte[]} only.</li>
 *   <li>Netty buffer types are confined to {@code wire.impl}.</li>
 *   <li>Malformed input yields {@link java.util.Optional#empty()}; it never
 *       throws.</li>
 * </ul>
 */
package com.questrail.mediaclock.wire;
