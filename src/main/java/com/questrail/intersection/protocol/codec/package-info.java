/**
 * Intersection Wire Codec
 * =============================================================================
 *
 * <p>Byte-level layer between a UDP datagram and a semantic
 * {@link com.questrail.intersection.protocol.LaneMessage}.</p>
 *
 * <pre>
 *   byte[] datagram
 *        → LaneFrameCodec       (CRC-16/ARC check, type/body split)
 *            → LaneFrame        (post-CRC, not yet interpreted)
 *                → LaneMessageDecoder
 *                    → LaneRequest / LaneResponse
 * </pre>
 *
 * <h2>Failure classes</h2>
 * <ul>
 *   <li>Framing and CRC defects are transport defects. The frame codec
 *       returns {@code Optional.empty()} and the datagram is dropped.</li>
 *   <li>A CRC-valid frame that cannot be interpreted raises
 *       {@link com.questrail.intersection.protocol.codec.LaneDecodeException}.</li>
 * </ul>
 *
 * All multi-byte fields are big-endian.
 */
package com.questrail.intersection.protocol.codec;
