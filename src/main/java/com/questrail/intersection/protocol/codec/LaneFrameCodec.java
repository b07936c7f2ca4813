package com.questrail.intersection.protocol.codec;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * LaneFrameCodec
 * -----------------------------------------------------------------------------
 * Byte-level boundary between a datagram payload and a {@link LaneFrame}.
 *
 * <pre>
 *   datagram = type(1) | body(n) | crc16(2)
 * </pre>
 *
 * <p>All failures at this layer are classified as transport defects: the
 * decoder returns {@link Optional#empty()} and the datagram is dropped.</p>
 */
public final class LaneFrameCodec
{
    /** type byte + CRC */
    static final int MIN_DATAGRAM_LENGTH = 1 + LaneCrc.LENGTH;

    public byte[] encode(LaneFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        byte[] body = frame.body();
        byte[] unprotected = new byte[body.length + 1];
        unprotected[0] = (byte) frame.type();
        System.arraycopy(body, 0, unprotected, 1, body.length);
        return LaneCrc.appendCrc(unprotected);
    }

    /**
     * Attempt to decode a single frame from a complete datagram payload.
     *
     * @return the frame if the datagram is well-formed; empty if it is
     *         truncated or corrupt
     */
    public Optional<LaneFrame> decode(byte[] datagram)
    {
        try {
            if (datagram == null || datagram.length < MIN_DATAGRAM_LENGTH) {
                throw new FramingException("datagram too short");
            }
            LaneCrc.validate(datagram);
            byte[] stripped = LaneCrc.stripCrc(datagram);

            int type = stripped[0] & 0xFF;
            byte[] body = Arrays.copyOfRange(stripped, 1, stripped.length);
            return Optional.of(new LaneFrame(type, body));
        }
        catch (FramingException | CrcException e) {
            return Optional.empty();
        }
    }
}
