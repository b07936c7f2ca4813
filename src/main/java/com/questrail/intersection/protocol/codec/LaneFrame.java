package com.questrail.intersection.protocol.codec;

/**
 * LaneFrame
 * -----------------------------------------------------------------------------
 * A datagram after its CRC has been validated and stripped: a type byte and
 * an opaque body.
 *
 * It is still <em>not</em> a semantic message; only
 * {@link LaneMessageDecoder} interprets the body.
 *
 * Immutability is enforced via defensive copying.
 */
public final class LaneFrame
{
    private final int type;
    private final byte[] body;

    public LaneFrame(int type, byte[] body) {
        if (type < 0 || type > 0xFF) {
            throw new IllegalArgumentException("type must be 0-255: " + type);
        }
        this.type = type;
        this.body = (body == null) ? new byte[0] : body.clone();
    }

    /**
     * Returns the unsigned message type byte.
     */
    public int type() {
        return type;
    }

    public byte[] body() {
        return body.clone();
    }

    @Override
    public String toString() {
        return "LaneFrame[type=0x" + Integer.toHexString(type) +
                ", bodyLength=" + body.length +
                ']';
    }
}
