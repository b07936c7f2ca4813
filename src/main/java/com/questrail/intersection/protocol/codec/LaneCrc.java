package com.questrail.intersection.protocol.codec;

import java.util.Arrays;

/**
 * LaneCrc
 * -----------------------------------------------------------------------------
 * CRC-16/ARC over the type byte and body of a datagram.
 *
 * <pre>
 *   Width: 16, Polynomial: 0x8005 (reflected 0xA001), INIT: 0x0000,
 *   reflected in/out, XOROUT: 0x0000
 * </pre>
 *
 * The CRC is appended as two bytes, big-endian.
 */
final class LaneCrc
{
    /** Trailer width in bytes. */
    static final int LENGTH = 2;

    private static final int REFLECTED_POLY = 0xA001;

    private LaneCrc() {}

    /**
     * Checks the trailing CRC against the bytes before it. Length checks
     * belong to {@link LaneFrameCodec}; the datagram must hold at least the
     * trailer.
     *
     * @throws CrcException if the computed CRC does not match the transmitted CRC
     */
    static void validate(byte[] datagram) throws CrcException
    {
        final int covered = datagram.length - LENGTH;
        final int transmitted = ((datagram[covered] & 0xFF) << 8) | (datagram[covered + 1] & 0xFF);
        final int computed = compute(datagram, 0, covered);

        if (transmitted != computed) {
            throw new CrcException(String.format(
                    "CRC mismatch: transmitted=0x%04X computed=0x%04X", transmitted, computed));
        }
    }

    static byte[] stripCrc(byte[] datagram)
    {
        return Arrays.copyOf(datagram, datagram.length - LENGTH);
    }

    static byte[] appendCrc(byte[] covered)
    {
        final int crc = compute(covered, 0, covered.length);
        final byte[] out = Arrays.copyOf(covered, covered.length + LENGTH);
        out[covered.length] = (byte) (crc >>> 8);
        out[covered.length + 1] = (byte) crc;
        return out;
    }

    static int compute(byte[] data, int off, int len)
    {
        int crc = 0;
        for (int i = off; i < off + len; i++) {
            crc ^= data[i] & 0xFF;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 1) != 0 ? (crc >>> 1) ^ REFLECTED_POLY : crc >>> 1;
            }
        }
        return crc;
    }
}
