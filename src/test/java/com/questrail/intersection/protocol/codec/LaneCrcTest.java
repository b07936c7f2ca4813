package com.questrail.intersection.protocol.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LaneCrcTest
 * -----------------------------------------------------------------------------
 * CRC-16/ARC: polynomial 0x8005 (reflected 0xA001), init 0x0000, reflected
 * input/output, no final XOR, appended big-endian.
 */
final class LaneCrcTest
{
    @Test
    void matchesStandardCheckValue()
    {
        byte[] check = "123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0xBB3D, LaneCrc.compute(check, 0, check.length));
    }

    @Test
    void appendedCrcValidates()
    {
        byte[] withCrc = LaneCrc.appendCrc(new byte[] {0x01, 0x02, 0x41});
        assertEquals(5, withCrc.length);
        assertDoesNotThrow(() -> LaneCrc.validate(withCrc));
    }

    @Test
    void appendIsBigEndian()
    {
        byte[] check = "123456789".getBytes(StandardCharsets.US_ASCII);
        byte[] withCrc = LaneCrc.appendCrc(check);
        assertEquals((byte) 0xBB, withCrc[withCrc.length - 2]);
        assertEquals((byte) 0x3D, withCrc[withCrc.length - 1]);
    }

    @Test
    void corruptedPayloadFails()
    {
        byte[] withCrc = LaneCrc.appendCrc(new byte[] {0x01, 0x00});
        withCrc[1] ^= 0x10;
        assertThrows(CrcException.class, () -> LaneCrc.validate(withCrc));
    }

    @Test
    void stripRemovesTrailingTwoBytes()
    {
        byte[] withCrc = LaneCrc.appendCrc(new byte[] {0x02});
        assertArrayEquals(new byte[] {0x02}, LaneCrc.stripCrc(withCrc));
    }
}
