package com.questrail.intersection.protocol.codec;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class LaneFrameCodecTest
{
    private final LaneFrameCodec codec = new LaneFrameCodec();

    @Test
    void encodeLaysOutTypeBodyCrc()
    {
        byte[] datagram = codec.encode(new LaneFrame(0x81, new byte[] {0x0A, 0x0B}));

        assertEquals(5, datagram.length);
        assertEquals((byte) 0x81, datagram[0]);
        assertEquals(0x0A, datagram[1]);
        assertEquals(0x0B, datagram[2]);
        assertDoesNotThrow(() -> LaneCrc.validate(datagram));
    }

    @Test
    void decodeRecoversTypeAndBody()
    {
        byte[] datagram = codec.encode(new LaneFrame(0x03, new byte[] {1, 2, 3}));

        LaneFrame frame = codec.decode(datagram).orElseThrow();
        assertEquals(0x03, frame.type());
        assertArrayEquals(new byte[] {1, 2, 3}, frame.body());
    }

    @Test
    void emptyBodyIsAllowed()
    {
        byte[] datagram = codec.encode(new LaneFrame(0x02, new byte[0]));

        assertEquals(3, datagram.length);
        assertEquals(0, codec.decode(datagram).orElseThrow().body().length);
    }

    @Test
    void corruptDatagramIsDropped()
    {
        byte[] datagram = codec.encode(new LaneFrame(0x01, new byte[] {5}));
        datagram[1] = 6;
        assertEquals(Optional.empty(), codec.decode(datagram));
    }

    @Test
    void truncatedDatagramIsDropped()
    {
        assertEquals(Optional.empty(), codec.decode(new byte[] {0x01, 0x00}));
        assertEquals(Optional.empty(), codec.decode(new byte[0]));
        assertEquals(Optional.empty(), codec.decode(null));
    }

    @Test
    void crcOnlyDatagramIsDroppedEvenWhenItsCrcMatches()
    {
        byte[] trailerOnly = LaneCrc.appendCrc(new byte[0]);

        assertEquals(LaneFrameCodec.MIN_DATAGRAM_LENGTH - 1, trailerOnly.length);
        assertDoesNotThrow(() -> LaneCrc.validate(trailerOnly));
        assertEquals(Optional.empty(), codec.decode(trailerOnly));
    }

    @Test
    void frameTypeMustFitOneByte()
    {
        assertThrows(IllegalArgumentException.class, () -> new LaneFrame(0x100, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new LaneFrame(-1, new byte[0]));
    }

    @Test
    void frameBodyIsDefensivelyCopied()
    {
        byte[] body = {1};
        LaneFrame frame = new LaneFrame(0x01, body);
        body[0] = 9;
        frame.body()[0] = 7;
        assertArrayEquals(new byte[] {1}, frame.body());
    }
}
