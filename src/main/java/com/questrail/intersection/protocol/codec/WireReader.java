package com.questrail.intersection.protocol.codec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Big-endian body reader. Running past the end of the body is reported as a
 * {@link LaneDecodeException}.
 */
final class WireReader
{
    private final ByteBuffer buf;

    WireReader(byte[] body) {
        this.buf = ByteBuffer.wrap(body);
    }

    int u8() {
        try {
            return buf.get() & 0xFF;
        } catch (BufferUnderflowException e) {
            throw truncated(e);
        }
    }

    boolean bool() {
        int v = u8();
        if (v > 1) {
            throw new LaneDecodeException("invalid boolean byte: " + v);
        }
        return v == 1;
    }

    int u16() {
        try {
            return buf.getShort() & 0xFFFF;
        } catch (BufferUnderflowException e) {
            throw truncated(e);
        }
    }

    int i32() {
        try {
            return buf.getInt();
        } catch (BufferUnderflowException e) {
            throw truncated(e);
        }
    }

    long i64() {
        try {
            return buf.getLong();
        } catch (BufferUnderflowException e) {
            throw truncated(e);
        }
    }

    float f32() {
        return Float.intBitsToFloat(i32());
    }

    double f64() {
        return Double.longBitsToDouble(i64());
    }

    String str() {
        return new String(bytes(u8()), StandardCharsets.UTF_8);
    }

    String longStr() {
        return new String(blob(), StandardCharsets.UTF_8);
    }

    byte[] blob() {
        return bytes(u16());
    }

    /**
     * Asserts the whole body was consumed.
     */
    void expectEnd() {
        if (buf.hasRemaining()) {
            throw new LaneDecodeException(buf.remaining() + " trailing bytes in body");
        }
    }

    private byte[] bytes(int n) {
        if (n > buf.remaining()) {
            throw new LaneDecodeException("field length " + n + " exceeds remaining " + buf.remaining());
        }
        byte[] out = new byte[n];
        buf.get(out);
        return out;
    }

    private static LaneDecodeException truncated(BufferUnderflowException e) {
        return new LaneDecodeException("body truncated", e);
    }
}
