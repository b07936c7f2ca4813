package com.questrail.intersection.protocol.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Big-endian body writer. Field ranges are checked; an out-of-range value is
 * a caller error, not a wire defect.
 */
final class WireWriter
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    WireWriter u8(int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("value does not fit u8: " + value);
        }
        out.write(value);
        return this;
    }

    WireWriter bool(boolean value) {
        return u8(value ? 1 : 0);
    }

    WireWriter u16(int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("value does not fit u16: " + value);
        }
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
        return this;
    }

    WireWriter i32(int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
        return this;
    }

    WireWriter i64(long value) {
        i32((int) (value >>> 32));
        i32((int) value);
        return this;
    }

    WireWriter f32(float value) {
        return i32(Float.floatToIntBits(value));
    }

    WireWriter f64(double value) {
        return i64(Double.doubleToLongBits(value));
    }

    /** u8 length + UTF-8 bytes */
    WireWriter str(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        u8(bytes.length);
        out.write(bytes, 0, bytes.length);
        return this;
    }

    /** u16 length + UTF-8 bytes */
    WireWriter longStr(String value) {
        return blob(value.getBytes(StandardCharsets.UTF_8));
    }

    /** u16 length + bytes */
    WireWriter blob(byte[] value) {
        u16(value.length);
        out.write(value, 0, value.length);
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }
}
