package it.netdicom.pdu;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

final class PduWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    PduWriter u8(int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Value " + value + " does not fit an unsigned byte");
        }
        out.write(value);
        return this;
    }

    PduWriter u16(int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("Value " + value + " does not fit an unsigned short");
        }
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
        return this;
    }

    PduWriter u32(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Value " + value + " does not fit an unsigned int");
        }
        out.write((int) (value >>> 24) & 0xFF);
        out.write((int) (value >>> 16) & 0xFF);
        out.write((int) (value >>> 8) & 0xFF);
        out.write((int) value & 0xFF);
        return this;
    }

    PduWriter zeros(int count) {
        for (int i = 0; i < count; i++) {
            out.write(0);
        }
        return this;
    }

    PduWriter bytes(byte[] value) {
        out.write(value, 0, value.length);
        return this;
    }

    PduWriter ascii(String value) {
        return bytes(value.getBytes(StandardCharsets.US_ASCII));
    }

    /** Writes an item as {type}{reserved}{length:2}{body}. */
    PduWriter item(int type, byte[] body) {
        return u8(type).u8(0).u16(checkItemLength(type, body)).bytes(body);
    }

    /** Writes a 16-bit length prefixed field, as used inside user information sub-items. */
    PduWriter lengthPrefixed(byte[] value) {
        return u16(checkItemLength(-1, value)).bytes(value);
    }

    int size() {
        return out.size();
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    private static int checkItemLength(int type, byte[] body) {
        if (body.length > 0xFFFF) {
            String what = type < 0 ? "field" : String.format("item 0x%02X", type);
            throw new IllegalArgumentException("Encoded " + what + " length " + body.length + " exceeds 65535 bytes");
        }
        return body.length;
    }
}
