package it.netdicom.pdu;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

final class PduReader {

    private final byte[] buffer;
    private final int end;
    private int position;

    PduReader(byte[] buffer) {
        this(buffer, 0, buffer.length);
    }

    private PduReader(byte[] buffer, int offset, int end) {
        this.buffer = buffer;
        this.position = offset;
        this.end = end;
    }

    int remaining() {
        return end - position;
    }

    boolean hasRemaining() {
        return position < end;
    }

    int u8() {
        require(1);
        return buffer[position++] & 0xFF;
    }

    int u16() {
        require(2);
        int value = ((buffer[position] & 0xFF) << 8) | (buffer[position + 1] & 0xFF);
        position += 2;
        return value;
    }

    long u32() {
        require(4);
        long value = ((long) (buffer[position] & 0xFF) << 24)
            | ((buffer[position + 1] & 0xFF) << 16)
            | ((buffer[position + 2] & 0xFF) << 8)
            | (buffer[position + 3] & 0xFF);
        position += 4;
        return value;
    }

    void skip(int count) {
        require(count);
        position += count;
    }

    byte[] bytes(int count) {
        require(count);
        byte[] value = Arrays.copyOfRange(buffer, position, position + count);
        position += count;
        return value;
    }

    String ascii(int count) {
        return new String(bytes(count), StandardCharsets.US_ASCII);
    }

    /** Returns a reader over the next {@code count} bytes and advances past them. */
    PduReader slice(int count) {
        require(count);
        PduReader slice = new PduReader(buffer, position, position + count);
        position += count;
        return slice;
    }

    void requireConsumed(String what) {
        if (hasRemaining()) {
            throw new MalformedPduException(what + " has " + remaining() + " unexpected trailing bytes");
        }
    }

    private void require(int count) {
        if (count < 0 || remaining() < count) {
            throw new MalformedPduException("Truncated data: needed " + count + " bytes, " + remaining() + " available");
        }
    }
}
