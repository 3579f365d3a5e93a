package it.netdicom.pdu;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class AeTitles {

    public static final int LENGTH = 16;

    private AeTitles() {
    }

    /** Trims surrounding spaces and checks the title is usable on the wire. */
    public static String normalize(String aeTitle) {
        if (aeTitle == null) {
            throw new IllegalArgumentException("AE title is required");
        }
        String trimmed = aeTitle.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("AE title must not be empty or only spaces");
        }
        if (trimmed.length() > LENGTH) {
            throw new IllegalArgumentException("AE title [" + trimmed + "] exceeds " + LENGTH + " characters");
        }
        for (char c : trimmed.toCharArray()) {
            if (c == '\\' || c < 0x20 || c > 0x7E) {
                throw new IllegalArgumentException("AE title [" + trimmed + "] contains an invalid character");
            }
        }
        return trimmed;
    }

    static byte[] encode(String aeTitle) {
        byte[] padded = new byte[LENGTH];
        Arrays.fill(padded, (byte) ' ');
        byte[] value = normalize(aeTitle).getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(value, 0, padded, 0, value.length);
        return padded;
    }

    static String decode(byte[] field) {
        return new String(field, StandardCharsets.US_ASCII).replace('\0', ' ').strip();
    }
}
