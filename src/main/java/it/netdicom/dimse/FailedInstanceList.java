package it.netdicom.dimse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import it.netdicom.sop.TransferSyntax;

/**
 * Encodes the Failed SOP Instance UID List (0008,0058) identifier sent with the final C-GET or C-MOVE response.
 */
public final class FailedInstanceList {

    private static final int GROUP = 0x0008;
    private static final int ELEMENT = 0x0058;

    private FailedInstanceList() {
    }

    public static byte[] encode(List<String> sopInstanceUids, String transferSyntax) {
        byte[] value = String.join("\\", sopInstanceUids).getBytes(StandardCharsets.US_ASCII);
        if (value.length % 2 != 0) {
            byte[] even = new byte[value.length + 1];
            System.arraycopy(value, 0, even, 0, value.length);
            value = even;
        }
        boolean littleEndian = TransferSyntax.isLittleEndian(transferSyntax);
        if (TransferSyntax.isDeflated(transferSyntax)) {
            throw new IllegalArgumentException("Deflated transfer syntax is not supported for the failed instance list");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length + 8);
        write16(out, GROUP, littleEndian);
        write16(out, ELEMENT, littleEndian);
        if (TransferSyntax.isImplicitVr(transferSyntax)) {
            write32(out, value.length, littleEndian);
        } else {
            if (value.length > 0xFFFF) {
                throw new IllegalArgumentException("Failed instance list of " + value.length + " bytes exceeds the explicit VR UI limit");
            }
            out.writeBytes("UI".getBytes(StandardCharsets.US_ASCII));
            write16(out, value.length, littleEndian);
        }
        out.writeBytes(value);
        return out.toByteArray();
    }

    private static void write16(ByteArrayOutputStream out, int value, boolean littleEndian) {
        if (littleEndian) {
            out.write(value & 0xFF);
            out.write((value >> 8) & 0xFF);
        } else {
            out.write((value >> 8) & 0xFF);
            out.write(value & 0xFF);
        }
    }

    private static void write32(ByteArrayOutputStream out, int value, boolean littleEndian) {
        if (littleEndian) {
            write16(out, value & 0xFFFF, true);
            write16(out, value >>> 16, true);
        } else {
            write16(out, value >>> 16, false);
            write16(out, value & 0xFFFF, false);
        }
    }
}
