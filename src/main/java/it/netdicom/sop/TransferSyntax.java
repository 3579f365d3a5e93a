package it.netdicom.sop;

import java.util.List;

public final class TransferSyntax {

    public static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    public static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
    public static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";
    public static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";
    public static final String JPEG_BASELINE = "1.2.840.10008.1.2.4.50";
    public static final String JPEG_LOSSLESS_SV1 = "1.2.840.10008.1.2.4.70";
    public static final String JPEG_2000_LOSSLESS = "1.2.840.10008.1.2.4.90";
    public static final String JPEG_2000 = "1.2.840.10008.1.2.4.91";
    public static final String RLE_LOSSLESS = "1.2.840.10008.1.2.5";

    public static final List<String> UNCOMPRESSED = List.of(
        EXPLICIT_VR_LITTLE_ENDIAN,
        IMPLICIT_VR_LITTLE_ENDIAN,
        EXPLICIT_VR_BIG_ENDIAN
    );

    private TransferSyntax() {
    }

    public static boolean isLittleEndian(String uid) {
        return !EXPLICIT_VR_BIG_ENDIAN.equals(uid);
    }

    public static boolean isImplicitVr(String uid) {
        return IMPLICIT_VR_LITTLE_ENDIAN.equals(uid);
    }

    public static boolean isDeflated(String uid) {
        return DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(uid);
    }
}
