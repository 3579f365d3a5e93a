package it.netdicom.acse;

public enum AbortSource {
    SERVICE_USER(0),
    RESERVED(1),
    SERVICE_PROVIDER(2);

    public static final int REASON_NOT_SPECIFIED = 0;
    public static final int REASON_UNRECOGNIZED_PDU = 1;
    public static final int REASON_UNEXPECTED_PDU = 2;
    public static final int REASON_UNRECOGNIZED_PDU_PARAMETER = 4;
    public static final int REASON_UNEXPECTED_PDU_PARAMETER = 5;
    public static final int REASON_INVALID_PDU_PARAMETER = 6;

    private final int code;

    AbortSource(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AbortSource fromCode(int code) {
        for (AbortSource source : values()) {
            if (source.code == code) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown abort source " + code);
    }

    public static String describeReason(int reason) {
        return switch (reason) {
            case REASON_NOT_SPECIFIED -> "Reason not specified";
            case REASON_UNRECOGNIZED_PDU -> "Unrecognised PDU";
            case REASON_UNEXPECTED_PDU -> "Unexpected PDU";
            case REASON_UNRECOGNIZED_PDU_PARAMETER -> "Unrecognised PDU parameter";
            case REASON_UNEXPECTED_PDU_PARAMETER -> "Unexpected PDU parameter";
            case REASON_INVALID_PDU_PARAMETER -> "Invalid PDU parameter value";
            default -> "Reserved reason " + reason;
        };
    }
}
