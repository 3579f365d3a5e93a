package it.netdicom.dimse;

/** DIMSE status codes used by the message layer and the service classes. */
public final class Status {

    public static final int SUCCESS = 0x0000;
    public static final int CANCEL = 0xFE00;
    public static final int PENDING = 0xFF00;
    public static final int PENDING_WARNING = 0xFF01;

    public static final int ATTRIBUTE_LIST_ERROR = 0x0107;
    public static final int ATTRIBUTE_VALUE_OUT_OF_RANGE = 0x0116;
    public static final int SUB_OPERATIONS_WARNING = 0xB000;

    public static final int PROCESSING_FAILURE = 0x0110;
    public static final int NO_SUCH_SOP_CLASS = 0x0118;
    public static final int SOP_CLASS_NOT_SUPPORTED = 0x0122;
    public static final int UNABLE_TO_PROCESS = 0xC000;

    public static final int STORE_CANNOT_UNDERSTAND = 0xC210;
    public static final int STORE_UNABLE_TO_PROCESS = 0xC211;

    public static final int FIND_CANNOT_UNDERSTAND = 0xC310;
    public static final int FIND_UNABLE_TO_PROCESS = 0xC311;
    public static final int FIND_INVALID_STATUS = 0xC312;

    public static final int GET_CANNOT_UNDERSTAND = 0xC410;
    public static final int GET_UNABLE_TO_PROCESS = 0xC411;
    public static final int GET_INVALID_SUB_OPERATIONS = 0xC413;
    public static final int GET_TOO_MANY_SUB_OPERATIONS = 0xC416;

    public static final int MOVE_CANNOT_UNDERSTAND = 0xC510;
    public static final int MOVE_UNABLE_TO_PROCESS = 0xC511;
    public static final int MOVE_INVALID_SUB_OPERATIONS = 0xC513;
    public static final int MOVE_INVALID_DESTINATION = 0xC515;
    public static final int MOVE_TOO_MANY_SUB_OPERATIONS = 0xC516;
    public static final int MOVE_DESTINATION_UNKNOWN = 0xA801;

    public static final int SUB_OPERATIONS_ALL_FAILED = 0xA702;

    public static final int MAX_SUB_OPERATIONS = 0xFFFF;

    private Status() {
    }

    public static String hex(int status) {
        return String.format("0x%04X", status);
    }
}
