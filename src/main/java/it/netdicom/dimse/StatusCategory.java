package it.netdicom.dimse;

/** Category of a DIMSE status code, PS3.7 Annex C. */
public enum StatusCategory {
    SUCCESS,
    WARNING,
    FAILURE,
    CANCEL,
    PENDING;

    public static StatusCategory of(int status) {
        if (status == Status.SUCCESS) {
            return SUCCESS;
        }
        if (status == Status.PENDING || status == Status.PENDING_WARNING) {
            return PENDING;
        }
        if (status == Status.CANCEL) {
            return CANCEL;
        }
        if (status == Status.ATTRIBUTE_LIST_ERROR
            || status == Status.ATTRIBUTE_VALUE_OUT_OF_RANGE
            || (status >= 0xB000 && status <= 0xBFFF)) {
            return WARNING;
        }
        return FAILURE;
    }

    public boolean isFinal() {
        return this != PENDING;
    }
}
