package it.netdicom.dimse;

/** A data set that could not be decoded. Scoped to one DIMSE exchange. */
public class DatasetDecodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DatasetDecodeException(String message) {
        super(message);
    }

    public DatasetDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
