package it.netdicom.dimse;

/** No DIMSE response arrived within the configured timeout; the association has been aborted. */
public class DimseTimeoutException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DimseTimeoutException(String message) {
        super(message);
    }
}
