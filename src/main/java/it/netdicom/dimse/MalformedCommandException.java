package it.netdicom.dimse;

/** A DIMSE command set or PDV sequence that cannot be interpreted. Fatal to the association. */
public class MalformedCommandException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedCommandException(String message) {
        super(message);
    }

    public MalformedCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
