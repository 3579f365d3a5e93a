package it.netdicom.pdu;

public class MalformedPduException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedPduException(String message) {
        super(message);
    }

    public MalformedPduException(String message, Throwable cause) {
        super(message, cause);
    }
}
