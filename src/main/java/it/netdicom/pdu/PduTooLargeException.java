package it.netdicom.pdu;

/**
 * A PDU header declared more bytes than the receiver accepts. The body was not consumed, so the
 * stream is no longer aligned on a PDU boundary.
 */
public class PduTooLargeException extends MalformedPduException {

    private static final long serialVersionUID = 1L;

    private final long declaredLength;

    public PduTooLargeException(int type, long declaredLength, long limit) {
        super(String.format("PDU type 0x%02X declared length %d exceeds the limit of %d", type, declaredLength, limit));
        this.declaredLength = declaredLength;
    }

    public long declaredLength() {
        return declaredLength;
    }
}
