package it.netdicom.fsm;

import it.netdicom.pdu.Pdu;

/** Primitives the Upper Layer hands up to the association user. */
public sealed interface Indication permits Indication.Received, Indication.ProviderAbort, Indication.Closed {

    /** A PDU passed up as an indication or confirmation primitive. */
    record Received(Pdu pdu) implements Indication {
    }

    /** A-P-ABORT indication. */
    record ProviderAbort(int reason) implements Indication {
    }

    /** The provider is back in Sta1 and will deliver nothing further. */
    record Closed() implements Indication {
    }
}
