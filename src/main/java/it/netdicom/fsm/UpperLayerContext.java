package it.netdicom.fsm;

import it.netdicom.pdu.Pdu;

/**
 * Services the state machine actions need from the transport provider.
 */
public interface UpperLayerContext {

    boolean isRequestor();

    /** Starts opening the transport connection; the outcome arrives later as Evt2 or Evt17. */
    void openTransport();

    void send(Pdu pdu);

    void indicate(Indication indication);

    void closeTransport();

    void startArtim();

    void stopArtim();

    default void onTransition(UpperLayerState from, UpperLayerEvent event, String action, UpperLayerState to) {
    }
}
