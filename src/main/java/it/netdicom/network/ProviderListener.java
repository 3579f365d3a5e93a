package it.netdicom.network;

import java.net.Socket;

import it.netdicom.fsm.Indication;
import it.netdicom.fsm.UpperLayerEvent;
import it.netdicom.fsm.UpperLayerState;
import it.netdicom.pdu.Pdu;

/**
 * Receives what the Upper Layer provider hands up. Indications are delivered on the thread that fired the
 * event, after the state machine lock has been released.
 */
public interface ProviderListener {

    void onIndication(Indication indication);

    default void onConnectionOpen(Socket socket) {
    }

    default void onConnectionClose() {
    }

    default void onPduSent(Pdu pdu) {
    }

    default void onPduReceived(Pdu pdu) {
    }

    default void onTransition(UpperLayerState from, UpperLayerEvent event, String action, UpperLayerState to) {
    }
}
