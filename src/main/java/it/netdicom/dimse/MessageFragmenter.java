package it.netdicom.dimse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PduCodec;
import it.netdicom.pdu.PresentationDataValue;

/**
 * Splits a DIMSE message into P-DATA-TF PDUs, one PDV each, none longer than the peer's maximum PDU length.
 */
public final class MessageFragmenter {

    /** Smallest maximum length that still leaves room for payload after the PDV header. */
    public static final long MINIMUM_MAX_PDU_LENGTH = PduCodec.PDV_HEADER_LENGTH + 2;

    private MessageFragmenter() {
    }

    /**
     * @param maxPduLength the peer's maximum PDU length; 0 means unlimited
     */
    public static List<Pdu.PDataTf> fragment(DimseMessage message, long maxPduLength) {
        if (maxPduLength != 0 && maxPduLength < MINIMUM_MAX_PDU_LENGTH) {
            throw new IllegalArgumentException("Maximum PDU length " + maxPduLength + " is too small to carry a fragment");
        }
        int fragmentSize = maxPduLength == 0
            ? Integer.MAX_VALUE
            : (int) Math.min(Integer.MAX_VALUE, maxPduLength - PduCodec.PDV_HEADER_LENGTH);
        List<Pdu.PDataTf> pdus = new ArrayList<>();
        split(message.contextId(), true, message.command().encode(), fragmentSize, pdus);
        if (message.hasDataSet()) {
            split(message.contextId(), false, message.dataSet(), fragmentSize, pdus);
        }
        return pdus;
    }

    private static void split(int contextId, boolean command, byte[] stream, int fragmentSize, List<Pdu.PDataTf> pdus) {
        if (stream.length == 0) {
            pdus.add(new Pdu.PDataTf(List.of(PresentationDataValue.of(contextId, command, true, stream))));
            return;
        }
        for (int offset = 0; offset < stream.length; offset += fragmentSize) {
            int end = (int) Math.min((long) offset + fragmentSize, stream.length);
            byte[] chunk = Arrays.copyOfRange(stream, offset, end);
            pdus.add(new Pdu.PDataTf(List.of(PresentationDataValue.of(contextId, command, end == stream.length, chunk))));
        }
    }
}
