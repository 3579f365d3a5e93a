package it.netdicom.event;

import java.time.Instant;
import java.util.function.BooleanSupplier;

import it.netdicom.association.Association;
import it.netdicom.dimse.CommandSet;
import it.netdicom.dimse.DatasetCodec;
import it.netdicom.dimse.DatasetDecodeException;
import it.netdicom.dimse.DimseMessage;
import it.netdicom.presentation.NegotiatedContext;

/**
 * A DIMSE request handed to a bound handler, together with the context and association it arrived on.
 */
public class Event {

    private final Association association;
    private final NegotiatedContext context;
    private final DimseMessage request;
    private final BooleanSupplier cancelled;
    private final Instant timestamp = Instant.now();

    public Event(Association association, NegotiatedContext context, DimseMessage request, BooleanSupplier cancelled) {
        this.association = association;
        this.context = context;
        this.request = request;
        this.cancelled = cancelled;
    }

    public Association association() {
        return association;
    }

    public NegotiatedContext context() {
        return context;
    }

    public DimseMessage request() {
        return request;
    }

    public CommandSet command() {
        return request.command();
    }

    public int messageId() {
        return request.command().messageId();
    }

    public String transferSyntax() {
        return context.negotiatedTransferSyntax();
    }

    public Instant timestamp() {
        return timestamp;
    }

    /** Raw encoded data set of the request. */
    public byte[] dataSet() {
        if (!request.hasDataSet()) {
            throw new DatasetDecodeException(request.commandField() + " request carries no data set");
        }
        return request.dataSet();
    }

    public <D> D dataSet(DatasetCodec<D> codec) {
        return codec.decode(dataSet(), transferSyntax());
    }

    public <D> byte[] encode(DatasetCodec<D> codec, D dataSet) {
        return codec.encode(dataSet, transferSyntax());
    }

    /** Whether the peer sent C-CANCEL for this request. Polled between pending responses. */
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    @Override
    public String toString() {
        return "Event[" + request + " on " + association + "]";
    }
}
