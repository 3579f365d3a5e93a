package it.netdicom.fsm;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.acse.AbortSource;
import it.netdicom.pdu.Pdu;

/**
 * DICOM Upper Layer state machine, PS3.8 Table 9-10.
 * <p>
 * All transitions go through {@link #fire(UpperLayerEvent, Pdu)}, which is serialized per association.
 * A state/event pair missing from the table forces a local abort back to Sta1.
 */
public class UpperLayerStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(UpperLayerStateMachine.class);

    private static final Map<UpperLayerEvent, Map<UpperLayerState, UpperLayerAction>> TRANSITIONS = new EnumMap<>(UpperLayerEvent.class);

    static {
        on(UpperLayerEvent.EVT1).put(UpperLayerState.STA1, UpperLayerAction.AE_1);
        on(UpperLayerEvent.EVT2).put(UpperLayerState.STA4, UpperLayerAction.AE_2);

        Map<UpperLayerState, UpperLayerAction> evt3 = on(UpperLayerEvent.EVT3);
        evt3.put(UpperLayerState.STA2, UpperLayerAction.AA_1);
        evt3.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        evt3.put(UpperLayerState.STA5, UpperLayerAction.AE_3);
        range(evt3, 6, 12, UpperLayerAction.AA_8);
        evt3.put(UpperLayerState.STA13, UpperLayerAction.AA_6);

        Map<UpperLayerState, UpperLayerAction> evt4 = on(UpperLayerEvent.EVT4);
        evt4.putAll(evt3);
        evt4.put(UpperLayerState.STA5, UpperLayerAction.AE_4);

        on(UpperLayerEvent.EVT5).put(UpperLayerState.STA1, UpperLayerAction.AE_5);

        Map<UpperLayerState, UpperLayerAction> evt6 = on(UpperLayerEvent.EVT6);
        evt6.put(UpperLayerState.STA2, UpperLayerAction.AE_6);
        evt6.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        range(evt6, 5, 12, UpperLayerAction.AA_8);
        evt6.put(UpperLayerState.STA13, UpperLayerAction.AA_7);

        on(UpperLayerEvent.EVT7).put(UpperLayerState.STA3, UpperLayerAction.AE_7);
        on(UpperLayerEvent.EVT8).put(UpperLayerState.STA3, UpperLayerAction.AE_8);

        Map<UpperLayerState, UpperLayerAction> evt9 = on(UpperLayerEvent.EVT9);
        evt9.put(UpperLayerState.STA6, UpperLayerAction.DT_1);
        evt9.put(UpperLayerState.STA8, UpperLayerAction.AR_7);

        Map<UpperLayerState, UpperLayerAction> evt10 = on(UpperLayerEvent.EVT10);
        evt10.put(UpperLayerState.STA2, UpperLayerAction.AA_1);
        evt10.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        evt10.put(UpperLayerState.STA5, UpperLayerAction.AA_8);
        evt10.put(UpperLayerState.STA6, UpperLayerAction.DT_2);
        evt10.put(UpperLayerState.STA7, UpperLayerAction.AR_6);
        range(evt10, 8, 12, UpperLayerAction.AA_8);
        evt10.put(UpperLayerState.STA13, UpperLayerAction.AA_6);

        on(UpperLayerEvent.EVT11).put(UpperLayerState.STA6, UpperLayerAction.AR_1);

        Map<UpperLayerState, UpperLayerAction> evt12 = on(UpperLayerEvent.EVT12);
        evt12.put(UpperLayerState.STA2, UpperLayerAction.AA_1);
        evt12.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        evt12.put(UpperLayerState.STA5, UpperLayerAction.AA_8);
        evt12.put(UpperLayerState.STA6, UpperLayerAction.AR_2);
        evt12.put(UpperLayerState.STA7, UpperLayerAction.AR_8);
        range(evt12, 8, 12, UpperLayerAction.AA_8);
        evt12.put(UpperLayerState.STA13, UpperLayerAction.AA_6);

        Map<UpperLayerState, UpperLayerAction> evt13 = on(UpperLayerEvent.EVT13);
        evt13.put(UpperLayerState.STA2, UpperLayerAction.AA_1);
        evt13.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA5, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA6, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA7, UpperLayerAction.AR_3);
        evt13.put(UpperLayerState.STA8, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA9, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA10, UpperLayerAction.AR_10);
        evt13.put(UpperLayerState.STA11, UpperLayerAction.AR_3);
        evt13.put(UpperLayerState.STA12, UpperLayerAction.AA_8);
        evt13.put(UpperLayerState.STA13, UpperLayerAction.AA_6);

        Map<UpperLayerState, UpperLayerAction> evt14 = on(UpperLayerEvent.EVT14);
        evt14.put(UpperLayerState.STA8, UpperLayerAction.AR_4);
        evt14.put(UpperLayerState.STA9, UpperLayerAction.AR_9);
        evt14.put(UpperLayerState.STA12, UpperLayerAction.AR_4);

        Map<UpperLayerState, UpperLayerAction> evt15 = on(UpperLayerEvent.EVT15);
        evt15.put(UpperLayerState.STA3, UpperLayerAction.AA_1);
        evt15.put(UpperLayerState.STA4, UpperLayerAction.AA_2);
        range(evt15, 5, 12, UpperLayerAction.AA_1);

        Map<UpperLayerState, UpperLayerAction> evt16 = on(UpperLayerEvent.EVT16);
        evt16.put(UpperLayerState.STA2, UpperLayerAction.AA_2);
        evt16.put(UpperLayerState.STA3, UpperLayerAction.AA_3);
        range(evt16, 5, 12, UpperLayerAction.AA_3);
        evt16.put(UpperLayerState.STA13, UpperLayerAction.AA_2);

        Map<UpperLayerState, UpperLayerAction> evt17 = on(UpperLayerEvent.EVT17);
        evt17.put(UpperLayerState.STA2, UpperLayerAction.AA_5);
        range(evt17, 3, 12, UpperLayerAction.AA_4);
        evt17.put(UpperLayerState.STA13, UpperLayerAction.AR_5);

        Map<UpperLayerState, UpperLayerAction> evt18 = on(UpperLayerEvent.EVT18);
        evt18.put(UpperLayerState.STA2, UpperLayerAction.AA_2);
        evt18.put(UpperLayerState.STA13, UpperLayerAction.AA_2);

        Map<UpperLayerState, UpperLayerAction> evt19 = on(UpperLayerEvent.EVT19);
        evt19.put(UpperLayerState.STA2, UpperLayerAction.AA_1);
        evt19.put(UpperLayerState.STA3, UpperLayerAction.AA_8);
        range(evt19, 5, 12, UpperLayerAction.AA_8);
        evt19.put(UpperLayerState.STA13, UpperLayerAction.AA_7);
    }

    private final UpperLayerContext context;
    private UpperLayerState state = UpperLayerState.STA1;
    private Pdu.AssociateRq pendingRequest;
    private boolean aborted;

    public UpperLayerStateMachine(UpperLayerContext context) {
        this.context = context;
    }

    public static Optional<UpperLayerAction> actionFor(UpperLayerState state, UpperLayerEvent event) {
        return Optional.ofNullable(TRANSITIONS.get(event).get(state));
    }

    public synchronized UpperLayerState state() {
        return state;
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public synchronized UpperLayerState fire(UpperLayerEvent event) {
        return fire(event, null);
    }

    /**
     * Applies the action defined for the current state and the given event.
     *
     * @param pdu the PDU received or to be sent; {@code null} for events that carry none
     * @return the state after the transition
     */
    public synchronized UpperLayerState fire(UpperLayerEvent event, Pdu pdu) {
        UpperLayerState from = state;
        UpperLayerAction action = TRANSITIONS.get(event).get(from);
        if (action == null) {
            forceAbort(event);
            return state;
        }
        UpperLayerState to = action.execute(this, pdu);
        enter(to);
        logger.debug("{} + {} -> {} -> {}", from.label(), event.label(), action.label(), to.label());
        context.onTransition(from, event, action.label(), to);
        return to;
    }

    UpperLayerContext context() {
        return context;
    }

    void markAborted() {
        aborted = true;
    }

    void rememberRequest(Pdu.AssociateRq request) {
        pendingRequest = request;
    }

    Pdu.AssociateRq takeRequest() {
        if (pendingRequest == null) {
            throw new IllegalStateException("No A-ASSOCIATE-RQ is waiting for the transport connection");
        }
        Pdu.AssociateRq request = pendingRequest;
        pendingRequest = null;
        return request;
    }

    private void forceAbort(UpperLayerEvent event) {
        UpperLayerState from = state;
        logger.warn("Event {} ({}) is not valid in {} ({}), aborting the association",
            event.label(), event.description(), from.label(), from.description());
        aborted = true;
        if (from != UpperLayerState.STA1 && from != UpperLayerState.STA4) {
            context.send(new Pdu.Abort(AbortSource.SERVICE_PROVIDER.code(), AbortSource.REASON_UNEXPECTED_PDU));
        }
        context.stopArtim();
        context.indicate(new Indication.ProviderAbort(AbortSource.REASON_UNEXPECTED_PDU));
        context.closeTransport();
        enter(UpperLayerState.STA1);
        context.onTransition(from, event, "local abort", UpperLayerState.STA1);
    }

    private void enter(UpperLayerState to) {
        UpperLayerState from = state;
        state = to;
        if (to == UpperLayerState.STA1 && from != UpperLayerState.STA1) {
            pendingRequest = null;
            context.indicate(new Indication.Closed());
        }
    }

    private static Map<UpperLayerState, UpperLayerAction> on(UpperLayerEvent event) {
        return TRANSITIONS.computeIfAbsent(event, key -> new EnumMap<>(UpperLayerState.class));
    }

    private static void range(Map<UpperLayerState, UpperLayerAction> row, int first, int last, UpperLayerAction action) {
        for (int number = first; number <= last; number++) {
            row.put(UpperLayerState.values()[number - 1], action);
        }
    }
}
