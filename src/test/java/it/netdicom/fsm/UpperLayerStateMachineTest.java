package it.netdicom.fsm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.PresentationContextAcItem;
import it.netdicom.pdu.PresentationContextRqItem;
import it.netdicom.pdu.PresentationDataValue;
import it.netdicom.pdu.UserInformation;

class UpperLayerStateMachineTest {

    private static final Pdu.AssociateRq RQ = new Pdu.AssociateRq(1, "SCP", "SCU", "1.2.840.10008.3.1.1.1",
        List.of(new PresentationContextRqItem(1, "1.2.840.10008.1.1", List.of("1.2.840.10008.1.2"))),
        UserInformation.of(16384, "1.2.3", null));
    private static final Pdu.AssociateAc AC = new Pdu.AssociateAc(1, "SCP", "SCU", "1.2.840.10008.3.1.1.1",
        List.of(new PresentationContextAcItem(1, 0, Optional.of("1.2.840.10008.1.2"))),
        UserInformation.of(16384, "1.2.3", null));
    private static final Pdu.PDataTf DATA = new Pdu.PDataTf(List.of(PresentationDataValue.of(1, true, true, new byte[]{0})));

    @Test
    void shouldExposeTableEntries() {
        assertEquals(Optional.of(UpperLayerAction.AE_1), UpperLayerStateMachine.actionFor(UpperLayerState.STA1, UpperLayerEvent.EVT1));
        assertEquals(Optional.of(UpperLayerAction.AR_8), UpperLayerStateMachine.actionFor(UpperLayerState.STA7, UpperLayerEvent.EVT12));
        assertEquals(Optional.of(UpperLayerAction.AA_7), UpperLayerStateMachine.actionFor(UpperLayerState.STA13, UpperLayerEvent.EVT6));
        assertEquals(Optional.of(UpperLayerAction.AR_5), UpperLayerStateMachine.actionFor(UpperLayerState.STA13, UpperLayerEvent.EVT17));
        assertEquals(Optional.empty(), UpperLayerStateMachine.actionFor(UpperLayerState.STA4, UpperLayerEvent.EVT3));
        assertEquals("AR-10", UpperLayerAction.AR_10.label());
    }

    @Test
    void requestorShouldEstablishAndRelease() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);

        assertEquals(UpperLayerState.STA4, machine.fire(UpperLayerEvent.EVT1, RQ));
        verify(context).openTransport();
        assertEquals(UpperLayerState.STA5, machine.fire(UpperLayerEvent.EVT2));
        verify(context).send(RQ);
        assertEquals(UpperLayerState.STA6, machine.fire(UpperLayerEvent.EVT3, AC));
        verify(context).indicate(new Indication.Received(AC));
        assertEquals(UpperLayerState.STA7, machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq()));
        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT13, new Pdu.ReleaseRp()));

        verify(context).closeTransport();
        verify(context).indicate(new Indication.Closed());
        assertFalse(machine.isAborted());
    }

    @Test
    void acceptorShouldRejectUnsupportedProtocolVersion() {
        UpperLayerContext context = context(false);
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        machine.fire(UpperLayerEvent.EVT5);
        Pdu.AssociateRq version2 = new Pdu.AssociateRq(2, RQ.calledAeTitle(), RQ.callingAeTitle(), RQ.applicationContext(),
            RQ.presentationContexts(), RQ.userInformation());

        assertEquals(UpperLayerState.STA13, machine.fire(UpperLayerEvent.EVT6, version2));

        verify(context).send(new Pdu.AssociateRj(1, 2, 2));
        verify(context, never()).indicate(new Indication.Received(version2));
    }

    @Test
    void artimExpiryAfterRejectionClosesWithoutAbort() {
        UpperLayerContext context = context(false);
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        machine.fire(UpperLayerEvent.EVT5);
        machine.fire(UpperLayerEvent.EVT6, RQ);
        machine.fire(UpperLayerEvent.EVT8, new Pdu.AssociateRj(1, 1, 1));

        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT18));

        assertFalse(machine.isAborted());
        verify(context).closeTransport();
    }

    @Test
    void artimExpiryBeforeAssociateRqAborts() {
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context(false));
        machine.fire(UpperLayerEvent.EVT5);

        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT18));
        assertTrue(machine.isAborted());
    }

    @Test
    void requestorReleaseCollisionFollowsSta9AndSta11() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);
        machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());

        assertEquals(UpperLayerState.STA9, machine.fire(UpperLayerEvent.EVT12, new Pdu.ReleaseRq()));
        assertEquals(UpperLayerState.STA11, machine.fire(UpperLayerEvent.EVT14, new Pdu.ReleaseRp()));
        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT13, new Pdu.ReleaseRp()));

        InOrder order = inOrder(context);
        order.verify(context).send(new Pdu.ReleaseRq());
        order.verify(context).send(new Pdu.ReleaseRp());
        order.verify(context).closeTransport();
        assertFalse(machine.isAborted());
    }

    @Test
    void acceptorReleaseCollisionFollowsSta10AndSta12() {
        UpperLayerContext context = context(false);
        UpperLayerStateMachine machine = established(context, false);
        machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());

        assertEquals(UpperLayerState.STA10, machine.fire(UpperLayerEvent.EVT12, new Pdu.ReleaseRq()));
        assertEquals(UpperLayerState.STA12, machine.fire(UpperLayerEvent.EVT13, new Pdu.ReleaseRp()));
        assertEquals(UpperLayerState.STA13, machine.fire(UpperLayerEvent.EVT14, new Pdu.ReleaseRp()));
        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT17));

        verify(context).send(new Pdu.ReleaseRp());
        assertFalse(machine.isAborted());
    }

    @Test
    void dataReceivedWhileAwaitingReleaseResponseIsStillIndicated() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);
        machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());

        assertEquals(UpperLayerState.STA7, machine.fire(UpperLayerEvent.EVT10, DATA));
        verify(context).indicate(new Indication.Received(DATA));
    }

    @Test
    void peerAbortIndicatesAndCloses() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);
        Pdu.Abort abort = new Pdu.Abort(0, 0);

        assertEquals(UpperLayerState.STA1, machine.fire(UpperLayerEvent.EVT16, abort));

        verify(context).indicate(new Indication.Received(abort));
        verify(context).closeTransport();
        assertTrue(machine.isAborted());
    }

    @Test
    void abortRequestSendsTheGivenAbortPdu() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);
        Pdu.Abort abort = new Pdu.Abort(2, 6);

        assertEquals(UpperLayerState.STA13, machine.fire(UpperLayerEvent.EVT15, abort));

        verify(context).send(abort);
        verify(context).startArtim();
        assertTrue(machine.isAborted());
    }

    @Test
    void unexpectedPduWhileAwaitingAssociateRqSendsUserAbort() {
        UpperLayerContext context = context(false);
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        machine.fire(UpperLayerEvent.EVT5);

        assertEquals(UpperLayerState.STA13, machine.fire(UpperLayerEvent.EVT10, DATA));

        verify(context).send(new Pdu.Abort(0, 0));
    }

    @Test
    void invalidPduSendsProviderAbort() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);

        assertEquals(UpperLayerState.STA13, machine.fire(UpperLayerEvent.EVT19));

        verify(context).send(new Pdu.Abort(2, 2));
        verify(context).indicate(new Indication.ProviderAbort(2));
        assertTrue(machine.isAborted());
    }

    @Test
    void undefinedPairAbortsFromEveryState() {
        for (UpperLayerState state : UpperLayerState.values()) {
            for (UpperLayerEvent event : UpperLayerEvent.values()) {
                if (UpperLayerStateMachine.actionFor(state, event).isPresent()) {
                    continue;
                }
                UpperLayerContext context = context(state != UpperLayerState.STA10 && state != UpperLayerState.STA12);
                UpperLayerStateMachine machine = driveTo(state, context);
                assertEquals(state, machine.state(), "setup for " + state.label());

                machine.fire(event, null);

                assertEquals(UpperLayerState.STA1, machine.state(), state.label() + " + " + event.label());
                assertTrue(machine.isAborted(), state.label() + " + " + event.label());
            }
        }
    }

    @Test
    void undefinedPairOutsideIdleSendsProviderAbort() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = established(context, true);

        machine.fire(UpperLayerEvent.EVT7, AC);

        verify(context).send(new Pdu.Abort(2, 2));
        verify(context).indicate(new Indication.ProviderAbort(2));
        verify(context).closeTransport();
        verify(context).indicate(new Indication.Closed());
    }

    @Test
    void undefinedPairWhileConnectingDoesNotSendAbort() {
        UpperLayerContext context = context(true);
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        machine.fire(UpperLayerEvent.EVT1, RQ);

        machine.fire(UpperLayerEvent.EVT3, AC);

        verify(context, never()).send(any());
        assertEquals(UpperLayerState.STA1, machine.state());
    }

    private static UpperLayerContext context(boolean requestor) {
        UpperLayerContext context = mock(UpperLayerContext.class);
        when(context.isRequestor()).thenReturn(requestor);
        return context;
    }

    private static UpperLayerStateMachine established(UpperLayerContext context, boolean requestor) {
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        if (requestor) {
            machine.fire(UpperLayerEvent.EVT1, RQ);
            machine.fire(UpperLayerEvent.EVT2);
            machine.fire(UpperLayerEvent.EVT3, AC);
        } else {
            machine.fire(UpperLayerEvent.EVT5);
            machine.fire(UpperLayerEvent.EVT6, RQ);
            machine.fire(UpperLayerEvent.EVT7, AC);
        }
        return machine;
    }

    private static UpperLayerStateMachine driveTo(UpperLayerState target, UpperLayerContext context) {
        UpperLayerStateMachine machine = new UpperLayerStateMachine(context);
        switch (target) {
            case STA1 -> {
            }
            case STA2 -> machine.fire(UpperLayerEvent.EVT5);
            case STA3 -> {
                machine.fire(UpperLayerEvent.EVT5);
                machine.fire(UpperLayerEvent.EVT6, RQ);
            }
            case STA4 -> machine.fire(UpperLayerEvent.EVT1, RQ);
            case STA5 -> {
                machine.fire(UpperLayerEvent.EVT1, RQ);
                machine.fire(UpperLayerEvent.EVT2);
            }
            case STA6 -> machine = established(context, true);
            case STA7 -> {
                machine = established(context, true);
                machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());
            }
            case STA8 -> {
                machine = established(context, true);
                machine.fire(UpperLayerEvent.EVT12, new Pdu.ReleaseRq());
            }
            case STA9, STA11 -> {
                machine = established(context, true);
                machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());
                machine.fire(UpperLayerEvent.EVT12, new Pdu.ReleaseRq());
                if (target == UpperLayerState.STA11) {
                    machine.fire(UpperLayerEvent.EVT14, new Pdu.ReleaseRp());
                }
            }
            case STA10, STA12 -> {
                machine = established(context, false);
                machine.fire(UpperLayerEvent.EVT11, new Pdu.ReleaseRq());
                machine.fire(UpperLayerEvent.EVT12, new Pdu.ReleaseRq());
                if (target == UpperLayerState.STA12) {
                    machine.fire(UpperLayerEvent.EVT13, new Pdu.ReleaseRp());
                }
            }
            case STA13 -> {
                machine.fire(UpperLayerEvent.EVT5);
                machine.fire(UpperLayerEvent.EVT6, RQ);
                machine.fire(UpperLayerEvent.EVT8, new Pdu.AssociateRj(1, 1, 1));
            }
        }
        return machine;
    }
}
