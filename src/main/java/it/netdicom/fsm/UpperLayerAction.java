package it.netdicom.fsm;

import it.netdicom.acse.AbortSource;
import it.netdicom.acse.Rejection;
import it.netdicom.pdu.Pdu;

/**
 * Upper Layer actions, PS3.8 Tables 9-6 to 9-9. Each returns the next state.
 */
public enum UpperLayerAction {

    AE_1("Issue TRANSPORT CONNECT request primitive to local transport service") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.rememberRequest((Pdu.AssociateRq) pdu);
            machine.context().openTransport();
            return UpperLayerState.STA4;
        }
    },
    AE_2("Send A-ASSOCIATE-RQ PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(machine.takeRequest());
            return UpperLayerState.STA5;
        }
    },
    AE_3("Issue A-ASSOCIATE confirmation (accept) primitive") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return UpperLayerState.STA6;
        }
    },
    AE_4("Issue A-ASSOCIATE confirmation (reject) primitive and close transport connection") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            machine.context().closeTransport();
            return UpperLayerState.STA1;
        }
    },
    AE_5("Issue transport connection response primitive, start ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().startArtim();
            return UpperLayerState.STA2;
        }
    },
    AE_6("Stop ARTIM timer and issue A-ASSOCIATE indication or send A-ASSOCIATE-RJ PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            UpperLayerContext context = machine.context();
            context.stopArtim();
            Pdu.AssociateRq rq = (Pdu.AssociateRq) pdu;
            if (rq.protocolVersion() != Pdu.PROTOCOL_VERSION) {
                context.send(Rejection.PROTOCOL_VERSION_NOT_SUPPORTED.toPdu());
                context.startArtim();
                return UpperLayerState.STA13;
            }
            context.indicate(new Indication.Received(pdu));
            return UpperLayerState.STA3;
        }
    },
    AE_7("Send A-ASSOCIATE-AC PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            return UpperLayerState.STA6;
        }
    },
    AE_8("Send A-ASSOCIATE-RJ PDU and start ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            machine.context().startArtim();
            return UpperLayerState.STA13;
        }
    },
    DT_1("Send P-DATA-TF PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            return UpperLayerState.STA6;
        }
    },
    DT_2("Send P-DATA indication primitive") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return UpperLayerState.STA6;
        }
    },
    AR_1("Send A-RELEASE-RQ PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            return UpperLayerState.STA7;
        }
    },
    AR_2("Issue A-RELEASE indication primitive") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return UpperLayerState.STA8;
        }
    },
    AR_3("Issue A-RELEASE confirmation primitive and close transport connection") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            machine.context().closeTransport();
            return UpperLayerState.STA1;
        }
    },
    AR_4("Issue A-RELEASE-RP PDU and start ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            machine.context().startArtim();
            return UpperLayerState.STA13;
        }
    },
    AR_5("Stop ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().stopArtim();
            return UpperLayerState.STA1;
        }
    },
    AR_6("Issue P-DATA indication") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return UpperLayerState.STA7;
        }
    },
    AR_7("Issue P-DATA-TF PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            return UpperLayerState.STA8;
        }
    },
    AR_8("Issue A-RELEASE indication (release collision)") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return machine.context().isRequestor() ? UpperLayerState.STA9 : UpperLayerState.STA10;
        }
    },
    AR_9("Send A-RELEASE-RP PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().send(pdu);
            return UpperLayerState.STA11;
        }
    },
    AR_10("Issue A-RELEASE confirmation primitive") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.context().indicate(new Indication.Received(pdu));
            return UpperLayerState.STA12;
        }
    },
    AA_1("Send A-ABORT PDU and start or restart ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            // EVT15 carries the user's A-ABORT; other events reaching AA-1 carry the received PDU or nothing
            Pdu.Abort abort = pdu instanceof Pdu.Abort requested
                ? requested
                : new Pdu.Abort(AbortSource.SERVICE_USER.code(), AbortSource.REASON_NOT_SPECIFIED);
            machine.context().send(abort);
            machine.context().stopArtim();
            machine.context().startArtim();
            return UpperLayerState.STA13;
        }
    },
    AA_2("Stop ARTIM timer if running, close transport connection") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            if (machine.state() != UpperLayerState.STA13) {
                machine.markAborted();
            }
            machine.context().stopArtim();
            machine.context().closeTransport();
            return UpperLayerState.STA1;
        }
    },
    AA_3("Issue A-ABORT or A-P-ABORT indication and close transport connection") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            machine.context().indicate(new Indication.Received(pdu));
            machine.context().closeTransport();
            return UpperLayerState.STA1;
        }
    },
    AA_4("Issue A-P-ABORT indication primitive") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            machine.context().indicate(new Indication.ProviderAbort(AbortSource.REASON_NOT_SPECIFIED));
            return UpperLayerState.STA1;
        }
    },
    AA_5("Stop ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            machine.context().stopArtim();
            return UpperLayerState.STA1;
        }
    },
    AA_6("Ignore PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            return UpperLayerState.STA13;
        }
    },
    AA_7("Send A-ABORT PDU") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            machine.context().send(new Pdu.Abort(AbortSource.SERVICE_PROVIDER.code(), AbortSource.REASON_UNEXPECTED_PDU));
            return UpperLayerState.STA13;
        }
    },
    AA_8("Send A-ABORT PDU (service-provider source), issue A-P-ABORT indication, start ARTIM timer") {
        @Override
        UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu) {
            machine.markAborted();
            UpperLayerContext context = machine.context();
            context.send(new Pdu.Abort(AbortSource.SERVICE_PROVIDER.code(), AbortSource.REASON_UNEXPECTED_PDU));
            context.indicate(new Indication.ProviderAbort(AbortSource.REASON_UNEXPECTED_PDU));
            context.startArtim();
            return UpperLayerState.STA13;
        }
    };

    private final String description;

    UpperLayerAction(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public String label() {
        return name().replace('_', '-');
    }

    abstract UpperLayerState execute(UpperLayerStateMachine machine, Pdu pdu);
}
