package it.netdicom.acse;

import java.util.List;

import it.netdicom.pdu.Pdu;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.presentation.NegotiatedContext;

public sealed interface AcseDecision permits AcseDecision.Accept, AcseDecision.Reject {

    record Accept(Pdu.AssociateAc pdu, List<NegotiatedContext> contexts, List<SopClassCommonExtended> acceptedCommonExtended) implements AcseDecision {

        public Accept {
            contexts = List.copyOf(contexts);
            acceptedCommonExtended = List.copyOf(acceptedCommonExtended);
        }
    }

    record Reject(Rejection rejection) implements AcseDecision {

        public Pdu.AssociateRj pdu() {
            return rejection.toPdu();
        }
    }
}
