package it.netdicom.pdu;

import java.util.List;

public sealed interface Pdu permits Pdu.AssociateRq, Pdu.AssociateAc, Pdu.AssociateRj, Pdu.PDataTf, Pdu.ReleaseRq, Pdu.ReleaseRp, Pdu.Abort {

    int ASSOCIATE_RQ = 0x01;
    int ASSOCIATE_AC = 0x02;
    int ASSOCIATE_RJ = 0x03;
    int P_DATA_TF = 0x04;
    int RELEASE_RQ = 0x05;
    int RELEASE_RP = 0x06;
    int ABORT = 0x07;

    int PROTOCOL_VERSION = 0x0001;

    int type();

    record AssociateRq(
        int protocolVersion,
        String calledAeTitle,
        String callingAeTitle,
        String applicationContext,
        List<PresentationContextRqItem> presentationContexts,
        UserInformation userInformation
    ) implements Pdu {

        public AssociateRq {
            presentationContexts = List.copyOf(presentationContexts);
        }

        @Override
        public int type() {
            return ASSOCIATE_RQ;
        }
    }

    record AssociateAc(
        int protocolVersion,
        String calledAeTitle,
        String callingAeTitle,
        String applicationContext,
        List<PresentationContextAcItem> presentationContexts,
        UserInformation userInformation
    ) implements Pdu {

        public AssociateAc {
            presentationContexts = List.copyOf(presentationContexts);
        }

        @Override
        public int type() {
            return ASSOCIATE_AC;
        }
    }

    record AssociateRj(int result, int source, int reason) implements Pdu {

        @Override
        public int type() {
            return ASSOCIATE_RJ;
        }
    }

    record PDataTf(List<PresentationDataValue> values) implements Pdu {

        public PDataTf {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("P-DATA-TF requires at least one presentation data value");
            }
            values = List.copyOf(values);
        }

        @Override
        public int type() {
            return P_DATA_TF;
        }
    }

    record ReleaseRq() implements Pdu {

        @Override
        public int type() {
            return RELEASE_RQ;
        }
    }

    record ReleaseRp() implements Pdu {

        @Override
        public int type() {
            return RELEASE_RP;
        }
    }

    record Abort(int source, int reason) implements Pdu {

        @Override
        public int type() {
            return ABORT;
        }
    }
}
