package it.netdicom.fsm;

import it.netdicom.pdu.Pdu;

/** Upper Layer events, PS3.8 Table 9-10. */
public enum UpperLayerEvent {
    EVT1("A-ASSOCIATE request (local user)"),
    EVT2("Transport connection confirmation (local transport service)"),
    EVT3("A-ASSOCIATE-AC PDU received"),
    EVT4("A-ASSOCIATE-RJ PDU received"),
    EVT5("Transport connection indication (local transport service)"),
    EVT6("A-ASSOCIATE-RQ PDU received"),
    EVT7("A-ASSOCIATE response primitive (accept)"),
    EVT8("A-ASSOCIATE response primitive (reject)"),
    EVT9("P-DATA request primitive"),
    EVT10("P-DATA-TF PDU received"),
    EVT11("A-RELEASE request primitive"),
    EVT12("A-RELEASE-RQ PDU received"),
    EVT13("A-RELEASE-RP PDU received"),
    EVT14("A-RELEASE response primitive"),
    EVT15("A-ABORT request primitive"),
    EVT16("A-ABORT PDU received"),
    EVT17("Transport connection closed indication"),
    EVT18("ARTIM timer expired"),
    EVT19("Unrecognised or invalid PDU received");

    private final String description;

    UpperLayerEvent(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public String label() {
        return "Evt" + (ordinal() + 1);
    }

    /** Event raised when the peer sends the given PDU. */
    public static UpperLayerEvent received(Pdu pdu) {
        return switch (pdu.type()) {
            case Pdu.ASSOCIATE_RQ -> EVT6;
            case Pdu.ASSOCIATE_AC -> EVT3;
            case Pdu.ASSOCIATE_RJ -> EVT4;
            case Pdu.P_DATA_TF -> EVT10;
            case Pdu.RELEASE_RQ -> EVT12;
            case Pdu.RELEASE_RP -> EVT13;
            case Pdu.ABORT -> EVT16;
            default -> EVT19;
        };
    }

    /** Event raised when the local user asks to send the given PDU. */
    public static UpperLayerEvent requested(Pdu pdu) {
        return switch (pdu.type()) {
            case Pdu.ASSOCIATE_RQ -> EVT1;
            case Pdu.ASSOCIATE_AC -> EVT7;
            case Pdu.ASSOCIATE_RJ -> EVT8;
            case Pdu.P_DATA_TF -> EVT9;
            case Pdu.RELEASE_RQ -> EVT11;
            case Pdu.RELEASE_RP -> EVT14;
            case Pdu.ABORT -> EVT15;
            default -> throw new IllegalArgumentException("Unsupported PDU type " + pdu.type());
        };
    }
}
