package it.netdicom.dimse;

import java.util.Optional;

/**
 * Command group (0000,xxxx) elements understood by the message layer, declared in tag order.
 */
public enum CommandElement {
    COMMAND_GROUP_LENGTH(0x0000, Vr.UL),
    AFFECTED_SOP_CLASS_UID(0x0002, Vr.UI),
    REQUESTED_SOP_CLASS_UID(0x0003, Vr.UI),
    COMMAND_FIELD(0x0100, Vr.US),
    MESSAGE_ID(0x0110, Vr.US),
    MESSAGE_ID_BEING_RESPONDED_TO(0x0120, Vr.US),
    MOVE_DESTINATION(0x0600, Vr.AE),
    PRIORITY(0x0700, Vr.US),
    COMMAND_DATA_SET_TYPE(0x0800, Vr.US),
    STATUS(0x0900, Vr.US),
    OFFENDING_ELEMENT(0x0901, Vr.AT),
    ERROR_COMMENT(0x0902, Vr.LO),
    ERROR_ID(0x0903, Vr.US),
    AFFECTED_SOP_INSTANCE_UID(0x1000, Vr.UI),
    REQUESTED_SOP_INSTANCE_UID(0x1001, Vr.UI),
    EVENT_TYPE_ID(0x1002, Vr.US),
    ATTRIBUTE_IDENTIFIER_LIST(0x1005, Vr.AT),
    ACTION_TYPE_ID(0x1008, Vr.US),
    NUMBER_OF_REMAINING_SUBOPERATIONS(0x1020, Vr.US),
    NUMBER_OF_COMPLETED_SUBOPERATIONS(0x1021, Vr.US),
    NUMBER_OF_FAILED_SUBOPERATIONS(0x1022, Vr.US),
    NUMBER_OF_WARNING_SUBOPERATIONS(0x1023, Vr.US),
    MOVE_ORIGINATOR_AE_TITLE(0x1030, Vr.AE),
    MOVE_ORIGINATOR_MESSAGE_ID(0x1031, Vr.US);

    public enum Vr {
        UL, US, UI, AE, LO, AT
    }

    private final int element;
    private final Vr vr;

    CommandElement(int element, Vr vr) {
        this.element = element;
        this.vr = vr;
    }

    public int element() {
        return element;
    }

    public Vr vr() {
        return vr;
    }

    public String tag() {
        return String.format("(0000,%04X)", element);
    }

    public static Optional<CommandElement> byElement(int element) {
        for (CommandElement candidate : values()) {
            if (candidate.element == element) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
