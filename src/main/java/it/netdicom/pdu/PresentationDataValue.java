package it.netdicom.pdu;

import java.util.Arrays;

public record PresentationDataValue(int contextId, int controlHeader, byte[] data) {

    public static final int COMMAND_BIT = 0x01;
    public static final int LAST_FRAGMENT_BIT = 0x02;

    public PresentationDataValue {
        if (contextId < 1 || contextId > 255) {
            throw new IllegalArgumentException("Presentation context id out of range: " + contextId);
        }
        if ((controlHeader & ~(COMMAND_BIT | LAST_FRAGMENT_BIT)) != 0) {
            throw new IllegalArgumentException("Invalid message control header 0x" + Integer.toHexString(controlHeader));
        }
        if (data == null) {
            throw new IllegalArgumentException("PDV data is required");
        }
    }

    public static PresentationDataValue of(int contextId, boolean command, boolean last, byte[] data) {
        int header = (command ? COMMAND_BIT : 0) | (last ? LAST_FRAGMENT_BIT : 0);
        return new PresentationDataValue(contextId, header, data);
    }

    public boolean isCommand() {
        return (controlHeader & COMMAND_BIT) != 0;
    }

    public boolean isLastFragment() {
        return (controlHeader & LAST_FRAGMENT_BIT) != 0;
    }

    /** Encoded size of the item: length field, context id, control header and payload. */
    public int encodedLength() {
        return 4 + 2 + data.length;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PresentationDataValue pdv
            && contextId == pdv.contextId
            && controlHeader == pdv.controlHeader
            && Arrays.equals(data, pdv.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * contextId + controlHeader) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PDV[context=" + contextId + ", " + (isCommand() ? "command" : "data")
            + (isLastFragment() ? ", last" : "") + ", " + data.length + " bytes]";
    }
}
