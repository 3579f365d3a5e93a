package it.netdicom.dimse;

import java.util.Optional;

/**
 * A command set plus an optional encoded data set, bound to the presentation context that carries it.
 * <p>
 * The command set is copied so that its Command Data Set Type matches the data set; the caller's instance is
 * left as it was. The data set array is not copied: ownership passes to the message and the caller must
 * not modify it afterwards.
 */
public record DimseMessage(int contextId, CommandSet command, byte[] dataSet) {

    public DimseMessage {
        if (command == null) {
            throw new IllegalArgumentException("DIMSE message requires a command set");
        }
        command = command.copy()
            .put(CommandElement.COMMAND_DATA_SET_TYPE, dataSet == null ? CommandSet.NO_DATA_SET : CommandSet.DATA_SET_PRESENT);
    }

    public static DimseMessage of(int contextId, CommandSet command) {
        return new DimseMessage(contextId, command, null);
    }

    public CommandField commandField() {
        return command.commandField();
    }

    public boolean hasDataSet() {
        return dataSet != null;
    }

    public Optional<byte[]> optionalDataSet() {
        return Optional.ofNullable(dataSet);
    }

    @Override
    public String toString() {
        return "DimseMessage[" + command.commandField() + ", context=" + contextId
            + (dataSet == null ? ", no data set" : ", data set " + dataSet.length + " bytes") + "]";
    }
}
