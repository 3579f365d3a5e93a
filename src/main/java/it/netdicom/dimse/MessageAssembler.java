package it.netdicom.dimse;

import java.io.ByteArrayOutputStream;
import java.util.Optional;

import it.netdicom.pdu.PresentationDataValue;

/**
 * Rebuilds DIMSE messages from the PDVs of incoming P-DATA-TF PDUs, one message at a time.
 * Not thread safe; owned by the thread reading the association.
 */
public class MessageAssembler {

    private final ByteArrayOutputStream commandBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream dataBytes = new ByteArrayOutputStream();
    private int contextId;
    private CommandSet command;

    /**
     * Appends a fragment.
     *
     * @return the completed message once its last fragment arrived
     * @throws MalformedCommandException when fragments arrive out of order or the command set cannot be decoded
     */
    public Optional<DimseMessage> accept(PresentationDataValue pdv) {
        if (commandBytes.size() == 0 && command == null && dataBytes.size() == 0) {
            contextId = pdv.contextId();
        } else if (pdv.contextId() != contextId) {
            reset();
            throw new MalformedCommandException("Fragment for context " + pdv.contextId() + " interleaved with a message on context " + contextId);
        }

        if (pdv.isCommand()) {
            if (command != null) {
                reset();
                throw new MalformedCommandException("Command fragment received after the command set was complete");
            }
            commandBytes.writeBytes(pdv.data());
            if (!pdv.isLastFragment()) {
                return Optional.empty();
            }
            try {
                command = CommandSet.decode(commandBytes.toByteArray());
            } catch (MalformedCommandException e) {
                reset();
                throw e;
            }
            if (!command.hasDataSet()) {
                return Optional.of(complete(null));
            }
            return Optional.empty();
        }

        if (command == null) {
            reset();
            throw new MalformedCommandException("Data fragment received before the command set was complete");
        }
        dataBytes.writeBytes(pdv.data());
        if (pdv.isLastFragment()) {
            return Optional.of(complete(dataBytes.toByteArray()));
        }
        return Optional.empty();
    }

    public boolean isIdle() {
        return command == null && commandBytes.size() == 0;
    }

    private DimseMessage complete(byte[] dataSet) {
        DimseMessage message = new DimseMessage(contextId, command, dataSet);
        reset();
        return message;
    }

    private void reset() {
        commandBytes.reset();
        dataBytes.reset();
        command = null;
        contextId = 0;
    }
}
