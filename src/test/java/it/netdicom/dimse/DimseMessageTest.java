package it.netdicom.dimse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DimseMessageTest {

    private static final String CT_IMAGE = "1.2.840.10008.5.1.4.1.1.2";

    @Test
    void marksDataSetTypeOnItsOwnCopyOfTheCommand() {
        CommandSet command = DimseCommands.storeRequest(7, CT_IMAGE, "1.2.3.4", DimseCommands.PRIORITY_MEDIUM);

        DimseMessage message = new DimseMessage(1, command, new byte[] {1, 2});

        assertTrue(message.command().hasDataSet());
        assertFalse(command.hasDataSet());
        assertNotSame(command, message.command());
        assertEquals(7, message.command().messageId());
    }

    @Test
    void sameCommandCanBeSentWithAndWithoutData() {
        CommandSet command = DimseCommands.echoRequest(3, "1.2.840.10008.1.1");

        DimseMessage withData = new DimseMessage(1, command, new byte[] {9});
        DimseMessage withoutData = DimseMessage.of(1, command);

        assertTrue(withData.command().hasDataSet());
        assertFalse(withoutData.command().hasDataSet());
    }

    @Test
    void copyIsIndependentOfLaterChanges() {
        CommandSet command = DimseCommands.echoRequest(3, "1.2.840.10008.1.1");
        CommandSet copy = command.copy();

        command.put(CommandElement.PRIORITY, DimseCommands.PRIORITY_HIGH);

        assertFalse(copy.contains(CommandElement.PRIORITY));
        assertEquals(command.messageId(), copy.messageId());
    }

    @Test
    void requiresACommand() {
        assertThrows(IllegalArgumentException.class, () -> new DimseMessage(1, null, null));
    }
}
