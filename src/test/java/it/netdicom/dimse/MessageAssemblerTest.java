package it.netdicom.dimse;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import it.netdicom.pdu.PresentationDataValue;

class MessageAssemblerTest {

    private MessageAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new MessageAssembler();
    }

    private static byte[] storeCommand() {
        CommandSet command = DimseCommands.storeRequest(9, "1.2.840.10008.5.1.4.1.1.7", "1.2.3", DimseCommands.PRIORITY_LOW)
            .put(CommandElement.COMMAND_DATA_SET_TYPE, CommandSet.DATA_SET_PRESENT);
        return command.encode();
    }

    @Test
    void commandSplitAcrossFragmentsCompletesOnLastFragment() {
        byte[] encoded = DimseCommands.echoRequest(4, "1.2.840.10008.1.1").encode();
        int half = encoded.length / 2;

        assertTrue(assembler.accept(PresentationDataValue.of(1, true, false, Arrays.copyOfRange(encoded, 0, half))).isEmpty());
        assertFalse(assembler.isIdle());
        Optional<DimseMessage> message = assembler.accept(PresentationDataValue.of(1, true, true, Arrays.copyOfRange(encoded, half, encoded.length)));

        assertEquals(CommandField.C_ECHO_RQ, message.orElseThrow().commandField());
        assertEquals(1, message.get().contextId());
        assertFalse(message.get().hasDataSet());
        assertTrue(assembler.isIdle());
    }

    @Test
    void dataSetIsCollectedAfterCommand() {
        assertTrue(assembler.accept(PresentationDataValue.of(5, true, true, storeCommand())).isEmpty());
        assertTrue(assembler.accept(PresentationDataValue.of(5, false, false, new byte[] {1, 2})).isEmpty());
        DimseMessage message = assembler.accept(PresentationDataValue.of(5, false, true, new byte[] {3, 4})).orElseThrow();

        assertArrayEquals(new byte[] {1, 2, 3, 4}, message.dataSet());
        assertEquals("1.2.3", message.command().sopInstanceUid().orElseThrow());
    }

    @Test
    void dataBeforeCommandCompleteIsMalformed() {
        byte[] encoded = storeCommand();
        assembler.accept(PresentationDataValue.of(1, true, false, Arrays.copyOf(encoded, 10)));

        assertThrows(MalformedCommandException.class,
            () -> assembler.accept(PresentationDataValue.of(1, false, true, new byte[] {0, 0})));
        assertTrue(assembler.isIdle());
    }

    @Test
    void fragmentOnAnotherContextMidMessageIsMalformed() {
        assembler.accept(PresentationDataValue.of(1, true, true, storeCommand()));

        assertThrows(MalformedCommandException.class,
            () -> assembler.accept(PresentationDataValue.of(3, false, true, new byte[] {0, 0})));
    }

    @Test
    void commandFragmentAfterCompleteCommandIsMalformed() {
        assembler.accept(PresentationDataValue.of(1, true, true, storeCommand()));

        assertThrows(MalformedCommandException.class,
            () -> assembler.accept(PresentationDataValue.of(1, true, true, storeCommand())));
    }

    @Test
    void undecodableCommandResetsAssembler() {
        assertThrows(MalformedCommandException.class,
            () -> assembler.accept(PresentationDataValue.of(1, true, true, new byte[] {8, 0, 0, 0, 2, 0, 0, 0, 0, 0})));
        assertTrue(assembler.isIdle());

        Optional<DimseMessage> next = assembler.accept(PresentationDataValue.of(7, true, true, DimseCommands.echoRequest(2, "1.2.840.10008.1.1").encode()));
        assertEquals(7, next.orElseThrow().contextId());
    }
}
