package it.netdicom.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

import it.netdicom.dimse.CommandElement;
import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.CommandSet;
import it.netdicom.dimse.DimseCommands;
import it.netdicom.dimse.DimseResult;
import it.netdicom.dimse.Status;
import it.netdicom.event.Event;
import it.netdicom.event.HandlerType;

class NormalizedServiceTest {

    private static final String MPPS = "1.2.840.10008.3.1.2.3.3";
    private static final String MPPS_INSTANCE = "1.2.826.0.1.3680043.2.1";

    private final ServiceFixtures fixtures = new ServiceFixtures();
    private final NormalizedService service = new NormalizedService();

    @Test
    void nCreateResponseCarriesHandlerResult() {
        byte[] attributes = {0x10, 0x00, 0x10, 0x00, 0, 0, 0, 0};
        fixtures.handlers.bind(HandlerType.N_CREATE, event -> DimseResult.of(Status.SUCCESS, attributes));
        Event event = fixtures.event(DimseCommands.nCreateRequest(2, MPPS, MPPS_INSTANCE), new byte[0]);

        service.handle(event);

        CommandSet response = fixtures.onlyResponse(event);
        assertEquals(CommandField.N_CREATE_RSP, response.commandField());
        assertEquals(MPPS_INSTANCE, response.getString(CommandElement.AFFECTED_SOP_INSTANCE_UID));
        assertArrayEquals(attributes, fixtures.responseData(event).get(0));
    }

    @Test
    void unboundOperationIsProcessingFailure() {
        fixtures.handlers.bind(HandlerType.N_CREATE, event -> DimseResult.of(Status.SUCCESS));
        Event event = fixtures.event(DimseCommands.nDeleteRequest(3, MPPS, MPPS_INSTANCE), null);

        service.handle(event);

        assertEquals(Status.PROCESSING_FAILURE, fixtures.onlyResponse(event).status());
        assertNull(fixtures.responseData(event).get(0));
    }

    @Test
    void handlerFailureIsProcessingFailure() {
        fixtures.handlers.bind(HandlerType.N_ACTION, event -> {
            throw new IllegalStateException("queue full");
        });
        Event event = fixtures.event(DimseCommands.nActionRequest(4, MPPS, MPPS_INSTANCE, 1), null);

        service.handle(event);

        CommandSet response = fixtures.onlyResponse(event);
        assertEquals(Status.PROCESSING_FAILURE, response.status());
        assertEquals(1, response.getInt(CommandElement.ACTION_TYPE_ID));
        assertEquals("queue full", response.getString(CommandElement.ERROR_COMMENT));
    }
}
