package it.netdicom.service;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.DatasetDecodeException;
import it.netdicom.dimse.DimseResult;
import it.netdicom.dimse.Status;
import it.netdicom.event.Event;
import it.netdicom.event.HandlerType;
import it.netdicom.event.Handlers;

/** DIMSE-N SCP for normalized SOP classes such as MPPS and Storage Commitment. */
public class NormalizedService implements ServiceClass {

    private static final Logger logger = LoggerFactory.getLogger(NormalizedService.class);

    private static final Set<CommandField> REQUESTS = EnumSet.of(
        CommandField.N_EVENT_REPORT_RQ,
        CommandField.N_GET_RQ,
        CommandField.N_SET_RQ,
        CommandField.N_ACTION_RQ,
        CommandField.N_CREATE_RQ,
        CommandField.N_DELETE_RQ
    );

    @Override
    public String name() {
        return "Normalized";
    }

    @Override
    public Set<CommandField> requests() {
        return REQUESTS;
    }

    @Override
    public void handle(Event event) {
        HandlerType<Handlers.NormalizedHandler> type = HandlerType.normalized(event.request().commandField());
        Optional<Handlers.NormalizedHandler> handler = event.association().handlers().handler(type);
        if (handler.isEmpty()) {
            logger.warn("No {} handler bound", type);
            ServiceResponses.failure(event, Status.PROCESSING_FAILURE, "No " + type + " handler");
            return;
        }
        DimseResult result;
        try {
            result = handler.get().handle(event);
        } catch (DatasetDecodeException e) {
            logger.warn("{} data set could not be decoded: {}", type, e.getMessage());
            ServiceResponses.failure(event, Status.PROCESSING_FAILURE, e.getMessage());
            return;
        } catch (Exception e) {
            logger.error("{} handler failed: {}", type, e.getMessage(), e);
            ServiceResponses.failure(event, Status.PROCESSING_FAILURE, e.getMessage());
            return;
        }
        ServiceResponses.respond(event, result);
    }
}
