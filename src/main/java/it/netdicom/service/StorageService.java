package it.netdicom.service;

import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.DatasetDecodeException;
import it.netdicom.dimse.Status;
import it.netdicom.event.Event;
import it.netdicom.event.HandlerType;
import it.netdicom.event.Handlers;

/** Storage SCP: hands each received instance to the bound C-STORE handler. */
public class StorageService implements ServiceClass {

    private static final Logger logger = LoggerFactory.getLogger(StorageService.class);

    @Override
    public String name() {
        return "Storage";
    }

    @Override
    public Set<CommandField> requests() {
        return Set.of(CommandField.C_STORE_RQ);
    }

    @Override
    public void handle(Event event) {
        if (!event.request().hasDataSet()) {
            ServiceResponses.failure(event, Status.STORE_CANNOT_UNDERSTAND, "C-STORE request has no data set");
            return;
        }
        Optional<Handlers.StatusHandler> handler = event.association().handlers().handler(HandlerType.C_STORE);
        if (handler.isEmpty()) {
            logger.warn("No C-STORE handler bound, refusing {}", event.command().sopInstanceUid().orElse("instance"));
            ServiceResponses.failure(event, Status.STORE_UNABLE_TO_PROCESS, "No storage handler");
            return;
        }
        try {
            ServiceResponses.respond(event, handler.get().handle(event));
        } catch (DatasetDecodeException e) {
            logger.warn("C-STORE data set could not be decoded: {}", e.getMessage());
            ServiceResponses.failure(event, Status.STORE_CANNOT_UNDERSTAND, e.getMessage());
        } catch (Exception e) {
            logger.error("C-STORE handler failed: {}", e.getMessage(), e);
            ServiceResponses.failure(event, Status.STORE_UNABLE_TO_PROCESS, e.getMessage());
        }
    }
}
