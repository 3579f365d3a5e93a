package it.netdicom.service;

import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.Status;
import it.netdicom.event.Event;
import it.netdicom.event.HandlerType;
import it.netdicom.event.Handlers;

/** Verification SCP. Replies success unless a bound C-ECHO handler says otherwise. */
public class VerificationService implements ServiceClass {

    private static final Logger logger = LoggerFactory.getLogger(VerificationService.class);

    @Override
    public String name() {
        return "Verification";
    }

    @Override
    public Set<CommandField> requests() {
        return Set.of(CommandField.C_ECHO_RQ);
    }

    @Override
    public void handle(Event event) {
        int status = Status.SUCCESS;
        Optional<Handlers.StatusHandler> handler = event.association().handlers().handler(HandlerType.C_ECHO);
        if (handler.isPresent()) {
            try {
                status = handler.get().handle(event);
            } catch (Exception e) {
                logger.error("C-ECHO handler failed, replying success: {}", e.getMessage(), e);
                status = Status.SUCCESS;
            }
        }
        ServiceResponses.respond(event, status);
    }
}
