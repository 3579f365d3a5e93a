package it.netdicom.service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.netdicom.association.ApplicationEntity;
import it.netdicom.association.Association;
import it.netdicom.dimse.CommandElement;
import it.netdicom.dimse.CommandField;
import it.netdicom.dimse.CommandSet;
import it.netdicom.dimse.DatasetDecodeException;
import it.netdicom.dimse.DimseCommands;
import it.netdicom.dimse.DimseMessage;
import it.netdicom.dimse.DimseResult;
import it.netdicom.dimse.FailedInstanceList;
import it.netdicom.dimse.Status;
import it.netdicom.dimse.StatusCategory;
import it.netdicom.dimse.SubOperationCounts;
import it.netdicom.event.Event;
import it.netdicom.event.HandlerType;
import it.netdicom.event.Handlers;
import it.netdicom.event.RetrieveResponse;
import it.netdicom.event.RetrieveResult;
import it.netdicom.pdu.AeTitles;

/**
 * Query/Retrieve SCP: C-FIND, C-GET and C-MOVE.
 * <p>
 * Handlers return iterators; a C-CANCEL from the peer is checked before each further response.
 * C-GET sub-operations run on the same association, C-MOVE sub-operations on a new association to the
 * destination the handler resolved.
 */
public class QueryRetrieveService implements ServiceClass {

    private static final Logger logger = LoggerFactory.getLogger(QueryRetrieveService.class);

    @Override
    public String name() {
        return "Query/Retrieve";
    }

    @Override
    public Set<CommandField> requests() {
        return EnumSet.of(CommandField.C_FIND_RQ, CommandField.C_GET_RQ, CommandField.C_MOVE_RQ);
    }

    @Override
    public void handle(Event event) {
        switch (event.request().commandField()) {
            case C_FIND_RQ -> find(event);
            case C_GET_RQ -> get(event);
            case C_MOVE_RQ -> move(event);
            default -> throw new IllegalArgumentException(event.request().commandField() + " is not a query/retrieve request");
        }
    }

    private void find(Event event) {
        Optional<Handlers.FindHandler> handler = event.association().handlers().handler(HandlerType.C_FIND);
        if (handler.isEmpty()) {
            ServiceResponses.failure(event, Status.FIND_UNABLE_TO_PROCESS, "No C-FIND handler");
            return;
        }
        Iterator<DimseResult> results;
        try {
            results = handler.get().handle(event);
        } catch (DatasetDecodeException e) {
            ServiceResponses.failure(event, Status.FIND_CANNOT_UNDERSTAND, e.getMessage());
            return;
        } catch (Exception e) {
            logger.error("C-FIND handler failed: {}", e.getMessage(), e);
            ServiceResponses.failure(event, Status.FIND_UNABLE_TO_PROCESS, e.getMessage());
            return;
        }

        while (true) {
            if (event.isCancelled()) {
                logger.info("C-FIND {} cancelled by peer", event.messageId());
                ServiceResponses.respond(event, Status.CANCEL);
                return;
            }
            DimseResult result;
            try {
                if (!results.hasNext()) {
                    ServiceResponses.respond(event, Status.SUCCESS);
                    return;
                }
                result = results.next();
            } catch (DatasetDecodeException e) {
                ServiceResponses.failure(event, Status.FIND_CANNOT_UNDERSTAND, e.getMessage());
                return;
            } catch (RuntimeException e) {
                logger.error("C-FIND handler failed while yielding results: {}", e.getMessage(), e);
                ServiceResponses.failure(event, Status.FIND_UNABLE_TO_PROCESS, e.getMessage());
                return;
            }
            switch (result.category()) {
                case PENDING -> {
                    if (!result.hasDataSet()) {
                        logger.warn("C-FIND pending result without identifier");
                    }
                    ServiceResponses.respond(event, result);
                }
                case SUCCESS, CANCEL -> {
                    ServiceResponses.respond(event, result.status());
                    return;
                }
                case FAILURE -> {
                    ServiceResponses.respond(event, result);
                    return;
                }
                case WARNING -> {
                    logger.warn("C-FIND handler yielded status {} which C-FIND does not define", Status.hex(result.status()));
                    ServiceResponses.failure(event, Status.FIND_INVALID_STATUS, "Invalid status " + Status.hex(result.status()));
                    return;
                }
            }
        }
    }

    private void get(Event event) {
        Optional<RetrieveResponse> response = retrieve(event, HandlerType.C_GET, Status.GET_CANNOT_UNDERSTAND, Status.GET_UNABLE_TO_PROCESS);
        if (response.isEmpty()) {
            return;
        }
        int total = response.get().subOperations();
        if (total < 0) {
            ServiceResponses.failure(event, Status.GET_INVALID_SUB_OPERATIONS, "Invalid number of sub-operations " + total);
            return;
        }
        if (total > Status.MAX_SUB_OPERATIONS) {
            ServiceResponses.failure(event, Status.GET_TOO_MANY_SUB_OPERATIONS, total + " sub-operations exceed the maximum");
            return;
        }
        runSubOperations(event, response.get().results(), total, event.association(), null, Status.GET_UNABLE_TO_PROCESS);
    }

    private void move(Event event) {
        String destinationTitle;
        try {
            destinationTitle = AeTitles.normalize(event.command().optionalString(CommandElement.MOVE_DESTINATION).orElse(null));
        } catch (IllegalArgumentException e) {
            ServiceResponses.failure(event, Status.MOVE_INVALID_DESTINATION, e.getMessage());
            return;
        }
        Optional<RetrieveResponse> response = retrieve(event, HandlerType.C_MOVE, Status.MOVE_CANNOT_UNDERSTAND, Status.MOVE_UNABLE_TO_PROCESS);
        if (response.isEmpty()) {
            return;
        }
        Optional<RetrieveResponse.Destination> destination = response.get().destination();
        if (destination.isEmpty()) {
            logger.warn("C-MOVE destination {} is unknown", destinationTitle);
            ServiceResponses.failure(event, Status.MOVE_DESTINATION_UNKNOWN, "Unknown move destination " + destinationTitle);
            return;
        }
        int total = response.get().subOperations();
        if (total < 0) {
            ServiceResponses.failure(event, Status.MOVE_INVALID_SUB_OPERATIONS, "Invalid number of sub-operations " + total);
            return;
        }
        if (total > Status.MAX_SUB_OPERATIONS) {
            ServiceResponses.failure(event, Status.MOVE_TOO_MANY_SUB_OPERATIONS, total + " sub-operations exceed the maximum");
            return;
        }

        ApplicationEntity ae = event.association().applicationEntity();
        Association storeAssociation;
        try {
            storeAssociation = ae.associate(destination.get().host(), destination.get().port(), destinationTitle);
        } catch (RuntimeException e) {
            logger.warn("C-MOVE association to {} failed: {}", destinationTitle, e.getMessage());
            ServiceResponses.failure(event, Status.MOVE_DESTINATION_UNKNOWN, "Cannot associate with " + destinationTitle);
            return;
        }
        if (!storeAssociation.isEstablished()) {
            logger.warn("C-MOVE association to {} was not established: {}", destinationTitle, storeAssociation.status());
            ServiceResponses.failure(event, Status.MOVE_DESTINATION_UNKNOWN, "Association with " + destinationTitle + " " + storeAssociation.status());
            return;
        }
        try {
            runSubOperations(event, response.get().results(), total, storeAssociation, event.association().peerAeTitle(), Status.MOVE_UNABLE_TO_PROCESS);
        } finally {
            if (storeAssociation.isEstablished()) {
                storeAssociation.release();
            }
        }
    }

    private Optional<RetrieveResponse> retrieve(Event event, HandlerType<Handlers.RetrieveHandler> type, int cannotUnderstand, int unableToProcess) {
        Optional<Handlers.RetrieveHandler> handler = event.association().handlers().handler(type);
        if (handler.isEmpty()) {
            ServiceResponses.failure(event, unableToProcess, "No " + type + " handler");
            return Optional.empty();
        }
        try {
            return Optional.of(handler.get().handle(event));
        } catch (DatasetDecodeException e) {
            ServiceResponses.failure(event, cannotUnderstand, e.getMessage());
        } catch (Exception e) {
            logger.error("{} handler failed: {}", type, e.getMessage(), e);
            ServiceResponses.failure(event, unableToProcess, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Sends one C-STORE per yielded instance over the store association and a pending response to the
     * requestor after each, then the final status.
     */
    private void runSubOperations(
        Event event,
        Iterator<RetrieveResult> results,
        int total,
        Association storeAssociation,
        String moveOriginator,
        int unableToProcess
    ) {
        SubOperationCounts counts = SubOperationCounts.of(total);
        List<String> failedInstances = new ArrayList<>();
        int priority = event.command().optionalInt(CommandElement.PRIORITY).orElse(DimseCommands.PRIORITY_MEDIUM);

        while (counts.remaining() > 0) {
            if (event.isCancelled()) {
                logger.info("{} {} cancelled by peer", event.request().commandField().operation(), event.messageId());
                sendRetrieveResponse(event, Status.CANCEL, counts, failedInstances);
                return;
            }
            RetrieveResult result;
            try {
                if (!results.hasNext()) {
                    break;
                }
                result = results.next();
            } catch (RuntimeException e) {
                logger.error("Retrieve handler failed while yielding instances: {}", e.getMessage(), e);
                sendRetrieveResponse(event, unableToProcess, counts.failRemaining(), failedInstances);
                return;
            }

            if (result.instance().isEmpty()) {
                StatusCategory category = StatusCategory.of(result.status());
                if (category == StatusCategory.PENDING) {
                    logger.warn("Pending retrieve result without an instance ignored");
                    continue;
                }
                if (category == StatusCategory.SUCCESS) {
                    break;
                }
                sendRetrieveResponse(event, result.status(), category == StatusCategory.CANCEL ? counts : counts.failRemaining(), failedInstances);
                return;
            }

            RetrieveResult.Instance instance = result.instance().get();
            StatusCategory outcome = store(storeAssociation, instance, priority, moveOriginator, event.messageId());
            counts = counts.record(outcome);
            if (outcome == StatusCategory.FAILURE) {
                failedInstances.add(instance.sopInstanceUid());
            }
            if (!storeAssociation.isEstablished()) {
                logger.warn("Store association {} ended, failing {} remaining sub-operations", storeAssociation.name(), counts.remaining());
                counts = counts.failRemaining();
            }
            if (counts.remaining() > 0) {
                sendRetrieveResponse(event, Status.PENDING, counts, List.of());
            }
        }

        if (counts.remaining() > 0) {
            logger.warn("Retrieve handler yielded {} fewer instances than announced", counts.remaining());
            counts = counts.failRemaining();
        }
        int finalStatus;
        if (counts.failed() == 0 && counts.warning() == 0) {
            finalStatus = Status.SUCCESS;
        } else if (counts.completed() == 0 && counts.warning() == 0) {
            finalStatus = Status.SUB_OPERATIONS_ALL_FAILED;
        } else {
            finalStatus = Status.SUB_OPERATIONS_WARNING;
        }
        sendRetrieveResponse(event, finalStatus, counts, failedInstances);
    }

    private StatusCategory store(Association association, RetrieveResult.Instance instance, int priority, String moveOriginator, int moveMessageId) {
        DimseMessage response;
        try {
            response = association.sendStore(instance, priority, moveOriginator, moveOriginator == null ? null : moveMessageId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.warn("C-STORE sub-operation for {} failed: {}", instance.sopInstanceUid(), e.getMessage());
            return StatusCategory.FAILURE;
        }
        int status = response.command().status();
        StatusCategory category = StatusCategory.of(status);
        if (category == StatusCategory.SUCCESS || category == StatusCategory.WARNING) {
            return category;
        }
        logger.info("C-STORE sub-operation for {} returned {}", instance.sopInstanceUid(), Status.hex(status));
        return StatusCategory.FAILURE;
    }

    private void sendRetrieveResponse(Event event, int status, SubOperationCounts counts, List<String> failedInstances) {
        CommandSet response = DimseCommands.retrieveResponse(event.command(), status, counts);
        byte[] identifier = null;
        if (!failedInstances.isEmpty() && StatusCategory.of(status) != StatusCategory.PENDING) {
            try {
                identifier = FailedInstanceList.encode(failedInstances, event.transferSyntax());
            } catch (IllegalArgumentException e) {
                logger.warn("Failed SOP Instance UID List not sent: {}", e.getMessage());
            }
        }
        ServiceResponses.respond(event, response, identifier);
    }
}
