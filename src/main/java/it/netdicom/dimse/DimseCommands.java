package it.netdicom.dimse;

/**
 * Builders for the request and response command sets of every DIMSE-C and DIMSE-N operation.
 */
public final class DimseCommands {

    public static final int PRIORITY_MEDIUM = 0x0000;
    public static final int PRIORITY_HIGH = 0x0001;
    public static final int PRIORITY_LOW = 0x0002;

    private DimseCommands() {
    }

    public static CommandSet echoRequest(int messageId, String sopClassUid) {
        return request(CommandField.C_ECHO_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid);
    }

    public static CommandSet storeRequest(int messageId, String sopClassUid, String sopInstanceUid, int priority) {
        return request(CommandField.C_STORE_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.AFFECTED_SOP_INSTANCE_UID, sopInstanceUid)
            .put(CommandElement.PRIORITY, priority);
    }

    /** C-STORE issued as a C-MOVE sub-operation. */
    public static CommandSet storeRequest(
        int messageId,
        String sopClassUid,
        String sopInstanceUid,
        int priority,
        String moveOriginatorAeTitle,
        int moveOriginatorMessageId
    ) {
        return storeRequest(messageId, sopClassUid, sopInstanceUid, priority)
            .put(CommandElement.MOVE_ORIGINATOR_AE_TITLE, moveOriginatorAeTitle)
            .put(CommandElement.MOVE_ORIGINATOR_MESSAGE_ID, moveOriginatorMessageId);
    }

    public static CommandSet findRequest(int messageId, String sopClassUid, int priority) {
        return request(CommandField.C_FIND_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.PRIORITY, priority);
    }

    public static CommandSet getRequest(int messageId, String sopClassUid, int priority) {
        return request(CommandField.C_GET_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.PRIORITY, priority);
    }

    public static CommandSet moveRequest(int messageId, String sopClassUid, int priority, String moveDestination) {
        return request(CommandField.C_MOVE_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.PRIORITY, priority)
            .put(CommandElement.MOVE_DESTINATION, moveDestination);
    }

    public static CommandSet cancelRequest(int messageIdBeingRespondedTo) {
        return new CommandSet(CommandField.C_CANCEL_RQ)
            .put(CommandElement.MESSAGE_ID_BEING_RESPONDED_TO, messageIdBeingRespondedTo);
    }

    public static CommandSet nEventReportRequest(int messageId, String sopClassUid, String sopInstanceUid, int eventTypeId) {
        return request(CommandField.N_EVENT_REPORT_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.AFFECTED_SOP_INSTANCE_UID, sopInstanceUid)
            .put(CommandElement.EVENT_TYPE_ID, eventTypeId);
    }

    public static CommandSet nGetRequest(int messageId, String sopClassUid, String sopInstanceUid, int[] attributeIdentifiers) {
        CommandSet command = request(CommandField.N_GET_RQ, messageId)
            .put(CommandElement.REQUESTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.REQUESTED_SOP_INSTANCE_UID, sopInstanceUid);
        if (attributeIdentifiers != null && attributeIdentifiers.length > 0) {
            command.put(CommandElement.ATTRIBUTE_IDENTIFIER_LIST, attributeIdentifiers.clone());
        }
        return command;
    }

    public static CommandSet nSetRequest(int messageId, String sopClassUid, String sopInstanceUid) {
        return request(CommandField.N_SET_RQ, messageId)
            .put(CommandElement.REQUESTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.REQUESTED_SOP_INSTANCE_UID, sopInstanceUid);
    }

    public static CommandSet nActionRequest(int messageId, String sopClassUid, String sopInstanceUid, int actionTypeId) {
        return request(CommandField.N_ACTION_RQ, messageId)
            .put(CommandElement.REQUESTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.REQUESTED_SOP_INSTANCE_UID, sopInstanceUid)
            .put(CommandElement.ACTION_TYPE_ID, actionTypeId);
    }

    /** N-CREATE; the instance UID may be {@code null} to let the SCP assign one. */
    public static CommandSet nCreateRequest(int messageId, String sopClassUid, String sopInstanceUid) {
        return request(CommandField.N_CREATE_RQ, messageId)
            .put(CommandElement.AFFECTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.AFFECTED_SOP_INSTANCE_UID, sopInstanceUid);
    }

    public static CommandSet nDeleteRequest(int messageId, String sopClassUid, String sopInstanceUid) {
        return request(CommandField.N_DELETE_RQ, messageId)
            .put(CommandElement.REQUESTED_SOP_CLASS_UID, sopClassUid)
            .put(CommandElement.REQUESTED_SOP_INSTANCE_UID, sopInstanceUid);
    }

    /**
     * Response to the given request: echoes the message id, the SOP class and, where the operation carries one,
     * the SOP instance as affected values.
     */
    public static CommandSet response(CommandSet request, int status) {
        CommandField field = request.commandField();
        CommandSet response = new CommandSet(field.response())
            .put(CommandElement.MESSAGE_ID_BEING_RESPONDED_TO, request.messageId())
            .put(CommandElement.STATUS, status);
        request.sopClassUid().ifPresent(uid -> response.put(CommandElement.AFFECTED_SOP_CLASS_UID, uid));
        switch (field) {
            case C_STORE_RQ, N_EVENT_REPORT_RQ, N_GET_RQ, N_SET_RQ, N_ACTION_RQ, N_CREATE_RQ, N_DELETE_RQ ->
                request.sopInstanceUid().ifPresent(uid -> response.put(CommandElement.AFFECTED_SOP_INSTANCE_UID, uid));
            default -> {
            }
        }
        if (field == CommandField.N_EVENT_REPORT_RQ) {
            response.put(CommandElement.EVENT_TYPE_ID, request.getInt(CommandElement.EVENT_TYPE_ID));
        }
        if (field == CommandField.N_ACTION_RQ) {
            response.put(CommandElement.ACTION_TYPE_ID, request.getInt(CommandElement.ACTION_TYPE_ID));
        }
        return response;
    }

    /** C-GET or C-MOVE response with sub-operation counters. */
    public static CommandSet retrieveResponse(CommandSet request, int status, SubOperationCounts counts) {
        CommandSet response = response(request, status);
        StatusCategory category = StatusCategory.of(status);
        if (category == StatusCategory.PENDING || category == StatusCategory.CANCEL) {
            response.put(CommandElement.NUMBER_OF_REMAINING_SUBOPERATIONS, counts.remaining());
        }
        return response
            .put(CommandElement.NUMBER_OF_COMPLETED_SUBOPERATIONS, counts.completed())
            .put(CommandElement.NUMBER_OF_FAILED_SUBOPERATIONS, counts.failed())
            .put(CommandElement.NUMBER_OF_WARNING_SUBOPERATIONS, counts.warning());
    }

    private static CommandSet request(CommandField field, int messageId) {
        return new CommandSet(field).put(CommandElement.MESSAGE_ID, messageId);
    }
}
