package it.netdicom.service;

import it.netdicom.dimse.CommandElement;
import it.netdicom.dimse.CommandSet;
import it.netdicom.dimse.DimseCommands;
import it.netdicom.dimse.DimseResult;
import it.netdicom.event.Event;

final class ServiceResponses {

    private static final int MAX_ERROR_COMMENT = 64;

    private ServiceResponses() {
    }

    static void respond(Event event, int status) {
        respond(event, DimseCommands.response(event.command(), status), null);
    }

    static void respond(Event event, DimseResult result) {
        CommandSet response = DimseCommands.response(event.command(), result.status());
        result.errorComment().ifPresent(comment -> response.put(CommandElement.ERROR_COMMENT, truncate(comment)));
        respond(event, response, result.dataSet());
    }

    static void failure(Event event, int status, String comment) {
        respond(event, DimseResult.failure(status, comment));
    }

    static void respond(Event event, CommandSet response, byte[] dataSet) {
        event.association().sendResponse(event, response, dataSet);
    }

    static String truncate(String comment) {
        String ascii = comment.replaceAll("[^\\x20-\\x7E]", "?");
        return ascii.length() > MAX_ERROR_COMMENT ? ascii.substring(0, MAX_ERROR_COMMENT) : ascii;
    }
}
