package it.netdicom.event;

import java.util.Iterator;
import java.util.List;

import it.netdicom.acse.IdentityVerdict;
import it.netdicom.dimse.DimseResult;
import it.netdicom.pdu.UserInformation.AsyncOperationsWindow;
import it.netdicom.pdu.UserInformation.SopClassCommonExtended;
import it.netdicom.pdu.UserInformation.SopClassExtended;
import it.netdicom.pdu.UserInformation.UserIdentity;

/** Handler contracts bound through {@link HandlerType}. */
public final class Handlers {

    private Handlers() {
    }

    /** C-ECHO, C-STORE: returns the response status. */
    @FunctionalInterface
    public interface StatusHandler {
        int handle(Event event) throws Exception;
    }

    /** C-FIND: one result per response, pending first, final status last. */
    @FunctionalInterface
    public interface FindHandler {
        Iterator<DimseResult> handle(Event event) throws Exception;
    }

    /** C-GET, C-MOVE. */
    @FunctionalInterface
    public interface RetrieveHandler {
        RetrieveResponse handle(Event event) throws Exception;
    }

    /** N-EVENT-REPORT, N-GET, N-SET, N-ACTION, N-CREATE, N-DELETE. */
    @FunctionalInterface
    public interface NormalizedHandler {
        DimseResult handle(Event event) throws Exception;
    }

    @FunctionalInterface
    public interface UserIdentityHandler {
        IdentityVerdict verify(UserIdentity identity);
    }

    @FunctionalInterface
    public interface AsyncOperationsHandler {
        AsyncOperationsWindow reply(AsyncOperationsWindow requested);
    }

    @FunctionalInterface
    public interface SopClassExtendedHandler {
        List<SopClassExtended> reply(List<SopClassExtended> requested);
    }

    @FunctionalInterface
    public interface SopClassCommonExtendedHandler {
        List<SopClassCommonExtended> accept(List<SopClassCommonExtended> requested);
    }
}
